/*
 * Copyright 2019 CS Systemes d'Information
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package fr.cs.ikats.api.objects;

import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import fr.cs.ikats.api.manager.TableManager;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Named two dimensional table: ordered column headers with an optional type
 * each, optional row headers and ordered rows of cells.
 *
 * Structural changes go through the {@link TableManager}, which checks row
 * lengths and cell types.
 *
 * @author CS Systemes d'Information
 */
public final class Table {

    /**
     * Public constructor.
     *
     * @param manager The owning manager.
     * @param name The unique name; not empty and without whitespace.
     */
    public Table(final TableManager manager, final String name) {
        _manager = Preconditions.checkNotNull(manager, "manager must not be null");
        _name = Identifiers.checkTableName(name);
    }

    public String getName() {
        return _name;
    }

    public String getTitle() {
        return _title;
    }

    public void setTitle(final String title) {
        _title = Preconditions.checkNotNull(title, "title must not be null");
    }

    public String getDescription() {
        return _description;
    }

    public void setDescription(final String description) {
        _description = Preconditions.checkNotNull(description, "description must not be null");
    }

    public ImmutableList<String> getColumnHeaders() {
        return _columnHeaders;
    }

    public ImmutableList<Optional<ColumnType>> getColumnTypes() {
        return _columnTypes;
    }

    /**
     * Header of the row header column, present when rows have headers.
     *
     * @return The title.
     */
    public Optional<String> getRowHeaderTitle() {
        return Optional.ofNullable(_rowHeaderTitle);
    }

    public Optional<ImmutableList<String>> getRowHeaders() {
        return Optional.ofNullable(_rowHeaders);
    }

    /**
     * Rows of cells. Cells may be null.
     *
     * @return Unmodifiable rows.
     */
    public List<List<Object>> getRows() {
        return _rows;
    }

    public int getColumnCount() {
        return _columnHeaders.size();
    }

    public int getRowCount() {
        return _rows.size();
    }

    /**
     * Replace the whole structure at once. The caller is responsible for its
     * consistency; use the structural operations for checked changes.
     *
     * @param columnHeaders The column headers.
     * @param columnTypes The column types, one per column.
     * @param rowHeaderTitle The header of the row header column; null without row headers.
     * @param rowHeaders The row headers, one per row; null without row headers.
     * @param rows The rows.
     */
    public void setStructure(
            final List<String> columnHeaders,
            final List<Optional<ColumnType>> columnTypes,
            @Nullable final String rowHeaderTitle,
            @Nullable final List<String> rowHeaders,
            final List<? extends List<?>> rows) {
        _columnHeaders = ImmutableList.copyOf(columnHeaders);
        _columnTypes = ImmutableList.copyOf(columnTypes);
        _rowHeaderTitle = rowHeaderTitle;
        _rowHeaders = rowHeaders == null ? null : ImmutableList.copyOf(rowHeaders);
        final List<List<Object>> copy = new ArrayList<>(rows.size());
        for (final List<?> row : rows) {
            copy.add(Collections.unmodifiableList(new ArrayList<Object>(row)));
        }
        _rows = Collections.unmodifiableList(copy);
    }

    /**
     * Append a column.
     *
     * @param header The header.
     * @param type The type; null for an untyped column.
     * @param values One value per row.
     * @return This instance.
     */
    public Table addColumn(final String header, @Nullable final ColumnType type, final List<?> values) {
        _manager.addColumn(this, header, type, values);
        return this;
    }

    /**
     * Read a column, including the row header column.
     *
     * @param header The header.
     * @return The values.
     */
    public List<Object> getColumn(final String header) {
        return _manager.getColumn(this, header);
    }

    /**
     * Append a row to a table without row headers.
     *
     * @param values One value per column.
     * @return This instance.
     */
    public Table addRow(final List<?> values) {
        _manager.addRow(this, null, values);
        return this;
    }

    /**
     * Append a row with its header.
     *
     * @param rowHeader The row header.
     * @param values One value per column.
     * @return This instance.
     */
    public Table addRow(final String rowHeader, final List<?> values) {
        _manager.addRow(this, rowHeader, values);
        return this;
    }

    public List<Object> getRow(final int index) {
        return _manager.getRow(this, index);
    }

    public List<Object> getRow(final String rowHeader) {
        return _manager.getRow(this, rowHeader);
    }

    /**
     * Index some columns by the values of a key column.
     *
     * @param keyColumn The key column, possibly the row header column.
     * @param items The columns to extract.
     * @return For each key, the extracted values by column.
     */
    public Map<Object, Map<String, Object>> extract(final String keyColumn, final List<String> items) {
        return _manager.extract(this, keyColumn, items);
    }

    /**
     * Persist the table, raising on failure.
     *
     * @return Always true.
     */
    public boolean save() {
        return _manager.save(this, true);
    }

    /**
     * Persist the table. Tables are created once and never updated.
     *
     * @param raiseException Whether a failure is raised or reported as false.
     * @return The status of the action.
     */
    public boolean save(final boolean raiseException) {
        return _manager.save(this, raiseException);
    }

    /**
     * Delete the table from the backend and keep the local instance,
     * raising on failure.
     *
     * @return Always true.
     */
    public boolean delete() {
        return _manager.delete(_name, true);
    }

    /**
     * Delete the table from the backend and keep the local instance.
     *
     * @param raiseException Whether a failure is raised or reported as false.
     * @return The status of the action.
     */
    public boolean delete(final boolean raiseException) {
        return _manager.delete(_name, raiseException);
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("name", _name)
                .put("title", _title)
                .put("columns", _columnHeaders)
                .put("rows", _rows.size())
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private final TableManager _manager;
    private final String _name;
    private String _title = "";
    private String _description = "";
    private ImmutableList<String> _columnHeaders = ImmutableList.of();
    private ImmutableList<Optional<ColumnType>> _columnTypes = ImmutableList.of();
    @Nullable
    private String _rowHeaderTitle;
    @Nullable
    private ImmutableList<String> _rowHeaders;
    private List<List<Object>> _rows = Collections.emptyList();
}
