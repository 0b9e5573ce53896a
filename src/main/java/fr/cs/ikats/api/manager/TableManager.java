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
package fr.cs.ikats.api.manager;

import com.arpnetworking.commons.jackson.databind.ObjectMapperFactory;
import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import fr.cs.ikats.api.client.DatamodelClient;
import fr.cs.ikats.api.exceptions.ConflictException;
import fr.cs.ikats.api.exceptions.NotFoundException;
import fr.cs.ikats.api.exceptions.ValidationException;
import fr.cs.ikats.api.objects.ColumnType;
import fr.cs.ikats.api.objects.Identifiers;
import fr.cs.ikats.api.objects.Table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Manager of the tables. Owns the structural operations of a local table
 * and its conversion to and from the datamodel JSON representation.
 *
 * Tables are written once: saving a name already in use is a conflict.
 *
 * @author CS Systemes d'Information
 */
public final class TableManager implements ObjectManager<Table, String> {

    /**
     * Public constructor.
     *
     * @param datamodel The datamodel client.
     */
    public TableManager(final DatamodelClient datamodel) {
        _datamodel = datamodel;
    }

    /**
     * Create a local empty table.
     *
     * @param name The name.
     * @return The table.
     * @throws ConflictException if a table already has this name
     */
    public Table newTable(final String name) {
        Identifiers.checkTableName(name);
        try {
            _datamodel.readTable(name);
        } catch (final NotFoundException e) {
            return new Table(this, name);
        }
        throw new ConflictException(String.format("Table already exists; name=%s", name));
    }

    @Override
    public Table get(final String name) {
        Preconditions.checkNotNull(name, "name must not be null");
        return fromJson(name, _datamodel.readTable(name));
    }

    @Override
    public LazyListing<Table> list() {
        return LazyListing.of(() -> _datamodel.listTables(null, false), this::get);
    }

    /**
     * List the tables whose name matches a pattern. Unless strict, the
     * pattern may hold {@code *} wildcards; a strict pattern is an exact name.
     *
     * @param pattern The pattern.
     * @param strict Whether the whole name must match.
     * @return The lazy listing.
     */
    public LazyListing<Table> list(final String pattern, final boolean strict) {
        Preconditions.checkNotNull(pattern, "pattern must not be null");
        return LazyListing.of(() -> _datamodel.listTables(pattern, strict), this::get);
    }

    @Override
    public boolean save(final Table table, final boolean raiseException) {
        Preconditions.checkNotNull(table, "table must not be null");
        return ActionResult.attempt("save table", table.getName(), () -> {
            if (table.getColumnCount() == 0) {
                throw new ValidationException(String.format("Table has no column; name=%s", table.getName()));
            }
            _datamodel.createTable(toJson(table));
        }).resolve(raiseException);
    }

    @Override
    public boolean delete(final String name, final boolean raiseException) {
        Preconditions.checkNotNull(name, "name must not be null");
        return ActionResult.attempt("delete table", name, () -> _datamodel.deleteTable(name))
                .resolve(raiseException);
    }

    /**
     * Append a column. On a table without rows nor columns the values create
     * the rows; otherwise there must be one value per row.
     *
     * @param table The table.
     * @param header The header, unique in the table.
     * @param type The type; null for an untyped column.
     * @param values The values.
     */
    public void addColumn(final Table table, final String header, @Nullable final ColumnType type, final List<?> values) {
        Preconditions.checkNotNull(header, "header must not be null");
        Preconditions.checkNotNull(values, "values must not be null");
        if (table.getColumnHeaders().contains(header) || header.equals(table.getRowHeaderTitle().orElse(null))) {
            throw new ValidationException(String.format("Column already exists; table=%s, column=%s", table.getName(), header));
        }
        final boolean empty = table.getColumnCount() == 0 && table.getRowCount() == 0;
        if (!empty && values.size() != table.getRowCount()) {
            throw new ValidationException(String.format(
                    "Column length does not match row count; table=%s, column=%s, length=%d, rows=%d",
                    table.getName(),
                    header,
                    values.size(),
                    table.getRowCount()));
        }
        for (int row = 0; row < values.size(); ++row) {
            checkCell(table, header, type, row, values.get(row));
        }
        final List<List<Object>> rows = new ArrayList<>();
        for (int row = 0; row < values.size(); ++row) {
            final List<Object> cells = empty ? new ArrayList<>() : new ArrayList<>(table.getRows().get(row));
            cells.add(values.get(row));
            rows.add(cells);
        }
        table.setStructure(
                ImmutableList.<String>builder().addAll(table.getColumnHeaders()).add(header).build(),
                ImmutableList.<Optional<ColumnType>>builder().addAll(table.getColumnTypes()).add(Optional.ofNullable(type)).build(),
                table.getRowHeaderTitle().orElse(null),
                table.getRowHeaders().orElse(null),
                rows);
    }

    /**
     * Read a column. The row header column is read by its title.
     *
     * @param table The table.
     * @param header The header.
     * @return The values, one per row.
     */
    public List<Object> getColumn(final Table table, final String header) {
        Preconditions.checkNotNull(header, "header must not be null");
        if (table.getRowHeaderTitle().isPresent() && header.equals(table.getRowHeaderTitle().get())) {
            return Collections.unmodifiableList(new ArrayList<Object>(table.getRowHeaders().orElse(ImmutableList.of())));
        }
        final int index = table.getColumnHeaders().indexOf(header);
        if (index < 0) {
            throw new NotFoundException(String.format("Column not found; table=%s, column=%s", table.getName(), header));
        }
        final List<Object> column = new ArrayList<>(table.getRowCount());
        for (final List<Object> row : table.getRows()) {
            column.add(row.get(index));
        }
        return Collections.unmodifiableList(column);
    }

    /**
     * Append a row. Either every row has a header or none has; the first
     * row decides. Row headers created this way have an empty title.
     *
     * @param table The table.
     * @param rowHeader The row header; null for a table without row headers.
     * @param values One value per column.
     */
    public void addRow(final Table table, @Nullable final String rowHeader, final List<?> values) {
        Preconditions.checkNotNull(values, "values must not be null");
        if (table.getColumnCount() == 0) {
            throw new ValidationException(String.format("Table has no column; table=%s", table.getName()));
        }
        if (values.size() != table.getColumnCount()) {
            throw new ValidationException(String.format(
                    "Row length does not match column count; table=%s, length=%d, columns=%d",
                    table.getName(),
                    values.size(),
                    table.getColumnCount()));
        }
        final boolean withHeaders = table.getRowHeaders().isPresent();
        if (rowHeader == null && withHeaders) {
            throw new ValidationException(String.format("Row header required; table=%s", table.getName()));
        }
        if (rowHeader != null && !withHeaders && table.getRowCount() > 0) {
            throw new ValidationException(String.format("Table has no row headers; table=%s, row=%s", table.getName(), rowHeader));
        }
        if (rowHeader != null && withHeaders && table.getRowHeaders().get().contains(rowHeader)) {
            throw new ValidationException(String.format("Row already exists; table=%s, row=%s", table.getName(), rowHeader));
        }
        for (int column = 0; column < values.size(); ++column) {
            checkCell(
                    table,
                    table.getColumnHeaders().get(column),
                    table.getColumnTypes().get(column).orElse(null),
                    table.getRowCount(),
                    values.get(column));
        }
        final List<List<?>> rows = new ArrayList<>(table.getRows());
        rows.add(values);
        List<String> rowHeaders = null;
        String rowHeaderTitle = null;
        if (rowHeader != null) {
            rowHeaders = ImmutableList.<String>builder().addAll(table.getRowHeaders().orElse(ImmutableList.of())).add(rowHeader).build();
            rowHeaderTitle = table.getRowHeaderTitle().orElse("");
        }
        table.setStructure(table.getColumnHeaders(), table.getColumnTypes(), rowHeaderTitle, rowHeaders, rows);
    }

    /**
     * Read a row by position.
     *
     * @param table The table.
     * @param index The position, from 0.
     * @return The cells.
     */
    public List<Object> getRow(final Table table, final int index) {
        if (index < 0 || index >= table.getRowCount()) {
            throw new NotFoundException(String.format(
                    "Row not found; table=%s, index=%d, rows=%d",
                    table.getName(),
                    index,
                    table.getRowCount()));
        }
        return table.getRows().get(index);
    }

    /**
     * Read a row by header.
     *
     * @param table The table.
     * @param rowHeader The row header.
     * @return The cells.
     */
    public List<Object> getRow(final Table table, final String rowHeader) {
        Preconditions.checkNotNull(rowHeader, "rowHeader must not be null");
        final int index = table.getRowHeaders().map(headers -> headers.indexOf(rowHeader)).orElse(-1);
        if (index < 0) {
            throw new NotFoundException(String.format("Row not found; table=%s, row=%s", table.getName(), rowHeader));
        }
        return table.getRows().get(index);
    }

    /**
     * Index some columns by the values of a key column.
     *
     * @param table The table.
     * @param keyColumn The key column, possibly the row header column.
     * @param items The columns to extract.
     * @return For each key in row order, the extracted values by column.
     */
    public Map<Object, Map<String, Object>> extract(final Table table, final String keyColumn, final List<String> items) {
        final List<Object> keys = getColumn(table, keyColumn);
        final Map<String, List<Object>> columns = new LinkedHashMap<>();
        for (final String item : items) {
            columns.put(item, getColumn(table, item));
        }
        final Map<Object, Map<String, Object>> extracted = new LinkedHashMap<>();
        for (int row = 0; row < keys.size(); ++row) {
            final Map<String, Object> values = new LinkedHashMap<>();
            for (final Map.Entry<String, List<Object>> column : columns.entrySet()) {
                values.put(column.getKey(), column.getValue().get(row));
            }
            if (extracted.containsKey(keys.get(row))) {
                throw new ValidationException(String.format(
                        "Duplicate key; table=%s, column=%s, key=%s",
                        table.getName(),
                        keyColumn,
                        keys.get(row)));
            }
            extracted.put(keys.get(row), Collections.unmodifiableMap(values));
        }
        return Collections.unmodifiableMap(extracted);
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("datamodel", _datamodel)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    /**
     * Serialize a table to the datamodel representation.
     *
     * @param table The table.
     * @return The JSON object.
     */
    ObjectNode toJson(final Table table) {
        final ObjectNode root = OBJECT_MAPPER.createObjectNode();
        root.putObject("table_desc")
                .put("name", table.getName())
                .put("title", table.getTitle())
                .put("desc", table.getDescription());
        final boolean withRowHeaders = table.getRowHeaders().isPresent();
        final ObjectNode headers = root.putObject("headers");
        final ObjectNode columnHeaders = headers.putObject("col");
        final ArrayNode columnData = columnHeaders.putArray("data");
        if (withRowHeaders) {
            columnData.add(table.getRowHeaderTitle().orElse(""));
        }
        table.getColumnHeaders().forEach(columnData::add);
        if (table.getColumnTypes().stream().anyMatch(Optional::isPresent)) {
            final ArrayNode types = columnHeaders.putArray("types");
            if (withRowHeaders) {
                types.addNull();
            }
            for (final Optional<ColumnType> type : table.getColumnTypes()) {
                if (type.isPresent()) {
                    types.add(type.get().getWireValue());
                } else {
                    types.addNull();
                }
            }
        }
        if (withRowHeaders) {
            final ArrayNode rowData = headers.putObject("row").putArray("data");
            rowData.addNull();
            table.getRowHeaders().get().forEach(rowData::add);
        }
        final ArrayNode cells = root.putObject("content").putArray("cells");
        for (final List<Object> row : table.getRows()) {
            final ArrayNode cellRow = cells.addArray();
            for (final Object cell : row) {
                cellRow.add(OBJECT_MAPPER.<JsonNode>valueToTree(cell));
            }
        }
        return root;
    }

    /**
     * Build a table from the datamodel representation. Missing column
     * headers are replaced by the column positions.
     *
     * @param name The name.
     * @param json The JSON object.
     * @return The table.
     */
    Table fromJson(final String name, final ObjectNode json) {
        final Table table = new Table(this, name);
        final JsonNode description = json.path("table_desc");
        table.setTitle(textOrEmpty(description.path("title")));
        table.setDescription(textOrEmpty(description.path("desc")));

        final List<List<Object>> rows = new ArrayList<>();
        for (final JsonNode row : json.path("content").path("cells")) {
            final List<Object> cells = new ArrayList<>();
            for (final JsonNode cell : row) {
                cells.add(toCell(cell));
            }
            rows.add(cells);
        }

        final JsonNode rowData = json.path("headers").path("row").path("data");
        final boolean withRowHeaders = rowData.isArray();
        final int offset = withRowHeaders ? 1 : 0;
        final JsonNode columnData = json.path("headers").path("col").path("data");
        final JsonNode typeData = json.path("headers").path("col").path("types");

        final int columnCount;
        String rowHeaderTitle = null;
        final List<String> columnHeaders = new ArrayList<>();
        if (columnData.isArray()) {
            if (withRowHeaders && columnData.size() > 0) {
                rowHeaderTitle = textOrEmpty(columnData.get(0));
            }
            for (int i = offset; i < columnData.size(); ++i) {
                columnHeaders.add(textOrEmpty(columnData.get(i)));
            }
            columnCount = columnHeaders.size();
        } else {
            columnCount = rows.stream().mapToInt(List::size).max().orElse(0);
            for (int i = 0; i < columnCount; ++i) {
                columnHeaders.add(String.valueOf(i));
            }
        }
        if (withRowHeaders && rowHeaderTitle == null) {
            rowHeaderTitle = "";
        }

        final List<Optional<ColumnType>> columnTypes = new ArrayList<>();
        for (int i = 0; i < columnCount; ++i) {
            final JsonNode type = typeData.path(i + offset);
            columnTypes.add(type.isTextual() ? Optional.of(ColumnType.fromWireValue(type.asText())) : Optional.empty());
        }

        List<String> rowHeaders = null;
        if (withRowHeaders) {
            rowHeaders = new ArrayList<>();
            for (int i = 1; i < rowData.size(); ++i) {
                rowHeaders.add(textOrEmpty(rowData.get(i)));
            }
            if (rowHeaders.size() != rows.size()) {
                throw new ValidationException(String.format(
                        "Row headers do not match rows; table=%s, headers=%d, rows=%d",
                        name,
                        rowHeaders.size(),
                        rows.size()));
            }
        }
        for (final List<Object> row : rows) {
            if (row.size() != columnCount) {
                throw new ValidationException(String.format(
                        "Row length does not match column count; table=%s, length=%d, columns=%d",
                        name,
                        row.size(),
                        columnCount));
            }
        }
        table.setStructure(columnHeaders, columnTypes, rowHeaderTitle, rowHeaders, rows);
        return table;
    }

    private static void checkCell(
            final Table table,
            final String column,
            @Nullable final ColumnType type,
            final int row,
            @Nullable final Object value) {
        if (type != null && !type.accepts(value)) {
            throw new ValidationException(String.format(
                    "Cell does not match column type; table=%s, column=%s, row=%d, type=%s, value=%s",
                    table.getName(),
                    column,
                    row,
                    type,
                    value));
        }
    }

    @Nullable
    private static Object toCell(final JsonNode cell) {
        if (cell.isNull() || cell.isMissingNode()) {
            return null;
        }
        if (cell.isBoolean()) {
            return cell.booleanValue();
        }
        if (cell.isNumber()) {
            return cell.numberValue();
        }
        if (cell.isTextual()) {
            return cell.textValue();
        }
        return OBJECT_MAPPER.convertValue(cell, Object.class);
    }

    private static String textOrEmpty(final JsonNode node) {
        return node.isNull() || node.isMissingNode() ? "" : node.asText();
    }

    private final DatamodelClient _datamodel;

    private static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.getInstance();
}
