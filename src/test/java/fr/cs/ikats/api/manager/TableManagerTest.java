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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import fr.cs.ikats.api.client.InMemoryDatamodelClient;
import fr.cs.ikats.api.client.InMemoryTimeseriesDbClient;
import fr.cs.ikats.api.exceptions.ConflictException;
import fr.cs.ikats.api.exceptions.NotFoundException;
import fr.cs.ikats.api.exceptions.ValidationException;
import fr.cs.ikats.api.objects.ColumnType;
import fr.cs.ikats.api.objects.Table;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Tests for the {@link TableManager} class.
 *
 * @author CS Systemes d'Information
 */
public class TableManagerTest {

    @Before
    public void setUp() {
        _manager = new TableManager(new InMemoryDatamodelClient(new InMemoryTimeseriesDbClient()));
    }

    @Test
    public void testBuildByColumns() {
        final Table table = _manager.newTable("sites")
                .addColumn("site", ColumnType.STRING, ImmutableList.of("A", "B"))
                .addColumn("power", ColumnType.NUMBER, ImmutableList.of(1.5, 2))
                .addColumn("note", null, Arrays.asList("x", null));
        Assert.assertEquals(ImmutableList.of("site", "power", "note"), table.getColumnHeaders());
        Assert.assertEquals(2, table.getRowCount());
        Assert.assertEquals(Arrays.asList("B", 2, null), table.getRow(1));
        Assert.assertEquals(ImmutableList.of(1.5, 2), table.getColumn("power"));
    }

    @Test
    public void testBuildByRowsWithHeaders() {
        final Table table = _manager.newTable("sites")
                .addColumn("power", ColumnType.NUMBER, ImmutableList.of())
                .addRow("A", ImmutableList.of(1))
                .addRow("B", ImmutableList.of(2));
        Assert.assertEquals(ImmutableList.of("A", "B"), table.getRowHeaders().get());
        Assert.assertEquals(ImmutableList.of(2), table.getRow("B"));
        Assert.assertEquals(ImmutableList.of("A", "B"), table.getColumn(""));
    }

    @Test(expected = ValidationException.class)
    public void testDuplicateColumn() {
        _manager.newTable("sites")
                .addColumn("site", null, ImmutableList.of("A"))
                .addColumn("site", null, ImmutableList.of("B"));
    }

    @Test(expected = ValidationException.class)
    public void testColumnLengthMismatch() {
        _manager.newTable("sites")
                .addColumn("site", null, ImmutableList.of("A", "B"))
                .addColumn("power", null, ImmutableList.of(1));
    }

    @Test(expected = ValidationException.class)
    public void testRowLengthMismatch() {
        _manager.newTable("sites")
                .addColumn("site", null, ImmutableList.of("A"))
                .addRow(ImmutableList.of("B", 2));
    }

    @Test(expected = ValidationException.class)
    public void testCellTypeMismatch() {
        _manager.newTable("sites")
                .addColumn("power", ColumnType.NUMBER, ImmutableList.of(1))
                .addRow(ImmutableList.of("high"));
    }

    @Test(expected = ValidationException.class)
    public void testRowHeaderMissing() {
        _manager.newTable("sites")
                .addColumn("power", null, ImmutableList.of())
                .addRow("A", ImmutableList.of(1))
                .addRow(ImmutableList.of(2));
    }

    @Test(expected = ValidationException.class)
    public void testRowHeaderOnTableWithoutRowHeaders() {
        _manager.newTable("sites")
                .addColumn("power", null, ImmutableList.of(1))
                .addRow("B", ImmutableList.of(2));
    }

    @Test(expected = NotFoundException.class)
    public void testUnknownColumn() {
        _manager.newTable("sites").addColumn("site", null, ImmutableList.of("A")).getColumn("power");
    }

    @Test(expected = NotFoundException.class)
    public void testUnknownRow() {
        _manager.newTable("sites").addColumn("site", null, ImmutableList.of("A")).getRow(1);
    }

    @Test
    public void testExtract() {
        final Table table = _manager.newTable("sites")
                .addColumn("site", ColumnType.STRING, ImmutableList.of("A", "B"))
                .addColumn("power", ColumnType.NUMBER, ImmutableList.of(1, 2))
                .addColumn("active", ColumnType.BOOLEAN, ImmutableList.of(true, false));
        final Map<Object, Map<String, Object>> extracted = table.extract("site", ImmutableList.of("power", "active"));
        Assert.assertEquals(
                ImmutableMap.of(
                        "A", ImmutableMap.of("power", 1, "active", true),
                        "B", ImmutableMap.of("power", 2, "active", false)),
                extracted);
    }

    @Test(expected = ValidationException.class)
    public void testExtractDuplicateKey() {
        _manager.newTable("sites")
                .addColumn("site", null, ImmutableList.of("A", "A"))
                .addColumn("power", null, ImmutableList.of(1, 2))
                .extract("site", ImmutableList.of("power"));
    }

    @Test
    public void testSaveAndGet() {
        final Table table = _manager.newTable("sites");
        table.setTitle("Sites");
        table.setDescription("Power per site");
        table.addColumn("power", ColumnType.NUMBER, ImmutableList.of())
                .addColumn("active", null, ImmutableList.of())
                .addRow("A", Arrays.asList(1.5, true))
                .addRow("B", Arrays.asList(null, false));
        Assert.assertTrue(table.save());

        final Table fetched = _manager.get("sites");
        Assert.assertEquals("Sites", fetched.getTitle());
        Assert.assertEquals("Power per site", fetched.getDescription());
        Assert.assertEquals(ImmutableList.of("power", "active"), fetched.getColumnHeaders());
        Assert.assertEquals(ImmutableList.of(Optional.of(ColumnType.NUMBER), Optional.empty()), fetched.getColumnTypes());
        Assert.assertEquals(ImmutableList.of("A", "B"), fetched.getRowHeaders().get());
        Assert.assertEquals(Arrays.asList(1.5, true), fetched.getRow("A"));
        Assert.assertEquals(Arrays.asList(null, false), fetched.getRow("B"));
    }

    @Test
    public void testSaveConflict() {
        final Table table = _manager.newTable("sites").addColumn("site", null, ImmutableList.of("A"));
        Assert.assertTrue(table.save());
        Assert.assertFalse(table.save(false));
        try {
            table.save();
            Assert.fail("Expected exception to be thrown");
        } catch (final ConflictException e) {
            Assert.assertEquals(1, _manager.list().toList().size());
        }
    }

    @Test(expected = ConflictException.class)
    public void testNewTableConflict() {
        _manager.newTable("sites").addColumn("site", null, ImmutableList.of("A")).save();
        _manager.newTable("sites");
    }

    @Test(expected = ValidationException.class)
    public void testSaveWithoutColumn() {
        _manager.newTable("sites").save();
    }

    @Test
    public void testDelete() {
        final Table table = _manager.newTable("sites").addColumn("site", null, ImmutableList.of("A"));
        table.save();
        Assert.assertTrue(table.delete());
        Assert.assertFalse(table.delete(false));
        Assert.assertTrue(_manager.list().toList().isEmpty());
    }

    @Test
    public void testListByPattern() {
        _manager.newTable("sites_2019").addColumn("site", null, ImmutableList.of("A")).save();
        _manager.newTable("sites_2020").addColumn("site", null, ImmutableList.of("A")).save();
        _manager.newTable("other").addColumn("site", null, ImmutableList.of("A")).save();

        Assert.assertEquals(
                ImmutableList.of("sites_2019", "sites_2020"),
                _manager.list("sites_*", false).stream().map(Table::getName).sorted().collect(Collectors.toList()));
        Assert.assertEquals(
                ImmutableList.of("other"),
                _manager.list("other", true).stream().map(Table::getName).collect(Collectors.toList()));
        Assert.assertTrue(_manager.list("sites", true).toList().isEmpty());
    }

    @Test
    public void testToJson() throws IOException {
        final Table table = _manager.newTable("sites");
        table.setTitle("Sites");
        table.addColumn("power", ColumnType.NUMBER, ImmutableList.of())
                .addRow("A", ImmutableList.of(1));
        Assert.assertEquals(
                OBJECT_MAPPER.readTree("{\"table_desc\":{\"name\":\"sites\",\"title\":\"Sites\",\"desc\":\"\"},"
                        + "\"headers\":{\"col\":{\"data\":[\"\",\"power\"],\"types\":[null,\"number\"]},"
                        + "\"row\":{\"data\":[null,\"A\"]}},"
                        + "\"content\":{\"cells\":[[1]]}}"),
                _manager.toJson(table));
    }

    @Test
    public void testFromJsonWithoutColumnHeaders() throws IOException {
        final ObjectNode json = (ObjectNode) OBJECT_MAPPER.readTree(
                "{\"table_desc\":{\"name\":\"raw\"},\"content\":{\"cells\":[[\"a\",1],[\"b\",2]]}}");
        final Table table = _manager.fromJson("raw", json);
        Assert.assertEquals(ImmutableList.of("0", "1"), table.getColumnHeaders());
        Assert.assertFalse(table.getRowHeaders().isPresent());
        Assert.assertEquals(ImmutableList.of("b", 2), table.getRow(1));
        Assert.assertEquals("", table.getTitle());
    }

    @Test(expected = ValidationException.class)
    public void testFromJsonRaggedRows() throws IOException {
        final ObjectNode json = (ObjectNode) OBJECT_MAPPER.readTree(
                "{\"headers\":{\"col\":{\"data\":[\"a\",\"b\"]}},\"content\":{\"cells\":[[1,2],[3]]}}");
        _manager.fromJson("raw", json);
    }

    private TableManager _manager;

    private static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.getInstance();
}
