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
package fr.cs.ikats.api.client;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import fr.cs.ikats.api.client.model.MetadataRecord;
import fr.cs.ikats.api.exceptions.ConflictException;
import fr.cs.ikats.api.exceptions.NotFoundException;
import fr.cs.ikats.api.objects.DataPoint;
import fr.cs.ikats.api.objects.MetadataType;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

/**
 * Tests for the {@link InMemoryDatamodelClient} class.
 *
 * @author CS Systemes d'Information
 */
public class InMemoryDatamodelClientTest {

    @Before
    public void setUp() {
        _timeseriesDb = new InMemoryTimeseriesDbClient();
        _client = new InMemoryDatamodelClient(_timeseriesDb);
    }

    @Test(expected = ConflictException.class)
    public void testFunctionalIdentifierUnique() {
        _client.importFunctionalIdentifier(_timeseriesDb.assignTsuid("fid_1"), "fid_1");
        _client.importFunctionalIdentifier(_timeseriesDb.assignTsuid("fid_1"), "fid_1");
    }

    @Test
    public void testFindFunctionalIdentifier() {
        final String tsuid = createTimeseries("fid_1");
        Assert.assertEquals(tsuid, _client.findFunctionalIdentifier("fid_1").getTsuid());
    }

    @Test(expected = NotFoundException.class)
    public void testMetadataOfUnknownTimeseries() {
        _client.createMetadata(record("T1", "unit", "kW"));
    }

    @Test
    public void testMatchTimeseries() {
        final String first = createTimeseries("fid_1");
        final String second = createTimeseries("fid_2");
        _client.createMetadata(record(first, "unit", "kW"));
        _client.createMetadata(record(second, "unit", "W"));
        _client.createMetadata(record(second, "site", "A"));

        Assert.assertEquals(
                ImmutableList.of(first),
                _client.matchTimeseries(ImmutableMap.<String, List<String>>of("unit", ImmutableList.of("kW"))));
        Assert.assertEquals(
                ImmutableList.of(second),
                _client.matchTimeseries(ImmutableMap.<String, List<String>>of(
                        "unit", ImmutableList.of("kW", "W"),
                        "site", ImmutableList.of("A"))));
    }

    @Test
    public void testDeleteTimeseriesPurges() {
        final String tsuid = createTimeseries("fid_1");
        _timeseriesDb.addPoints(tsuid, ImmutableList.of(new DataPoint(1000L, 1.0)));
        _client.createMetadata(record(tsuid, "unit", "kW"));

        _client.deleteTimeseries(tsuid);

        Assert.assertTrue(_client.lookupMetadata(ImmutableList.of(tsuid)).isEmpty());
        Assert.assertTrue(_client.listFunctionalIdentifiers().isEmpty());
        try {
            _timeseriesDb.countPoints(tsuid);
            Assert.fail("Expected exception to be thrown");
        } catch (final NotFoundException e) {
            // Expected exception
        }
    }

    @Test
    public void testDeepDeleteDataset() {
        final String kept = createTimeseries("fid_1");
        final String deleted = createTimeseries("fid_2");
        _client.createDataset("ds_1", "", ImmutableList.of(deleted, "STALE"));

        _client.deleteDataset("ds_1", true);

        Assert.assertEquals(1, _client.listFunctionalIdentifiers().size());
        Assert.assertEquals(kept, _client.listFunctionalIdentifiers().get(0).getTsuid());
        Assert.assertTrue(_client.listDatasets().isEmpty());
    }

    @Test(expected = ConflictException.class)
    public void testCreateDatasetConflict() {
        _client.createDataset("ds_1", "", ImmutableList.of("T1"));
        _client.createDataset("ds_1", "", ImmutableList.of("T2"));
    }

    @Test(expected = NotFoundException.class)
    public void testUpdateUnknownMetadata() {
        _client.updateMetadata(record(createTimeseries("fid_1"), "unit", "kW"));
    }

    private String createTimeseries(final String fid) {
        final String tsuid = _timeseriesDb.assignTsuid(fid);
        _client.importFunctionalIdentifier(tsuid, fid);
        return tsuid;
    }

    private static MetadataRecord record(final String tsuid, final String name, final String value) {
        return new MetadataRecord.Builder()
                .setTsuid(tsuid)
                .setName(name)
                .setValue(value)
                .setDtype(MetadataType.STRING)
                .build();
    }

    private InMemoryTimeseriesDbClient _timeseriesDb;
    private InMemoryDatamodelClient _client;
}
