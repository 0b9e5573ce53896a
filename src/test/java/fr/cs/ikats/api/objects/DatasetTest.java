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

import com.google.common.collect.ImmutableList;
import fr.cs.ikats.api.client.DatamodelClient;
import fr.cs.ikats.api.client.TimeseriesDbClient;
import fr.cs.ikats.api.exceptions.ValidationException;
import fr.cs.ikats.api.manager.DatasetManager;
import fr.cs.ikats.api.manager.MetadataManager;
import fr.cs.ikats.api.manager.TimeseriesManager;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mockito;

/**
 * Tests for the {@link Dataset} class.
 *
 * @author CS Systemes d'Information
 */
public class DatasetTest {

    @Before
    public void setUp() {
        final DatamodelClient datamodel = Mockito.mock(DatamodelClient.class);
        _metadataManager = new MetadataManager(datamodel);
        _timeseriesManager = new TimeseriesManager(datamodel, Mockito.mock(TimeseriesDbClient.class), _metadataManager);
        _datasetManager = new DatasetManager(datamodel, _timeseriesManager);
    }

    @Test
    public void testMembersOrderedWithoutDuplicates() {
        final Dataset dataset = new Dataset(_datasetManager, "D1", "", ImmutableList.of("T2", "T1", "T2"));
        dataset.addTimeseries("T3").addTimeseries("T1");
        Assert.assertEquals(ImmutableList.of("T2", "T1", "T3"), dataset.getTimeseriesIds());
        Assert.assertTrue(dataset.removeTimeseries("T1"));
        Assert.assertFalse(dataset.removeTimeseries("T1"));
        Assert.assertEquals(ImmutableList.of("T2", "T3"), dataset.getTimeseriesIds());
    }

    @Test(expected = ValidationException.class)
    public void testNameWithSpace() {
        new Dataset(_datasetManager, "my dataset", "", ImmutableList.of());
    }

    @Test(expected = ValidationException.class)
    public void testEmptyName() {
        new Dataset(_datasetManager, "", "", ImmutableList.of());
    }

    @Test(expected = ValidationException.class)
    public void testAddUnsavedTimeseries() {
        final Dataset dataset = new Dataset(_datasetManager, "D1", "", ImmutableList.of());
        dataset.addTimeseries(new Timeseries(_timeseriesManager, null, "my_fid", _metadataManager.newMetadata(null)));
    }

    @Test
    public void testEquality() {
        final Dataset first = new Dataset(_datasetManager, "D1", "desc", ImmutableList.of("T1"));
        final Dataset second = new Dataset(_datasetManager, "D1", "desc", ImmutableList.of("T1"));
        Assert.assertEquals(first, second);
        Assert.assertEquals(first.hashCode(), second.hashCode());
        second.setDescription("other");
        Assert.assertNotEquals(first, second);
    }

    private MetadataManager _metadataManager;
    private TimeseriesManager _timeseriesManager;
    private DatasetManager _datasetManager;
}
