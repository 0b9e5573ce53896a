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

import com.google.common.collect.ImmutableList;
import fr.cs.ikats.api.client.InMemoryCatalogClient;
import fr.cs.ikats.api.client.model.OperatorParameterRecord;
import fr.cs.ikats.api.client.model.OperatorRecord;
import fr.cs.ikats.api.exceptions.NotFoundException;
import fr.cs.ikats.api.objects.Operator;
import fr.cs.ikats.api.objects.OperatorParameter;
import fr.cs.ikats.api.test.TestBeanFactory;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests for the {@link OperatorManager} class.
 *
 * @author CS Systemes d'Information
 */
public class OperatorManagerTest {

    @Before
    public void setUp() {
        _catalog = new InMemoryCatalogClient();
        _manager = new OperatorManager(_catalog);
    }

    @Test
    public void testGet() {
        final OperatorRecord record = TestBeanFactory.createOperatorRecord();
        _catalog.register(record);
        final Operator operator = _manager.get(record.getName());
        Assert.assertEquals(record.getName(), operator.getName());
        Assert.assertEquals(record.getId(), operator.getId());
        Assert.assertEquals(record.getLabel().get(), operator.getLabel());
        Assert.assertEquals(record.getDescription().get(), operator.getDescription());
        Assert.assertEquals(record.getFamily().get(), operator.getFamily());
        Assert.assertEquals(1, operator.getInputs().size());
        Assert.assertEquals(1, operator.getOutputs().size());

        final OperatorParameterRecord parameterRecord = record.getParameters().get(0);
        final OperatorParameter parameter = operator.getParameters().get(0);
        Assert.assertEquals(parameterRecord.getName(), parameter.getName());
        Assert.assertEquals(parameterRecord.getType().get(), parameter.getType());
        Assert.assertEquals(parameterRecord.getOrder(), parameter.getOrder());
        Assert.assertEquals(parameterRecord.getDefaultValue(), parameter.getDefaultValue());
    }

    @Test
    public void testGetAppliesDefaults() {
        _catalog.register(new OperatorRecord.Builder()
                .setName("cut_ds")
                .setParameters(ImmutableList.of(new OperatorParameterRecord.Builder().setName("start").build()))
                .build());
        final Operator operator = _manager.get("cut_ds");
        Assert.assertEquals("cut_ds", operator.getLabel());
        Assert.assertEquals("", operator.getDescription());
        Assert.assertEquals("", operator.getFamily());
        Assert.assertFalse(operator.getId().isPresent());

        final OperatorParameter parameter = operator.getParameters().get(0);
        Assert.assertEquals("start", parameter.getLabel());
        Assert.assertEquals("", parameter.getType());
        Assert.assertFalse(parameter.getDefaultValue().isPresent());
    }

    @Test(expected = NotFoundException.class)
    public void testGetUnknown() {
        _manager.get("cut_ds");
    }

    @Test
    public void testList() {
        Assert.assertTrue(_manager.list().toList().isEmpty());
        final OperatorRecord first = TestBeanFactory.createOperatorRecordBuilder().setFamily("Preprocessing").build();
        final OperatorRecord second = TestBeanFactory.createOperatorRecord();
        _catalog.register(first);
        _catalog.register(second);
        Assert.assertEquals(2, _manager.list().toList().size());
        Assert.assertEquals(1, _manager.list("Preprocessing").toList().size());
        Assert.assertEquals(first.getName(), _manager.list("Preprocessing").iterator().next().getName());
    }

    private InMemoryCatalogClient _catalog;
    private OperatorManager _manager;
}
