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

import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import fr.cs.ikats.api.client.CatalogClient;
import fr.cs.ikats.api.client.model.OperatorParameterRecord;
import fr.cs.ikats.api.client.model.OperatorRecord;
import fr.cs.ikats.api.objects.Operator;
import fr.cs.ikats.api.objects.OperatorParameter;

import java.util.List;

/**
 * Read only mirror of the operators registered in the catalog.
 *
 * @author CS Systemes d'Information
 */
public final class OperatorManager implements ReadableManager<Operator, String> {

    /**
     * Public constructor.
     *
     * @param catalog The catalog client.
     */
    public OperatorManager(final CatalogClient catalog) {
        _catalog = catalog;
    }

    @Override
    public Operator get(final String name) {
        Preconditions.checkNotNull(name, "name must not be null");
        return toOperator(_catalog.readImplementation(name));
    }

    @Override
    public LazyListing<Operator> list() {
        return LazyListing.of(() -> toOperators(_catalog.listImplementations()));
    }

    /**
     * List the operators of one family.
     *
     * @param family The family.
     * @return The lazy listing.
     */
    public LazyListing<Operator> list(final String family) {
        Preconditions.checkNotNull(family, "family must not be null");
        return LazyListing.of(() -> toOperators(_catalog.listImplementations())
                .stream()
                .filter(operator -> family.equals(operator.getFamily()))
                .collect(ImmutableList.toImmutableList()));
    }

    private static ImmutableList<Operator> toOperators(final List<OperatorRecord> records) {
        return records.stream()
                .map(OperatorManager::toOperator)
                .collect(ImmutableList.toImmutableList());
    }

    private static Operator toOperator(final OperatorRecord record) {
        return new Operator.Builder()
                .setName(record.getName())
                .setId(record.getId().orElse(null))
                .setLabel(record.getLabel().orElse(null))
                .setDescription(record.getDescription().orElse(null))
                .setFamily(record.getFamily().orElse(null))
                .setInputs(toParameters(record.getInputs()))
                .setParameters(toParameters(record.getParameters()))
                .setOutputs(toParameters(record.getOutputs()))
                .build();
    }

    private static ImmutableList<OperatorParameter> toParameters(final List<OperatorParameterRecord> records) {
        return records.stream()
                .map(record -> new OperatorParameter.Builder()
                        .setName(record.getName())
                        .setLabel(record.getLabel().orElse(null))
                        .setDescription(record.getDescription().orElse(null))
                        .setType(record.getType().orElse(null))
                        .setOrder(record.getOrder().orElse(null))
                        .setDefaultValue(record.getDefaultValue().orElse(null))
                        .setDomain(record.getDomain().orElse(null))
                        .build())
                .collect(ImmutableList.toImmutableList());
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("catalog", _catalog)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private final CatalogClient _catalog;
}
