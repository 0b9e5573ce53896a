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
import fr.cs.ikats.api.client.model.OperatorRecord;
import fr.cs.ikats.api.exceptions.NotFoundException;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link CatalogClient} serving operators registered in memory. Used when
 * the backends are emulated.
 *
 * @author CS Systemes d'Information
 */
public final class InMemoryCatalogClient implements CatalogClient {

    /**
     * Register an operator, replacing any operator of the same name.
     *
     * @param operator The operator.
     */
    public void register(final OperatorRecord operator) {
        _operators.put(operator.getName(), operator);
    }

    @Override
    public List<OperatorRecord> listImplementations() {
        return ImmutableList.copyOf(_operators.values());
    }

    @Override
    public OperatorRecord readImplementation(final String name) {
        final OperatorRecord operator = _operators.get(name);
        if (operator == null) {
            throw new NotFoundException(String.format("No implementation found; name=%s", name));
        }
        return operator;
    }

    private final Map<String, OperatorRecord> _operators = new ConcurrentHashMap<>();
}
