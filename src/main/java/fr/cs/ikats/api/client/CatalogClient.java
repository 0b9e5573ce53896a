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

import fr.cs.ikats.api.client.model.OperatorRecord;

import java.util.List;

/**
 * Contract of the operator catalog.
 *
 * @author CS Systemes d'Information
 */
public interface CatalogClient {

    /**
     * List the registered operator implementations.
     *
     * @return The operators.
     */
    List<OperatorRecord> listImplementations();

    /**
     * Read one operator implementation.
     *
     * @param name The operator name.
     * @return The operator.
     * @throws fr.cs.ikats.api.exceptions.NotFoundException if unknown
     */
    OperatorRecord readImplementation(String name);
}
