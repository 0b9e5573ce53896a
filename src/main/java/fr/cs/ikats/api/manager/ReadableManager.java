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

/**
 * Read actions shared by every manager.
 *
 * @param <T> The managed object type.
 * @param <K> The identifier type.
 * @author CS Systemes d'Information
 */
public interface ReadableManager<T, K> {

    /**
     * Fetch one fully hydrated object.
     *
     * @param identifier The identifier.
     * @return The object.
     * @throws fr.cs.ikats.api.exceptions.NotFoundException if absent
     * @throws fr.cs.ikats.api.exceptions.BackendUnavailableException on transport failure
     */
    T get(K identifier);

    /**
     * List every persisted object. An empty backend yields an empty listing.
     *
     * @return The lazy listing.
     */
    LazyListing<T> list();
}
