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
 * Read and write actions of a manager whose objects are persisted from this
 * library.
 *
 * Mutating actions either raise the failure (the default) or report it as a
 * {@code false} status when {@code raiseException} is false.
 *
 * @param <T> The managed object type.
 * @param <K> The identifier type.
 * @author CS Systemes d'Information
 */
public interface ObjectManager<T, K> extends ReadableManager<T, K> {

    /**
     * Persist an object, raising on failure.
     *
     * @param object The object.
     * @return Always true.
     */
    default boolean save(final T object) {
        return save(object, true);
    }

    /**
     * Persist an object.
     *
     * @param object The object.
     * @param raiseException Whether a failure is raised or reported as false.
     * @return The status of the action.
     */
    boolean save(T object, boolean raiseException);

    /**
     * Delete an object, raising on failure.
     *
     * @param identifier The identifier.
     * @return Always true.
     */
    default boolean delete(final K identifier) {
        return delete(identifier, true);
    }

    /**
     * Delete an object.
     *
     * @param identifier The identifier.
     * @param raiseException Whether a failure is raised or reported as false.
     * @return The status of the action.
     */
    boolean delete(K identifier, boolean raiseException);
}
