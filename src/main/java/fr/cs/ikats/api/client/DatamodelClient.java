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

import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.cs.ikats.api.client.model.DatasetRecord;
import fr.cs.ikats.api.client.model.FunctionalIdentifier;
import fr.cs.ikats.api.client.model.MetadataRecord;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Contract of the datamodel service, the system of record for datasets,
 * timeseries references, metadata and tables.
 *
 * Every operation fails with a subclass of
 * {@link fr.cs.ikats.api.exceptions.IkatsException}.
 *
 * @author CS Systemes d'Information
 */
public interface DatamodelClient {

    /**
     * Create a dataset.
     *
     * @param name The unique name.
     * @param description The description.
     * @param tsuids The members.
     * @throws fr.cs.ikats.api.exceptions.ConflictException if the name is taken
     */
    void createDataset(String name, String description, List<String> tsuids);

    /**
     * Read a dataset with its members.
     *
     * @param name The name.
     * @return The dataset.
     * @throws fr.cs.ikats.api.exceptions.NotFoundException if unknown
     */
    DatasetRecord readDataset(String name);

    /**
     * Replace the description and the members of a dataset.
     *
     * @param name The name.
     * @param description The description.
     * @param tsuids The members.
     */
    void updateDataset(String name, String description, List<String> tsuids);

    /**
     * Delete a dataset.
     *
     * @param name The name.
     * @param deep Whether to delete the member timeseries as well.
     */
    void deleteDataset(String name, boolean deep);

    /**
     * List the datasets without their members.
     *
     * @return The datasets.
     */
    List<DatasetRecord> listDatasets();

    /**
     * Record the functional identifier of a timeseries.
     *
     * @param tsuid The timeseries.
     * @param fid The functional identifier.
     */
    void importFunctionalIdentifier(String tsuid, String fid);

    /**
     * Read the functional identifier record of a timeseries.
     *
     * @param tsuid The timeseries.
     * @return The record.
     * @throws fr.cs.ikats.api.exceptions.NotFoundException if unknown
     */
    FunctionalIdentifier readFunctionalIdentifier(String tsuid);

    /**
     * Find the timeseries holding a functional identifier.
     *
     * @param fid The functional identifier.
     * @return The record.
     * @throws fr.cs.ikats.api.exceptions.NotFoundException if unknown
     */
    FunctionalIdentifier findFunctionalIdentifier(String fid);

    /**
     * List every timeseries reference.
     *
     * @return The records.
     */
    List<FunctionalIdentifier> listFunctionalIdentifiers();

    /**
     * Find the timeseries whose metadata match a constraint. Each key must
     * match one of the listed values.
     *
     * @param constraint The constraint.
     * @return The matching tsuids.
     */
    List<String> matchTimeseries(Map<String, List<String>> constraint);

    /**
     * Delete a timeseries with its functional identifier, its metadata and its points.
     *
     * @param tsuid The timeseries.
     */
    void deleteTimeseries(String tsuid);

    /**
     * Create a metadata entry.
     *
     * @param record The entry.
     * @throws fr.cs.ikats.api.exceptions.ConflictException if the key exists
     */
    void createMetadata(MetadataRecord record);

    /**
     * Update a metadata entry.
     *
     * @param record The entry.
     * @throws fr.cs.ikats.api.exceptions.NotFoundException if the key is unknown
     */
    void updateMetadata(MetadataRecord record);

    /**
     * Delete a metadata entry.
     *
     * @param tsuid The timeseries.
     * @param name The key.
     */
    void deleteMetadata(String tsuid, String name);

    /**
     * Read the metadata of several timeseries.
     *
     * @param tsuids The timeseries.
     * @return Every entry of every timeseries; unknown timeseries contribute nothing.
     */
    List<MetadataRecord> lookupMetadata(Collection<String> tsuids);

    /**
     * Create a table.
     *
     * @param table The table in its exchange format.
     * @throws fr.cs.ikats.api.exceptions.ConflictException if the name is taken
     */
    void createTable(ObjectNode table);

    /**
     * Read a table.
     *
     * @param name The name.
     * @return The table in its exchange format.
     * @throws fr.cs.ikats.api.exceptions.NotFoundException if unknown
     */
    ObjectNode readTable(String name);

    /**
     * List table names. A pattern may contain {@code *} to match any characters
     * unless strict matching is requested.
     *
     * @param pattern The name pattern; null to list all.
     * @param strict Whether the pattern is matched literally.
     * @return The names.
     */
    List<String> listTables(@Nullable String pattern, boolean strict);

    /**
     * Delete a table.
     *
     * @param name The name.
     */
    void deleteTable(String name);
}
