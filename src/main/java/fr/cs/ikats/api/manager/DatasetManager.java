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
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import fr.cs.ikats.api.client.DatamodelClient;
import fr.cs.ikats.api.client.model.DatasetRecord;
import fr.cs.ikats.api.exceptions.ConflictException;
import fr.cs.ikats.api.exceptions.NotFoundException;
import fr.cs.ikats.api.exceptions.ValidationException;
import fr.cs.ikats.api.objects.Dataset;
import fr.cs.ikats.api.objects.Identifiers;
import fr.cs.ikats.api.objects.Timeseries;

import java.util.Collection;

/**
 * Manager of the datasets.
 *
 * A dataset references its timeseries by tsuid only. Deleting a timeseries
 * never rewrites the datasets referencing it; {@link #pruneStaleReferences}
 * does that cleanup on demand.
 *
 * @author CS Systemes d'Information
 */
public final class DatasetManager implements ObjectManager<Dataset, String> {

    /**
     * Public constructor.
     *
     * @param datamodel The datamodel client.
     * @param timeseriesManager The timeseries manager.
     */
    public DatasetManager(final DatamodelClient datamodel, final TimeseriesManager timeseriesManager) {
        _datamodel = datamodel;
        _timeseriesManager = timeseriesManager;
    }

    /**
     * Create a local dataset. Nothing is persisted until it is saved.
     *
     * @param name The name.
     * @param description The description.
     * @param tsuids The members.
     * @return The dataset.
     * @throws ConflictException if a dataset already has this name
     */
    public Dataset newDataset(final String name, final String description, final Collection<String> tsuids) {
        Identifiers.checkDatasetName(name);
        if (exists(name)) {
            throw new ConflictException(String.format("Dataset already exists; name=%s", name));
        }
        return new Dataset(this, name, description, tsuids);
    }

    @Override
    public Dataset get(final String name) {
        Preconditions.checkNotNull(name, "name must not be null");
        return toDataset(_datamodel.readDataset(name));
    }

    /**
     * List the datasets. The listing only returns names; each dataset is
     * read with its members when the iteration reaches it.
     *
     * @return The lazy listing.
     */
    @Override
    public LazyListing<Dataset> list() {
        return LazyListing.of(this::listNames, this::get);
    }

    /**
     * List the datasets whose name starts with a prefix.
     *
     * @param namePrefix The prefix.
     * @return The lazy listing.
     */
    public LazyListing<Dataset> list(final String namePrefix) {
        Preconditions.checkNotNull(namePrefix, "namePrefix must not be null");
        return LazyListing.of(
                () -> listNames()
                        .stream()
                        .filter(name -> name.startsWith(namePrefix))
                        .collect(ImmutableList.toImmutableList()),
                this::get);
    }

    /**
     * Create a dataset. A dataset is written once; saving a name already in
     * use is a conflict.
     *
     * @param dataset The dataset.
     * @param raiseException Whether a failure is raised or reported as false.
     * @return The status of the action.
     */
    @Override
    public boolean save(final Dataset dataset, final boolean raiseException) {
        Preconditions.checkNotNull(dataset, "dataset must not be null");
        return ActionResult.attempt("save dataset", dataset.getName(), () -> {
            if (dataset.getTimeseriesIds().isEmpty()) {
                throw new ValidationException(String.format("Dataset has no timeseries; name=%s", dataset.getName()));
            }
            _datamodel.createDataset(dataset.getName(), dataset.getDescription(), dataset.getTimeseriesIds());
        }).resolve(raiseException);
    }

    @Override
    public boolean delete(final String name, final boolean raiseException) {
        return delete(name, false, raiseException);
    }

    /**
     * Delete a dataset.
     *
     * @param name The name.
     * @param deep Whether the member timeseries are deleted too.
     * @param raiseException Whether a failure is raised or reported as false.
     * @return The status of the action.
     */
    public boolean delete(final String name, final boolean deep, final boolean raiseException) {
        Preconditions.checkNotNull(name, "name must not be null");
        return ActionResult.attempt("delete dataset", name, () -> _datamodel.deleteDataset(name, deep))
                .resolve(raiseException);
    }

    /**
     * List the member timeseries of a dataset. Each iteration reads the
     * members held by the dataset at that time; a stale reference fails the
     * iteration with {@link NotFoundException} when reached.
     *
     * @param dataset The dataset.
     * @return The lazy listing.
     */
    public LazyListing<Timeseries> fetchTimeseries(final Dataset dataset) {
        Preconditions.checkNotNull(dataset, "dataset must not be null");
        return _timeseriesManager.list(dataset::getTimeseriesIds);
    }

    /**
     * Remove from a persisted dataset the references to timeseries that no
     * longer exist.
     *
     * @param name The name.
     * @param raiseException Whether a failure is raised or reported as false.
     * @return The status of the action.
     */
    public boolean pruneStaleReferences(final String name, final boolean raiseException) {
        Preconditions.checkNotNull(name, "name must not be null");
        return ActionResult.attempt("prune dataset", name, () -> {
            final DatasetRecord record = _datamodel.readDataset(name);
            final ImmutableList<String> alive = record.getTsuids()
                    .stream()
                    .filter(this::isAlive)
                    .collect(ImmutableList.toImmutableList());
            if (alive.size() != record.getTsuids().size()) {
                _datamodel.updateDataset(name, record.getDescription(), alive);
                LOGGER.debug()
                        .setMessage("Stale references pruned")
                        .addData("name", name)
                        .addData("removed", record.getTsuids().size() - alive.size())
                        .log();
            }
        }).resolve(raiseException);
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("datamodel", _datamodel)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private ImmutableList<String> listNames() {
        return _datamodel.listDatasets()
                .stream()
                .map(DatasetRecord::getName)
                .collect(ImmutableList.toImmutableList());
    }

    private Dataset toDataset(final DatasetRecord record) {
        return new Dataset(this, record.getName(), record.getDescription(), record.getTsuids());
    }

    private boolean exists(final String name) {
        try {
            _datamodel.readDataset(name);
            return true;
        } catch (final NotFoundException e) {
            return false;
        }
    }

    private boolean isAlive(final String tsuid) {
        try {
            _datamodel.readFunctionalIdentifier(tsuid);
            return true;
        } catch (final NotFoundException e) {
            return false;
        }
    }

    private final DatamodelClient _datamodel;
    private final TimeseriesManager _timeseriesManager;

    private static final Logger LOGGER = LoggerFactory.getLogger(DatasetManager.class);
}
