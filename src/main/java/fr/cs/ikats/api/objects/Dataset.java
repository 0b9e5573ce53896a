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

import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import fr.cs.ikats.api.exceptions.ValidationException;
import fr.cs.ikats.api.manager.DatasetManager;
import fr.cs.ikats.api.manager.LazyListing;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Named and ordered set of timeseries references. A dataset references its
 * timeseries by tsuid and does not own their data.
 *
 * @author CS Systemes d'Information
 */
public final class Dataset {

    /**
     * Public constructor.
     *
     * @param manager The owning manager.
     * @param name The unique name; not empty and without whitespace.
     * @param description The description.
     * @param tsuids The members; duplicates are dropped, order is kept.
     */
    public Dataset(
            final DatasetManager manager,
            final String name,
            final String description,
            final Collection<String> tsuids) {
        _manager = Preconditions.checkNotNull(manager, "manager must not be null");
        _name = Identifiers.checkDatasetName(name);
        _description = Preconditions.checkNotNull(description, "description must not be null");
        tsuids.forEach(this::addTimeseries);
    }

    public String getName() {
        return _name;
    }

    public String getDescription() {
        return _description;
    }

    public void setDescription(final String description) {
        _description = Preconditions.checkNotNull(description, "description must not be null");
    }

    public ImmutableList<String> getTimeseriesIds() {
        return ImmutableList.copyOf(_tsuids);
    }

    /**
     * Reference a timeseries. Adding a member twice has no effect.
     *
     * @param tsuid The timeseries.
     * @return This instance.
     */
    public Dataset addTimeseries(final String tsuid) {
        Preconditions.checkNotNull(tsuid, "tsuid must not be null");
        if (tsuid.isEmpty()) {
            throw new ValidationException(String.format("Empty tsuid; dataset=%s", _name));
        }
        _tsuids.add(tsuid);
        return this;
    }

    /**
     * Reference a persisted timeseries.
     *
     * @param timeseries The timeseries.
     * @return This instance.
     */
    public Dataset addTimeseries(final Timeseries timeseries) {
        return addTimeseries(timeseries.getTsuid().orElseThrow(() -> new ValidationException(String.format(
                "Timeseries must be saved before joining a dataset; dataset=%s, fid=%s",
                _name,
                timeseries.getFid().orElse(null)))));
    }

    /**
     * Drop a reference.
     *
     * @param tsuid The timeseries.
     * @return True if and only if the timeseries was referenced.
     */
    public boolean removeTimeseries(final String tsuid) {
        return _tsuids.remove(tsuid);
    }

    /**
     * Persist the dataset, raising on failure.
     *
     * @return Always true.
     */
    public boolean save() {
        return _manager.save(this, true);
    }

    /**
     * Persist the dataset.
     *
     * @param raiseException Whether a failure is raised or reported as false.
     * @return The status of the action.
     */
    public boolean save(final boolean raiseException) {
        return _manager.save(this, raiseException);
    }

    /**
     * Delete the dataset and keep its timeseries, raising on failure.
     *
     * @return Always true.
     */
    public boolean delete() {
        return _manager.delete(_name, false, true);
    }

    /**
     * Delete the dataset.
     *
     * @param deep Whether to delete the member timeseries as well.
     * @param raiseException Whether a failure is raised or reported as false.
     * @return The status of the action.
     */
    public boolean delete(final boolean deep, final boolean raiseException) {
        return _manager.delete(_name, deep, raiseException);
    }

    /**
     * Hydrate the member timeseries.
     *
     * @return The lazy listing of the members.
     */
    public LazyListing<Timeseries> fetchTimeseries() {
        return _manager.fetchTimeseries(this);
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final Dataset other = (Dataset) object;

        return Objects.equal(_name, other._name)
                && Objects.equal(_description, other._description)
                && Objects.equal(getTimeseriesIds(), other.getTimeseriesIds());
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_name, _description, getTimeseriesIds());
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("name", _name)
                .put("description", _description)
                .put("tsuids", _tsuids)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private final DatasetManager _manager;
    private final String _name;
    private String _description;
    private final Set<String> _tsuids = new LinkedHashSet<>();
}
