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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import fr.cs.ikats.api.exceptions.ValidationException;
import fr.cs.ikats.api.manager.TimeseriesManager;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Timeseries identified by its tsuid, named by its functional identifier and
 * owning exactly one {@link Metadata} bag.
 *
 * The tsuid is assigned by the backend on the first save and never changes
 * afterwards. Points held here are local until saved.
 *
 * @author CS Systemes d'Information
 */
public final class Timeseries {

    /**
     * Public constructor.
     *
     * @param manager The owning manager.
     * @param tsuid The tsuid; null for a timeseries that is not persisted yet.
     * @param fid The functional identifier; null when unknown.
     * @param metadata The metadata bag, bound to the same tsuid. A bag
     * belongs to at most one timeseries.
     * @throws ValidationException if the bag belongs to another timeseries
     */
    public Timeseries(
            final TimeseriesManager manager,
            @Nullable final String tsuid,
            @Nullable final String fid,
            final Metadata metadata) {
        _manager = Preconditions.checkNotNull(manager, "manager must not be null");
        _metadata = Preconditions.checkNotNull(metadata, "metadata must not be null");
        if (fid != null) {
            Identifiers.checkFid(fid);
        }
        _metadata.checkAttachable(this);
        if (tsuid != null) {
            _metadata.setTsuid(tsuid);
        } else if (_metadata.getTsuid().isPresent()) {
            throw new ValidationException("Metadata of a timeseries without tsuid must not be bound");
        }
        _tsuid = tsuid;
        _fid = fid;
        _metadata.attach(this);
    }

    public Optional<String> getTsuid() {
        return Optional.ofNullable(_tsuid);
    }

    /**
     * Assign the tsuid. Once assigned it cannot change.
     *
     * @param tsuid The tsuid.
     */
    public void setTsuid(final String tsuid) {
        Preconditions.checkNotNull(tsuid, "tsuid must not be null");
        if (_tsuid != null && !_tsuid.equals(tsuid)) {
            throw new ValidationException(String.format("Tsuid already assigned; tsuid=%s, requested=%s", _tsuid, tsuid));
        }
        _metadata.setTsuid(tsuid);
        _tsuid = tsuid;
    }

    public Optional<String> getFid() {
        return Optional.ofNullable(_fid);
    }

    /**
     * Name the timeseries. Only allowed until the timeseries is persisted.
     *
     * @param fid The functional identifier.
     */
    public void setFid(final String fid) {
        Identifiers.checkFid(fid);
        if (_tsuid != null && !fid.equals(_fid)) {
            throw new ValidationException(String.format(
                    "Cannot rename a persisted timeseries; tsuid=%s, fid=%s, requested=%s",
                    _tsuid,
                    _fid,
                    fid));
        }
        _fid = fid;
    }

    public Metadata getMetadata() {
        return _metadata;
    }

    public ImmutableList<DataPoint> getPoints() {
        return _points;
    }

    /**
     * Replace the local points. They are kept sorted by timestamp.
     *
     * @param points The points.
     */
    public void setPoints(final List<DataPoint> points) {
        _points = points.stream()
                .sorted(Comparator.comparingLong(DataPoint::getTimestamp))
                .collect(ImmutableList.toImmutableList());
    }

    /**
     * Persist the timeseries with generated metadata, raising on failure.
     *
     * @return Always true.
     */
    public boolean save() {
        return _manager.save(this, true);
    }

    /**
     * Persist the timeseries with generated metadata.
     *
     * @param raiseException Whether a failure is raised or reported as false.
     * @return The status of the action.
     */
    public boolean save(final boolean raiseException) {
        return _manager.save(this, raiseException);
    }

    /**
     * Persist the timeseries.
     *
     * @param parent Timeseries to inherit metadata from; null for none.
     * @param generateMetadata Whether to regenerate the range and count metadata.
     * @param raiseException Whether a failure is raised or reported as false.
     * @return The status of the action.
     */
    public boolean save(@Nullable final Timeseries parent, final boolean generateMetadata, final boolean raiseException) {
        return _manager.save(this, parent, generateMetadata, raiseException);
    }

    /**
     * Delete the timeseries with its metadata and points, raising on failure.
     *
     * @return Always true.
     */
    public boolean delete() {
        return _manager.delete(this, true);
    }

    /**
     * Delete the timeseries with its metadata and points.
     *
     * @param raiseException Whether a failure is raised or reported as false.
     * @return The status of the action.
     */
    public boolean delete(final boolean raiseException) {
        return _manager.delete(this, raiseException);
    }

    /**
     * Load the points of the whole range recorded in the metadata.
     *
     * @return The points, also kept locally.
     */
    public ImmutableList<DataPoint> fetchPoints() {
        return _manager.fetchPoints(this);
    }

    /**
     * Load the points of a range.
     *
     * @param start First timestamp, inclusive, in milliseconds since epoch.
     * @param end Last timestamp, inclusive, in milliseconds since epoch.
     * @return The points, also kept locally.
     */
    public ImmutableList<DataPoint> fetchPoints(final long start, final long end) {
        return _manager.fetchPoints(this, start, end);
    }

    /**
     * Copy the inheritable metadata of a parent timeseries.
     *
     * @param parent The parent.
     */
    public void inherit(final Timeseries parent) {
        _manager.inherit(this, parent);
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("tsuid", _tsuid)
                .put("fid", _fid)
                .put("points", _points.size())
                .put("metadata", _metadata)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private final TimeseriesManager _manager;
    private final Metadata _metadata;
    @Nullable
    private String _tsuid;
    @Nullable
    private String _fid;
    private ImmutableList<DataPoint> _points = ImmutableList.of();
}
