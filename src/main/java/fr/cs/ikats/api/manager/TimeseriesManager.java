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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterators;
import fr.cs.ikats.api.client.DatamodelClient;
import fr.cs.ikats.api.client.TimeseriesDbClient;
import fr.cs.ikats.api.client.model.FunctionalIdentifier;
import fr.cs.ikats.api.client.model.PointsSummary;
import fr.cs.ikats.api.exceptions.ConflictException;
import fr.cs.ikats.api.exceptions.NotFoundException;
import fr.cs.ikats.api.exceptions.ValidationException;
import fr.cs.ikats.api.objects.DataPoint;
import fr.cs.ikats.api.objects.Identifiers;
import fr.cs.ikats.api.objects.Metadata;
import fr.cs.ikats.api.objects.MetadataEntry;
import fr.cs.ikats.api.objects.Timeseries;

import java.time.Instant;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * Manager of the timeseries.
 *
 * A timeseries spans two backends: its record, functional identifier and
 * metadata live in the datamodel while its points live in the time series
 * database. Fetching a timeseries always reads its metadata too; if either
 * read fails the whole fetch fails.
 *
 * @author CS Systemes d'Information
 */
public final class TimeseriesManager implements ObjectManager<Timeseries, String> {

    /**
     * Public constructor.
     *
     * @param datamodel The datamodel client.
     * @param timeseriesDb The time series database client.
     * @param metadataManager The metadata manager.
     */
    public TimeseriesManager(
            final DatamodelClient datamodel,
            final TimeseriesDbClient timeseriesDb,
            final MetadataManager metadataManager) {
        _datamodel = datamodel;
        _timeseriesDb = timeseriesDb;
        _metadataManager = metadataManager;
    }

    /**
     * Create a local timeseries. Nothing is persisted until it is saved.
     *
     * @param fid The functional identifier; null to name it later.
     * @return The timeseries.
     * @throws ConflictException if the functional identifier is already used
     */
    public Timeseries newTimeseries(@Nullable final String fid) {
        if (fid != null) {
            checkFidUnused(Identifiers.checkFid(fid));
        }
        return new Timeseries(this, null, fid, _metadataManager.newMetadata(null));
    }

    @Override
    public Timeseries get(final String tsuid) {
        Preconditions.checkNotNull(tsuid, "tsuid must not be null");
        final String fid = _datamodel.readFunctionalIdentifier(tsuid).getFuncId();
        return hydrate(tsuid, fid, _metadataManager.readAll(ImmutableList.of(tsuid)).get(tsuid));
    }

    /**
     * Fetch a timeseries by its functional identifier.
     *
     * @param fid The functional identifier.
     * @return The timeseries.
     */
    public Timeseries getByFid(final String fid) {
        Preconditions.checkNotNull(fid, "fid must not be null");
        final String tsuid = _datamodel.findFunctionalIdentifier(fid).getTsuid();
        return hydrate(tsuid, fid, _metadataManager.readAll(ImmutableList.of(tsuid)).get(tsuid));
    }

    @Override
    public LazyListing<Timeseries> list() {
        return LazyListing.fromIterator(() -> hydrateInBatches(_datamodel.listFunctionalIdentifiers().iterator()));
    }

    /**
     * List the timeseries whose metadata match a constraint. Each key maps to
     * the accepted values of that metadata.
     *
     * @param constraint The constraint.
     * @return The lazy listing.
     */
    public LazyListing<Timeseries> list(final Map<String, List<String>> constraint) {
        final ImmutableMap<String, List<String>> copy = ImmutableMap.copyOf(constraint);
        return list(() -> _datamodel.matchTimeseries(copy));
    }

    /**
     * Save a timeseries with generated metadata and no parent.
     *
     * @param timeseries The timeseries.
     * @param raiseException Whether a failure is raised or reported as false.
     * @return The status of the action.
     */
    @Override
    public boolean save(final Timeseries timeseries, final boolean raiseException) {
        return save(timeseries, null, true, raiseException);
    }

    /**
     * Save a timeseries.
     *
     * A timeseries without tsuid is first created: its functional identifier
     * must be set and unused. Local points are then written and, when
     * {@code generateMetadata} is set, the start date, end date and point
     * count of the written points are recorded in the metadata. Metadata of
     * the parent are inherited except the generated ones. Last, the local
     * metadata changes are pushed.
     *
     * @param timeseries The timeseries.
     * @param parent The timeseries to inherit metadata from; may be null.
     * @param generateMetadata Whether metadata are generated from the points.
     * @param raiseException Whether a failure is raised or reported as false.
     * @return The status of the action.
     */
    public boolean save(
            final Timeseries timeseries,
            @Nullable final Timeseries parent,
            final boolean generateMetadata,
            final boolean raiseException) {
        Preconditions.checkNotNull(timeseries, "timeseries must not be null");
        return ActionResult.attempt("save timeseries", describe(timeseries), () -> persist(timeseries, parent, generateMetadata))
                .resolve(raiseException);
    }

    /**
     * Delete a timeseries with its metadata and points. Datasets referencing
     * it are left untouched.
     *
     * @param tsuid The tsuid.
     * @param raiseException Whether a failure is raised or reported as false.
     * @return The status of the action.
     */
    @Override
    public boolean delete(final String tsuid, final boolean raiseException) {
        Preconditions.checkNotNull(tsuid, "tsuid must not be null");
        return ActionResult.attempt("delete timeseries", tsuid, () -> _datamodel.deleteTimeseries(tsuid))
                .resolve(raiseException);
    }

    /**
     * Delete a timeseries known locally. A timeseries without tsuid is
     * resolved by its functional identifier.
     *
     * @param timeseries The timeseries.
     * @param raiseException Whether a failure is raised or reported as false.
     * @return The status of the action.
     */
    public boolean delete(final Timeseries timeseries, final boolean raiseException) {
        Preconditions.checkNotNull(timeseries, "timeseries must not be null");
        return ActionResult.attempt("delete timeseries", describe(timeseries), () -> {
            final String tsuid = timeseries.getTsuid().orElseGet(() -> fidToTsuid(timeseries.getFid()
                    .orElseThrow(() -> new ValidationException("Cannot delete a timeseries without tsuid nor fid"))));
            _datamodel.deleteTimeseries(tsuid);
        }).resolve(raiseException);
    }

    /**
     * Read the points of a timeseries over the range recorded in its
     * metadata. The points replace the local ones.
     *
     * @param timeseries The timeseries.
     * @return The points.
     */
    public ImmutableList<DataPoint> fetchPoints(final Timeseries timeseries) {
        final String tsuid = requireTsuid(timeseries);
        Metadata metadata = timeseries.getMetadata();
        if (!metadata.contains(START_DATE) || !metadata.contains(END_DATE)) {
            metadata = _metadataManager.get(tsuid);
        }
        if (!metadata.contains(START_DATE) || !metadata.contains(END_DATE)) {
            throw new ValidationException(String.format(
                    "Range of the points is unknown, provide start and end; tsuid=%s",
                    tsuid));
        }
        return fetchPoints(
                timeseries,
                metadata.getDate(START_DATE).toEpochMilli(),
                metadata.getDate(END_DATE).toEpochMilli());
    }

    /**
     * Read the points of a timeseries over a range, bounds included. The
     * points replace the local ones.
     *
     * @param timeseries The timeseries.
     * @param start The start in milliseconds since epoch.
     * @param end The end in milliseconds since epoch.
     * @return The points.
     */
    public ImmutableList<DataPoint> fetchPoints(final Timeseries timeseries, final long start, final long end) {
        if (start > end) {
            throw new ValidationException(String.format("Start after end; start=%d, end=%d", start, end));
        }
        timeseries.setPoints(_timeseriesDb.readPoints(requireTsuid(timeseries), start, end));
        return timeseries.getPoints();
    }

    /**
     * Count the points stored for a timeseries.
     *
     * @param tsuid The tsuid.
     * @return The count.
     */
    public long countPoints(final String tsuid) {
        return _timeseriesDb.countPoints(tsuid);
    }

    /**
     * Copy the metadata of a parent into a persisted timeseries and push them.
     * Generated metadata of the parent are not copied.
     *
     * @param timeseries The timeseries.
     * @param parent The parent.
     */
    public void inherit(final Timeseries timeseries, final Timeseries parent) {
        requireTsuid(timeseries);
        copyInheritable(timeseries, parent);
        _metadataManager.save(timeseries.getMetadata(), true);
    }

    /**
     * Resolve a functional identifier.
     *
     * @param fid The functional identifier.
     * @return The tsuid.
     */
    public String fidToTsuid(final String fid) {
        return _datamodel.findFunctionalIdentifier(fid).getTsuid();
    }

    /**
     * Resolve a tsuid.
     *
     * @param tsuid The tsuid.
     * @return The functional identifier.
     */
    public String tsuidToFid(final String tsuid) {
        return _datamodel.readFunctionalIdentifier(tsuid).getFuncId();
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
                .put("timeseriesDb", _timeseriesDb)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    /**
     * List the timeseries of a tsuid query, hydrated by batches.
     *
     * @param tsuids The query.
     * @return The lazy listing.
     */
    LazyListing<Timeseries> list(final Supplier<? extends Collection<String>> tsuids) {
        return LazyListing.fromIterator(() -> Iterators.concat(Iterators.transform(
                Iterators.partition(tsuids.get().iterator(), MetadataManager.BATCH_SIZE),
                this::hydrateTsuids)));
    }

    private Iterator<Timeseries> hydrateInBatches(final Iterator<FunctionalIdentifier> identifiers) {
        return Iterators.concat(Iterators.transform(
                Iterators.partition(identifiers, MetadataManager.BATCH_SIZE),
                chunk -> {
                    final Map<String, Metadata> bags = _metadataManager.readAll(chunk.stream()
                            .map(FunctionalIdentifier::getTsuid)
                            .collect(ImmutableList.toImmutableList()));
                    return chunk.stream()
                            .map(identifier -> hydrate(identifier.getTsuid(), identifier.getFuncId(), bags.get(identifier.getTsuid())))
                            .iterator();
                }));
    }

    private Iterator<Timeseries> hydrateTsuids(final List<String> tsuids) {
        final ImmutableList<FunctionalIdentifier> identifiers = tsuids.stream()
                .map(_datamodel::readFunctionalIdentifier)
                .collect(ImmutableList.toImmutableList());
        return hydrateInBatches(identifiers.iterator());
    }

    private Timeseries hydrate(final String tsuid, final String fid, final Metadata metadata) {
        return new Timeseries(this, tsuid, fid, metadata);
    }

    private void persist(final Timeseries timeseries, @Nullable final Timeseries parent, final boolean generateMetadata) {
        if (!timeseries.getTsuid().isPresent()) {
            create(timeseries);
        }
        final String tsuid = requireTsuid(timeseries);
        final ImmutableList<DataPoint> points = timeseries.getPoints();
        if (!points.isEmpty()) {
            final PointsSummary summary = _timeseriesDb.addPoints(tsuid, points);
            if (generateMetadata) {
                timeseries.getMetadata()
                        .set(START_DATE, Instant.ofEpochMilli(summary.getStartDate()))
                        .set(END_DATE, Instant.ofEpochMilli(summary.getEndDate()))
                        .set(POINT_COUNT, summary.getCount());
            }
        }
        if (parent != null) {
            copyInheritable(timeseries, parent);
        }
        _metadataManager.save(timeseries.getMetadata(), true);
    }

    private void create(final Timeseries timeseries) {
        final String fid = timeseries.getFid()
                .orElseThrow(() -> new ValidationException("Cannot create a timeseries without fid"));
        if (timeseries.getMetadata().getTsuid().isPresent()) {
            throw new ValidationException(String.format(
                    "Metadata of a timeseries being created must not be bound; fid=%s, tsuid=%s",
                    fid,
                    timeseries.getMetadata().getTsuid().get()));
        }
        checkFidUnused(fid);
        final String tsuid = _timeseriesDb.assignTsuid(fid);
        _datamodel.importFunctionalIdentifier(tsuid, fid);
        timeseries.setTsuid(tsuid);
        LOGGER.debug()
                .setMessage("Timeseries created")
                .addData("tsuid", tsuid)
                .addData("fid", fid)
                .log();
    }

    private void copyInheritable(final Timeseries timeseries, final Timeseries parent) {
        final Map<String, MetadataEntry> entries = parent.getTsuid().isPresent()
                ? _metadataManager.get(parent.getTsuid().get()).getEntries()
                : parent.getMetadata().getEntries();
        final Metadata metadata = timeseries.getMetadata();
        for (final Map.Entry<String, MetadataEntry> entry : entries.entrySet()) {
            if (!NOT_INHERITED.matcher(entry.getKey()).lookingAt()) {
                metadata.set(entry.getKey(), entry.getValue().getValue(), entry.getValue().getType());
            }
        }
    }

    private void checkFidUnused(final String fid) {
        final String existing;
        try {
            existing = fidToTsuid(fid);
        } catch (final NotFoundException e) {
            return;
        }
        throw new ConflictException(String.format("Fid already used; fid=%s, tsuid=%s", fid, existing));
    }

    private static String requireTsuid(final Timeseries timeseries) {
        return timeseries.getTsuid()
                .orElseThrow(() -> new ValidationException(String.format(
                        "Timeseries is not saved; fid=%s",
                        timeseries.getFid().orElse(null))));
    }

    private static String describe(final Timeseries timeseries) {
        return timeseries.getTsuid().orElseGet(() -> timeseries.getFid().orElse("<unnamed>"));
    }

    private final DatamodelClient _datamodel;
    private final TimeseriesDbClient _timeseriesDb;
    private final MetadataManager _metadataManager;

    static final String START_DATE = "ikats_start_date";
    static final String END_DATE = "ikats_end_date";
    static final String POINT_COUNT = "qual_nb_points";
    private static final Pattern NOT_INHERITED = Pattern.compile("qual.*|ikats.*|funcId");
    private static final Logger LOGGER = LoggerFactory.getLogger(TimeseriesManager.class);
}
