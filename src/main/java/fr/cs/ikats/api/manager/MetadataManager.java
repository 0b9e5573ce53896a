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
import com.google.common.collect.Iterables;
import com.google.common.collect.Iterators;
import fr.cs.ikats.api.client.DatamodelClient;
import fr.cs.ikats.api.client.model.FunctionalIdentifier;
import fr.cs.ikats.api.client.model.MetadataRecord;
import fr.cs.ikats.api.exceptions.ConflictException;
import fr.cs.ikats.api.exceptions.NotFoundException;
import fr.cs.ikats.api.exceptions.ValidationException;
import fr.cs.ikats.api.objects.Metadata;
import fr.cs.ikats.api.objects.MetadataEntry;
import fr.cs.ikats.api.objects.MetadataType;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Manager of the metadata bags. Exposes both whole-bag actions and key level
 * actions scoped to one timeseries.
 *
 * @author CS Systemes d'Information
 */
public final class MetadataManager implements ReadableManager<Metadata, String> {

    /**
     * Public constructor.
     *
     * @param datamodel The datamodel client.
     */
    public MetadataManager(final DatamodelClient datamodel) {
        _datamodel = datamodel;
    }

    /**
     * Create an empty local bag.
     *
     * @param tsuid The timeseries; null until the timeseries is persisted.
     * @return The bag.
     */
    public Metadata newMetadata(@Nullable final String tsuid) {
        return new Metadata(this, tsuid);
    }

    /**
     * Fetch the bag of a timeseries. Fails if the timeseries itself does not
     * exist, even though a lookup of its metadata would be empty.
     *
     * @param tsuid The timeseries.
     * @return The bag.
     */
    @Override
    public Metadata get(final String tsuid) {
        Preconditions.checkNotNull(tsuid, "tsuid must not be null");
        _datamodel.readFunctionalIdentifier(tsuid);
        return readAll(ImmutableList.of(tsuid)).get(tsuid);
    }

    @Override
    public LazyListing<Metadata> list() {
        return LazyListing.fromIterator(() -> Iterators.concat(Iterators.transform(
                Iterators.partition(_datamodel.listFunctionalIdentifiers().iterator(), BATCH_SIZE),
                chunk -> readAll(chunk.stream()
                        .map(FunctionalIdentifier::getTsuid)
                        .collect(ImmutableList.toImmutableList()))
                        .values()
                        .iterator())));
    }

    /**
     * Read one value.
     *
     * @param tsuid The timeseries.
     * @param key The key.
     * @return The entry.
     * @throws NotFoundException if the timeseries or the key is unknown
     */
    public MetadataEntry getValue(final String tsuid, final String key) {
        return get(tsuid).getEntry(key);
    }

    /**
     * Write one value, creating or replacing it, raising on failure.
     *
     * @param tsuid The timeseries.
     * @param key The key.
     * @param value The value as text.
     * @param type The type.
     * @return Always true.
     */
    public boolean set(final String tsuid, final String key, final String value, final MetadataType type) {
        return set(tsuid, key, value, type, true);
    }

    /**
     * Write one value, creating or replacing it.
     *
     * @param tsuid The timeseries.
     * @param key The key.
     * @param value The value as text.
     * @param type The type.
     * @param raiseException Whether a failure is raised or reported as false.
     * @return The status of the action.
     */
    public boolean set(
            final String tsuid,
            final String key,
            final String value,
            final MetadataType type,
            final boolean raiseException) {
        Preconditions.checkNotNull(tsuid, "tsuid must not be null");
        Preconditions.checkNotNull(key, "key must not be null");
        Preconditions.checkNotNull(value, "value must not be null");
        Preconditions.checkNotNull(type, "type must not be null");
        return ActionResult.attempt("set metadata", tsuid + "/" + key, () -> upsert(tsuid, key, new MetadataEntry(value, type)))
                .resolve(raiseException);
    }

    /**
     * Delete one key, raising on failure.
     *
     * @param tsuid The timeseries.
     * @param key The key.
     * @return Always true.
     */
    public boolean delete(final String tsuid, final String key) {
        return delete(tsuid, key, true);
    }

    /**
     * Delete one key.
     *
     * @param tsuid The timeseries.
     * @param key The key.
     * @param raiseException Whether a failure is raised or reported as false.
     * @return The status of the action.
     */
    public boolean delete(final String tsuid, final String key, final boolean raiseException) {
        Preconditions.checkNotNull(tsuid, "tsuid must not be null");
        Preconditions.checkNotNull(key, "key must not be null");
        return ActionResult.attempt("delete metadata", tsuid + "/" + key, () -> _datamodel.deleteMetadata(tsuid, key))
                .resolve(raiseException);
    }

    /**
     * Push the local changes of a bag, raising on failure.
     *
     * @param metadata The bag.
     * @return Always true.
     */
    public boolean save(final Metadata metadata) {
        return save(metadata, true);
    }

    /**
     * Push the local changes of a bag: written keys are created or replaced,
     * deleted keys are removed.
     *
     * @param metadata The bag.
     * @param raiseException Whether a failure is raised or reported as false.
     * @return The status of the action.
     */
    public boolean save(final Metadata metadata, final boolean raiseException) {
        Preconditions.checkNotNull(metadata, "metadata must not be null");
        return ActionResult.attempt("save metadata", metadata.getTsuid().orElse("<unbound>"), () -> push(metadata))
                .resolve(raiseException);
    }

    /**
     * Reload a bag from the datamodel, dropping its local changes.
     *
     * @param metadata The bag.
     */
    public void fetch(final Metadata metadata) {
        final String tsuid = metadata.getTsuid()
                .orElseThrow(() -> new ValidationException("Cannot fetch metadata of a timeseries that is not saved"));
        metadata.load(get(tsuid).getEntries());
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

    /**
     * Read the bags of several timeseries in one lookup per chunk. Every
     * requested tsuid gets a bag, empty when nothing is recorded; records of
     * other tsuids are ignored.
     *
     * @param tsuids The timeseries.
     * @return The bags by tsuid, in request order.
     */
    Map<String, Metadata> readAll(final Collection<String> tsuids) {
        final Map<String, Map<String, MetadataEntry>> entries = new LinkedHashMap<>();
        for (final String tsuid : tsuids) {
            entries.put(tsuid, new LinkedHashMap<>());
        }
        for (final List<String> chunk : Iterables.partition(tsuids, BATCH_SIZE)) {
            for (final MetadataRecord record : _datamodel.lookupMetadata(chunk)) {
                final Map<String, MetadataEntry> bag = entries.get(record.getTsuid());
                if (bag != null) {
                    bag.put(record.getName(), new MetadataEntry(record.getValue(), record.getDtype()));
                }
            }
        }
        final ImmutableMap.Builder<String, Metadata> bags = ImmutableMap.builder();
        for (final Map.Entry<String, Map<String, MetadataEntry>> entry : entries.entrySet()) {
            final Metadata metadata = new Metadata(this, entry.getKey());
            metadata.load(entry.getValue());
            bags.put(entry.getKey(), metadata);
        }
        return bags.build();
    }

    private void push(final Metadata metadata) {
        final String tsuid = metadata.getTsuid()
                .orElseThrow(() -> new ValidationException("Cannot save metadata of a timeseries that is not saved"));
        for (final Map.Entry<String, MetadataEntry> update : metadata.getPendingUpdates().entrySet()) {
            upsert(tsuid, update.getKey(), update.getValue());
        }
        for (final String key : metadata.getPendingDeletions()) {
            try {
                _datamodel.deleteMetadata(tsuid, key);
            } catch (final NotFoundException e) {
                LOGGER.debug()
                        .setMessage("Deleted metadata was never persisted")
                        .addData("tsuid", tsuid)
                        .addData("key", key)
                        .log();
            }
        }
        metadata.markSynchronized();
    }

    private void upsert(final String tsuid, final String key, final MetadataEntry entry) {
        final MetadataRecord record = new MetadataRecord.Builder()
                .setTsuid(tsuid)
                .setName(key)
                .setValue(entry.getValue())
                .setDtype(entry.getType())
                .build();
        try {
            _datamodel.createMetadata(record);
        } catch (final ConflictException e) {
            _datamodel.updateMetadata(record);
        }
    }

    private final DatamodelClient _datamodel;

    static final int BATCH_SIZE = 100;
    private static final Logger LOGGER = LoggerFactory.getLogger(MetadataManager.class);
}
