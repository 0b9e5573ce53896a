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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import fr.cs.ikats.api.exceptions.NotFoundException;
import fr.cs.ikats.api.exceptions.ValidationException;
import fr.cs.ikats.api.manager.MetadataManager;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Typed key/value bag of exactly one timeseries.
 *
 * Local changes are tracked and only reach the datamodel through
 * {@link #save()}. A bag created for a timeseries that is not persisted yet
 * is bound to its tsuid once the timeseries is saved.
 *
 * @author CS Systemes d'Information
 */
public final class Metadata {

    /**
     * Public constructor.
     *
     * @param manager The owning manager.
     * @param tsuid The timeseries; null until the timeseries is persisted.
     */
    public Metadata(final MetadataManager manager, @Nullable final String tsuid) {
        _manager = manager;
        _tsuid = tsuid;
    }

    public Optional<String> getTsuid() {
        return Optional.ofNullable(_tsuid);
    }

    /**
     * Bind the bag to its timeseries. A bound bag cannot be rebound to
     * another timeseries.
     *
     * @param tsuid The timeseries.
     */
    public void setTsuid(final String tsuid) {
        Preconditions.checkNotNull(tsuid, "tsuid must not be null");
        if (_tsuid != null && !_tsuid.equals(tsuid)) {
            throw new ValidationException(String.format(
                    "Metadata already bound to another timeseries; tsuid=%s, requested=%s",
                    _tsuid,
                    tsuid));
        }
        _tsuid = tsuid;
    }

    /**
     * Set a value, replacing any value of the same key.
     *
     * @param key The key.
     * @param value The value as text.
     * @param type The type.
     * @return This instance.
     */
    public Metadata set(final String key, final String value, final MetadataType type) {
        checkKey(key);
        Preconditions.checkNotNull(value, "value must not be null");
        Preconditions.checkNotNull(type, "type must not be null");
        _entries.put(key, new MetadataEntry(value, type));
        _pendingUpdates.add(key);
        _pendingDeletions.remove(key);
        return this;
    }

    /**
     * Set a text value.
     *
     * @param key The key.
     * @param value The value.
     * @return This instance.
     */
    public Metadata set(final String key, final String value) {
        return set(key, value, MetadataType.STRING);
    }

    /**
     * Set a number value.
     *
     * @param key The key.
     * @param value The value.
     * @return This instance.
     */
    public Metadata set(final String key, final Number value) {
        return set(key, value.toString(), MetadataType.NUMBER);
    }

    /**
     * Set a date value, stored as milliseconds since epoch.
     *
     * @param key The key.
     * @param value The value.
     * @return This instance.
     */
    public Metadata set(final String key, final Instant value) {
        return set(key, Long.toString(value.toEpochMilli()), MetadataType.DATE);
    }

    /**
     * Add a value for a key that is not defined yet.
     *
     * @param key The key.
     * @param value The value as text.
     * @param type The type.
     * @return This instance.
     * @throws ValidationException if the key is already defined
     */
    public Metadata add(final String key, final String value, final MetadataType type) {
        if (_entries.containsKey(key)) {
            throw new ValidationException(String.format("Duplicate metadata key; tsuid=%s, key=%s", _tsuid, key));
        }
        return set(key, value, type);
    }

    /**
     * Remove a key. The removal reaches the datamodel on the next save.
     *
     * @param key The key.
     * @return This instance.
     * @throws NotFoundException if the key is not defined
     */
    public Metadata delete(final String key) {
        if (_entries.remove(key) == null) {
            throw new NotFoundException(String.format("Unknown metadata key; tsuid=%s, key=%s", _tsuid, key));
        }
        _pendingUpdates.remove(key);
        _pendingDeletions.add(key);
        return this;
    }

    /**
     * Whether a key is defined.
     *
     * @param key The key.
     * @return True if and only if the key is defined.
     */
    public boolean contains(final String key) {
        return _entries.containsKey(key);
    }

    public ImmutableSet<String> getKeys() {
        return ImmutableSet.copyOf(_entries.keySet());
    }

    public ImmutableMap<String, MetadataEntry> getEntries() {
        return ImmutableMap.copyOf(_entries);
    }

    /**
     * Look up the entry of a key.
     *
     * @param key The key.
     * @return The entry.
     * @throws NotFoundException if the key is not defined
     */
    public MetadataEntry getEntry(final String key) {
        final MetadataEntry entry = _entries.get(key);
        if (entry == null) {
            throw new NotFoundException(String.format("Unknown metadata key; tsuid=%s, key=%s", _tsuid, key));
        }
        return entry;
    }

    public MetadataType getType(final String key) {
        return getEntry(key).getType();
    }

    public String getString(final String key) {
        return getEntry(key).getValue();
    }

    /**
     * Read a value as a number.
     *
     * @param key The key.
     * @return The number.
     * @throws ValidationException if the value is not a number
     */
    public double getNumber(final String key) {
        final MetadataEntry entry = getEntry(key);
        try {
            return Double.parseDouble(entry.getValue());
        } catch (final NumberFormatException e) {
            throw new ValidationException(String.format("Metadata is not a number; key=%s, value=%s", key, entry.getValue()), e);
        }
    }

    /**
     * Read a value as a date stored in milliseconds since epoch.
     *
     * @param key The key.
     * @return The date.
     * @throws ValidationException if the value is not a date
     */
    public Instant getDate(final String key) {
        final MetadataEntry entry = getEntry(key);
        try {
            return Instant.ofEpochMilli(Long.parseLong(entry.getValue()));
        } catch (final NumberFormatException e) {
            throw new ValidationException(String.format("Metadata is not a date; key=%s, value=%s", key, entry.getValue()), e);
        }
    }

    /**
     * Keys set locally since the last synchronization.
     *
     * @return The keys to write.
     */
    public ImmutableMap<String, MetadataEntry> getPendingUpdates() {
        final ImmutableMap.Builder<String, MetadataEntry> pending = ImmutableMap.builder();
        for (final String key : _pendingUpdates) {
            pending.put(key, _entries.get(key));
        }
        return pending.build();
    }

    /**
     * Keys deleted locally since the last synchronization.
     *
     * @return The keys to delete.
     */
    public ImmutableSet<String> getPendingDeletions() {
        return ImmutableSet.copyOf(_pendingDeletions);
    }

    /**
     * Whether local changes are waiting for a save.
     *
     * @return True if and only if a save would write something.
     */
    public boolean isDirty() {
        return !_pendingUpdates.isEmpty() || !_pendingDeletions.isEmpty();
    }

    /**
     * Replace the content with the persisted state and forget local changes.
     *
     * @param entries The persisted entries.
     */
    public void load(final Map<String, MetadataEntry> entries) {
        _entries.clear();
        _entries.putAll(entries);
        markSynchronized();
    }

    /**
     * Forget the tracked local changes once they are persisted.
     */
    public void markSynchronized() {
        _pendingUpdates.clear();
        _pendingDeletions.clear();
    }

    /**
     * Persist the local changes, raising on failure.
     *
     * @return Always true.
     */
    public boolean save() {
        return _manager.save(this, true);
    }

    /**
     * Persist the local changes.
     *
     * @param raiseException Whether a failure is raised or reported as false.
     * @return The status of the action.
     */
    public boolean save(final boolean raiseException) {
        return _manager.save(this, raiseException);
    }

    /**
     * Reload the persisted state, dropping local changes.
     *
     * @return This instance.
     */
    public Metadata fetch() {
        _manager.fetch(this);
        return this;
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
                .put("entries", _entries)
                .put("pendingUpdates", _pendingUpdates)
                .put("pendingDeletions", _pendingDeletions)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    /**
     * Give the bag to the timeseries owning it. A bag has at most one owner.
     *
     * @param owner The owning timeseries.
     */
    void attach(final Timeseries owner) {
        checkAttachable(owner);
        _owner = owner;
    }

    /**
     * Fail if the bag belongs to a timeseries other than {@code owner}.
     *
     * @param owner The candidate owner.
     */
    void checkAttachable(final Timeseries owner) {
        if (_owner != null && _owner != owner) {
            throw new ValidationException(String.format(
                    "Metadata already belongs to another timeseries; tsuid=%s",
                    _tsuid));
        }
    }

    private static void checkKey(final String key) {
        Preconditions.checkNotNull(key, "key must not be null");
        if (key.isEmpty()) {
            throw new ValidationException("Metadata key must not be empty");
        }
    }

    private final MetadataManager _manager;
    private final Map<String, MetadataEntry> _entries = new LinkedHashMap<>();
    private final Set<String> _pendingUpdates = new LinkedHashSet<>();
    private final Set<String> _pendingDeletions = new LinkedHashSet<>();
    @Nullable
    private String _tsuid;
    @Nullable
    private Timeseries _owner;
}
