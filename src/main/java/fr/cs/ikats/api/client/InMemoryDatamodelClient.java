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

import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import fr.cs.ikats.api.client.model.DatasetRecord;
import fr.cs.ikats.api.client.model.FunctionalIdentifier;
import fr.cs.ikats.api.client.model.MetadataRecord;
import fr.cs.ikats.api.exceptions.ConflictException;
import fr.cs.ikats.api.exceptions.NotFoundException;
import fr.cs.ikats.api.exceptions.ValidationException;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * {@link DatamodelClient} keeping datasets, timeseries references, metadata
 * and tables in memory. Used when the backends are emulated.
 *
 * Deleting a timeseries purges its points from the companion
 * {@link InMemoryTimeseriesDbClient} and leaves dataset memberships untouched.
 *
 * @author CS Systemes d'Information
 */
public final class InMemoryDatamodelClient implements DatamodelClient {

    /**
     * Public constructor.
     *
     * @param timeseriesDb The emulated time series database holding the points.
     */
    public InMemoryDatamodelClient(final InMemoryTimeseriesDbClient timeseriesDb) {
        _timeseriesDb = timeseriesDb;
    }

    @Override
    public void createDataset(final String name, final String description, final List<String> tsuids) {
        final DatasetRecord record = new DatasetRecord.Builder()
                .setName(name)
                .setDescription(description)
                .setTsuids(ImmutableList.copyOf(tsuids))
                .build();
        if (_datasets.putIfAbsent(name, record) != null) {
            throw new ConflictException(String.format("Dataset already exists; name=%s", name));
        }
        LOGGER.debug()
                .setMessage("Dataset created")
                .addData("name", name)
                .log();
    }

    @Override
    public DatasetRecord readDataset(final String name) {
        final DatasetRecord record = _datasets.get(name);
        if (record == null) {
            throw new NotFoundException(String.format("Dataset not found; name=%s", name));
        }
        return record;
    }

    @Override
    public void updateDataset(final String name, final String description, final List<String> tsuids) {
        final DatasetRecord record = new DatasetRecord.Builder()
                .setName(name)
                .setDescription(description)
                .setTsuids(ImmutableList.copyOf(tsuids))
                .build();
        if (_datasets.replace(name, record) == null) {
            throw new NotFoundException(String.format("Dataset not found; name=%s", name));
        }
    }

    @Override
    public void deleteDataset(final String name, final boolean deep) {
        final DatasetRecord record = _datasets.remove(name);
        if (record == null) {
            throw new NotFoundException(String.format("Dataset not found; name=%s", name));
        }
        if (deep) {
            for (final String tsuid : record.getTsuids()) {
                if (_fids.containsKey(tsuid)) {
                    deleteTimeseries(tsuid);
                }
            }
        }
        LOGGER.debug()
                .setMessage("Dataset deleted")
                .addData("name", name)
                .addData("deep", deep)
                .log();
    }

    @Override
    public List<DatasetRecord> listDatasets() {
        return _datasets.values()
                .stream()
                .map(record -> new DatasetRecord.Builder()
                        .setName(record.getName())
                        .setDescription(record.getDescription())
                        .build())
                .collect(ImmutableList.toImmutableList());
    }

    @Override
    public void importFunctionalIdentifier(final String tsuid, final String fid) {
        synchronized (_fids) {
            if (_fids.containsKey(tsuid) || _fids.containsValue(fid)) {
                throw new ConflictException(String.format("Functional identifier already exists; tsuid=%s, fid=%s", tsuid, fid));
            }
            _fids.put(tsuid, fid);
        }
    }

    @Override
    public FunctionalIdentifier readFunctionalIdentifier(final String tsuid) {
        final String fid = _fids.get(tsuid);
        if (fid == null) {
            throw new NotFoundException(String.format("No functional identifier; tsuid=%s", tsuid));
        }
        return toFunctionalIdentifier(tsuid, fid);
    }

    @Override
    public FunctionalIdentifier findFunctionalIdentifier(final String fid) {
        return _fids.entrySet()
                .stream()
                .filter(entry -> entry.getValue().equals(fid))
                .findFirst()
                .map(entry -> toFunctionalIdentifier(entry.getKey(), entry.getValue()))
                .orElseThrow(() -> new NotFoundException(String.format("Unknown functional identifier; fid=%s", fid)));
    }

    @Override
    public List<FunctionalIdentifier> listFunctionalIdentifiers() {
        return _fids.entrySet()
                .stream()
                .map(entry -> toFunctionalIdentifier(entry.getKey(), entry.getValue()))
                .collect(ImmutableList.toImmutableList());
    }

    @Override
    public List<String> matchTimeseries(final Map<String, List<String>> constraint) {
        return _fids.keySet()
                .stream()
                .filter(tsuid -> matches(_metadata.getOrDefault(tsuid, new ConcurrentHashMap<>()), constraint))
                .collect(ImmutableList.toImmutableList());
    }

    @Override
    public void deleteTimeseries(final String tsuid) {
        if (_fids.remove(tsuid) == null) {
            throw new NotFoundException(String.format("Timeseries not found; tsuid=%s", tsuid));
        }
        _metadata.remove(tsuid);
        _timeseriesDb.purge(tsuid);
        LOGGER.debug()
                .setMessage("Timeseries deleted")
                .addData("tsuid", tsuid)
                .log();
    }

    @Override
    public void createMetadata(final MetadataRecord record) {
        if (getMetadataOf(record.getTsuid()).putIfAbsent(record.getName(), record) != null) {
            throw new ConflictException(String.format(
                    "Metadata already exists; tsuid=%s, name=%s",
                    record.getTsuid(),
                    record.getName()));
        }
    }

    @Override
    public void updateMetadata(final MetadataRecord record) {
        if (getMetadataOf(record.getTsuid()).replace(record.getName(), record) == null) {
            throw new NotFoundException(String.format(
                    "Metadata not found; tsuid=%s, name=%s",
                    record.getTsuid(),
                    record.getName()));
        }
    }

    @Override
    public void deleteMetadata(final String tsuid, final String name) {
        if (getMetadataOf(tsuid).remove(name) == null) {
            throw new NotFoundException(String.format("Metadata not found; tsuid=%s, name=%s", tsuid, name));
        }
    }

    @Override
    public List<MetadataRecord> lookupMetadata(final Collection<String> tsuids) {
        final ImmutableList.Builder<MetadataRecord> records = ImmutableList.builder();
        for (final String tsuid : tsuids) {
            final Map<String, MetadataRecord> entries = _metadata.get(tsuid);
            if (entries != null) {
                records.addAll(entries.values());
            }
        }
        return records.build();
    }

    @Override
    public void createTable(final ObjectNode table) {
        final String name = table.path("table_desc").path("name").asText("");
        if (name.isEmpty()) {
            throw new ValidationException("Table has no name");
        }
        if (_tables.putIfAbsent(name, table.deepCopy()) != null) {
            throw new ConflictException(String.format("Table already exists; name=%s", name));
        }
    }

    @Override
    public ObjectNode readTable(final String name) {
        final ObjectNode table = _tables.get(name);
        if (table == null) {
            throw new NotFoundException(String.format("Table not found; name=%s", name));
        }
        return table.deepCopy();
    }

    @Override
    public List<String> listTables(@Nullable final String pattern, final boolean strict) {
        if (pattern == null) {
            return ImmutableList.copyOf(_tables.keySet());
        }
        if (strict) {
            return _tables.containsKey(pattern) ? ImmutableList.of(pattern) : ImmutableList.of();
        }
        final StringBuilder regex = new StringBuilder();
        for (final String part : pattern.split("\\*", -1)) {
            if (regex.length() > 0) {
                regex.append(".*");
            }
            regex.append(Pattern.quote(part));
        }
        final Pattern compiled = Pattern.compile(regex.toString());
        return _tables.keySet()
                .stream()
                .filter(name -> compiled.matcher(name).matches())
                .collect(ImmutableList.toImmutableList());
    }

    @Override
    public void deleteTable(final String name) {
        if (_tables.remove(name) == null) {
            throw new NotFoundException(String.format("Table not found; name=%s", name));
        }
    }

    private ConcurrentMap<String, MetadataRecord> getMetadataOf(final String tsuid) {
        if (!_fids.containsKey(tsuid)) {
            throw new NotFoundException(String.format("Timeseries not found; tsuid=%s", tsuid));
        }
        return _metadata.computeIfAbsent(tsuid, key -> new ConcurrentHashMap<>());
    }

    private static boolean matches(final Map<String, MetadataRecord> entries, final Map<String, List<String>> constraint) {
        for (final Map.Entry<String, List<String>> criterion : constraint.entrySet()) {
            final MetadataRecord entry = entries.get(criterion.getKey());
            if (entry == null || criterion.getValue().stream().noneMatch(value -> Objects.equal(value, entry.getValue()))) {
                return false;
            }
        }
        return true;
    }

    private static FunctionalIdentifier toFunctionalIdentifier(final String tsuid, final String fid) {
        return new FunctionalIdentifier.Builder()
                .setTsuid(tsuid)
                .setFuncId(fid)
                .build();
    }

    private final InMemoryTimeseriesDbClient _timeseriesDb;
    private final ConcurrentMap<String, DatasetRecord> _datasets = new ConcurrentHashMap<>();
    private final Map<String, String> _fids = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ConcurrentMap<String, MetadataRecord>> _metadata = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ObjectNode> _tables = new ConcurrentHashMap<>();

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryDatamodelClient.class);
}
