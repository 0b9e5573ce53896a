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
import com.google.common.collect.ImmutableList;
import fr.cs.ikats.api.client.model.PointsSummary;
import fr.cs.ikats.api.exceptions.NotFoundException;
import fr.cs.ikats.api.exceptions.ValidationException;
import fr.cs.ikats.api.objects.DataPoint;

import java.util.List;
import java.util.Locale;
import java.util.NavigableMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * {@link TimeseriesDbClient} keeping points in memory. Used when the
 * backends are emulated.
 *
 * @author CS Systemes d'Information
 */
public final class InMemoryTimeseriesDbClient implements TimeseriesDbClient {

    @Override
    public String assignTsuid(final String fid) {
        final String tsuid = UUID.randomUUID().toString().replace("-", "").substring(0, 24).toUpperCase(Locale.ROOT);
        _points.put(tsuid, new ConcurrentSkipListMap<>());
        LOGGER.debug()
                .setMessage("Tsuid assigned")
                .addData("fid", fid)
                .addData("tsuid", tsuid)
                .log();
        return tsuid;
    }

    @Override
    public PointsSummary addPoints(final String tsuid, final List<DataPoint> points) {
        if (points.isEmpty()) {
            throw new ValidationException(String.format("No points to write; tsuid=%s", tsuid));
        }
        final NavigableMap<Long, Double> series = _points.computeIfAbsent(tsuid, key -> new ConcurrentSkipListMap<>());
        for (final DataPoint point : points) {
            series.put(point.getTimestamp(), point.getValue());
        }
        return new PointsSummary(
                points.get(0).getTimestamp(),
                points.get(points.size() - 1).getTimestamp(),
                points.size());
    }

    @Override
    public List<DataPoint> readPoints(final String tsuid, final long start, final long end) {
        if (start < 0 || end < start) {
            throw new ValidationException(String.format("Invalid range; start=%d, end=%d", start, end));
        }
        return getSeries(tsuid).subMap(start, true, end, true)
                .entrySet()
                .stream()
                .map(entry -> new DataPoint(entry.getKey(), entry.getValue()))
                .collect(ImmutableList.toImmutableList());
    }

    @Override
    public long countPoints(final String tsuid) {
        return getSeries(tsuid).size();
    }

    /**
     * Forget a timeseries and its points. Mirrors the purge done by the
     * datamodel when a timeseries is deleted.
     *
     * @param tsuid The timeseries.
     */
    void purge(final String tsuid) {
        _points.remove(tsuid);
    }

    private NavigableMap<Long, Double> getSeries(final String tsuid) {
        final NavigableMap<Long, Double> series = _points.get(tsuid);
        if (series == null) {
            throw new NotFoundException(String.format("Unknown timeseries; tsuid=%s", tsuid));
        }
        return series;
    }

    private final ConcurrentMap<String, NavigableMap<Long, Double>> _points = new ConcurrentHashMap<>();

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryTimeseriesDbClient.class);
}
