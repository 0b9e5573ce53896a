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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import fr.cs.ikats.api.client.model.PointsSummary;
import fr.cs.ikats.api.exceptions.NotFoundException;
import fr.cs.ikats.api.exceptions.ServerException;
import fr.cs.ikats.api.exceptions.ValidationException;
import fr.cs.ikats.api.objects.DataPoint;
import org.asynchttpclient.AsyncHttpClient;
import org.asynchttpclient.Response;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link TimeseriesDbClient} talking to the OpenTSDB HTTP api.
 *
 * A tsuid is the concatenation of the 6 hex characters uid of the metric and
 * of the uids of each tag key and tag value. New timeseries get a metric and
 * tags derived from the import instant so that the uid space is not exhausted.
 *
 * @author CS Systemes d'Information
 */
public final class HttpTimeseriesDbClient extends HttpBackendClient implements TimeseriesDbClient {

    /**
     * Public constructor.
     *
     * @param client Shared http client.
     * @param uri Root of the time series database.
     * @param requestTimeout Timeout applied to every request.
     */
    public HttpTimeseriesDbClient(final AsyncHttpClient client, final URI uri, final Duration requestTimeout) {
        this(client, uri, requestTimeout, Clock.systemUTC());
    }

    /* package private */ HttpTimeseriesDbClient(
            final AsyncHttpClient client,
            final URI uri,
            final Duration requestTimeout,
            final Clock clock) {
        super(client, uri, requestTimeout);
        _clock = clock;
    }

    @Override
    public String assignTsuid(final String fid) {
        final Instant now = _clock.instant();
        final ZonedDateTime date = now.atZone(ZoneOffset.UTC);
        final String metric = Long.toString(now.getNano() / 100L);
        final Map<String, String> tags = ImmutableMap.of(
                "import_year", Integer.toString(date.getYear()),
                "import_month_day", MONTH_DAY_FORMATTER.format(date),
                "import_time", TIME_FORMATTER.format(date));

        final Response response = send(
                request("GET", "/api/uid/assign")
                        .addQueryParam("metric", metric)
                        .addQueryParam("tagk", LIST_JOINER.join(tags.keySet()))
                        .addQueryParam("tagv", LIST_JOINER.join(tags.values())),
                "assigning tsuid for " + fid);
        // Already known uids are reported with a 400 and listed in the *_errors blocks
        if (response.getStatusCode() / 100 != 2 && response.getStatusCode() != 400) {
            checkStatus(response, "assigning tsuid for " + fid);
        }
        final JsonNode body = readTree(response);

        final StringBuilder tsuid = new StringBuilder(extractUid(body, "metric", metric));
        final List<String> tagUids = Lists.newArrayList();
        for (final Map.Entry<String, String> tag : tags.entrySet()) {
            tagUids.add(extractUid(body, "tagk", tag.getKey()) + extractUid(body, "tagv", tag.getValue()));
        }
        tagUids.stream().sorted().forEach(tsuid::append);
        LOGGER.debug()
                .setMessage("Tsuid assigned")
                .addData("fid", fid)
                .addData("tsuid", tsuid)
                .log();
        return tsuid.toString();
    }

    @Override
    public PointsSummary addPoints(final String tsuid, final List<DataPoint> points) {
        if (points.isEmpty()) {
            throw new ValidationException(String.format("No points to write; tsuid=%s", tsuid));
        }
        final Map<String, String> tags = new LinkedHashMap<>();
        final String metric = resolveMetricAndTags(tsuid, tags);

        final ArrayNode body = getObjectMapper().createArrayNode();
        for (final DataPoint point : points) {
            final ObjectNode entry = body.addObject();
            entry.put("metric", metric);
            entry.put("timestamp", Strings.padStart(Long.toString(point.getTimestamp()), 13, '0'));
            entry.put("value", point.getValue());
            final ObjectNode tagNode = entry.putObject("tags");
            tags.forEach(tagNode::put);
        }
        final byte[] payload;
        try {
            payload = getObjectMapper().writeValueAsBytes(body);
        } catch (final JsonProcessingException e) {
            throw new ServerException("Unable to serialize points", e);
        }
        final Response response = sendChecked(
                request("POST", "/api/put?details&ms=true&sync")
                        .setHeader("Content-Type", "application/json")
                        .setBody(payload),
                "writing points of " + tsuid);
        final JsonNode details = readTree(response);
        if (details.has("success") && details.get("success").asLong() != points.size()) {
            throw new ServerException(String.format(
                    "Database wrote only part of the points; tsuid=%s, written=%d, expected=%d",
                    tsuid,
                    details.get("success").asLong(),
                    points.size()));
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
        final Response response = send(
                request("GET", "/api/query")
                        .addQueryParam("start", Long.toString(start))
                        .addQueryParam("end", Long.toString(end == start ? end + 1 : end))
                        .addQueryParam("tsuid", "avg:" + tsuid)
                        .addQueryParam("ms", "true"),
                "reading points of " + tsuid);
        checkQueryResponse(response, tsuid);
        final JsonNode body = readTree(response);
        if (!body.isArray() || body.size() == 0) {
            return ImmutableList.of();
        }
        final List<DataPoint> points = Lists.newArrayList();
        final Iterator<Map.Entry<String, JsonNode>> dps = body.get(0).path("dps").fields();
        while (dps.hasNext()) {
            final Map.Entry<String, JsonNode> dp = dps.next();
            points.add(new DataPoint(Long.parseLong(dp.getKey()), dp.getValue().asDouble()));
        }
        points.sort(Comparator.comparingLong(DataPoint::getTimestamp));
        return ImmutableList.copyOf(points);
    }

    @Override
    public long countPoints(final String tsuid) {
        final Response response = send(
                request("GET", "/api/query")
                        .addQueryParam("start", "0")
                        .addQueryParam("tsuid", "sum:1y-count:" + tsuid),
                "counting points of " + tsuid);
        checkQueryResponse(response, tsuid);
        final JsonNode body = readTree(response);
        long count = 0;
        if (body.isArray() && body.size() > 0) {
            for (final JsonNode value : body.get(0).path("dps")) {
                count += value.asLong();
            }
        }
        return count;
    }

    private String resolveMetricAndTags(final String tsuid, final Map<String, String> tags) {
        if (tsuid.isEmpty() || tsuid.length() % UID_LENGTH != 0) {
            throw new ValidationException(String.format("Malformed tsuid; tsuid=%s", tsuid));
        }
        String metric = null;
        String tagKey = null;
        for (int i = 0; i < tsuid.length() / UID_LENGTH; ++i) {
            final String uid = tsuid.substring(i * UID_LENGTH, (i + 1) * UID_LENGTH);
            final String type;
            if (i == 0) {
                type = "metric";
            } else if (i % 2 == 1) {
                type = "tagk";
            } else {
                type = "tagv";
            }
            final Response response = send(
                    request("GET", "/api/uid/uidmeta").addQueryParam("uid", uid).addQueryParam("type", type),
                    "resolving uid " + uid);
            if (response.getStatusCode() == 404) {
                throw new NotFoundException(String.format("Unknown uid; tsuid=%s, uid=%s, type=%s", tsuid, uid, type));
            }
            checkStatus(response, "resolving uid " + uid);
            final String name = readTree(response).path("name").asText();
            if ("metric".equals(type)) {
                metric = name;
            } else if ("tagk".equals(type)) {
                tagKey = name;
            } else {
                tags.put(tagKey, name);
            }
        }
        return metric;
    }

    private static void checkQueryResponse(final Response response, final String tsuid) {
        if (response.getStatusCode() / 100 != 2
                && response.getResponseBody() != null
                && response.getResponseBody().contains("No such name for")) {
            throw new NotFoundException(String.format("Unknown timeseries; tsuid=%s", tsuid));
        }
        checkStatus(response, "querying points of " + tsuid);
    }

    private static String extractUid(final JsonNode body, final String type, final String value) {
        final JsonNode assigned = body.path(type).path(value);
        if (assigned.isTextual()) {
            return assigned.asText();
        }
        final JsonNode error = body.path(type + "_errors").path(value);
        if (error.isTextual()) {
            final String message = error.asText();
            final String uid = message.substring(message.lastIndexOf(':') + 1).trim();
            if (!uid.isEmpty() && uid.chars().allMatch(c -> Character.digit(c, 16) >= 0)) {
                return uid;
            }
            throw new ServerException(String.format("Uid assignment failed; type=%s, value=%s, error=%s", type, value, message));
        }
        throw new ServerException(String.format("Uid missing from assignment response; type=%s, value=%s", type, value));
    }

    private final Clock _clock;

    private static final int UID_LENGTH = 6;
    private static final Joiner LIST_JOINER = Joiner.on(',');
    private static final DateTimeFormatter MONTH_DAY_FORMATTER = DateTimeFormatter.ofPattern("MM_dd");
    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH_mm_ss");
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpTimeseriesDbClient.class);
}
