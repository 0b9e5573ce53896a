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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import fr.cs.ikats.api.client.model.DatasetRecord;
import fr.cs.ikats.api.client.model.FunctionalIdentifier;
import fr.cs.ikats.api.client.model.MetadataRecord;
import fr.cs.ikats.api.exceptions.NotFoundException;
import fr.cs.ikats.api.exceptions.ServerException;
import org.asynchttpclient.AsyncHttpClient;
import org.asynchttpclient.RequestBuilder;
import org.asynchttpclient.Response;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * {@link DatamodelClient} talking to the temporal data manager web
 * application over HTTP.
 *
 * @author CS Systemes d'Information
 */
public final class HttpDatamodelClient extends HttpBackendClient implements DatamodelClient {

    /**
     * Public constructor.
     *
     * @param client Shared http client.
     * @param uri Root of the datamodel web api.
     * @param requestTimeout Timeout applied to every request.
     */
    public HttpDatamodelClient(final AsyncHttpClient client, final URI uri, final Duration requestTimeout) {
        super(client, uri, requestTimeout);
    }

    @Override
    public void createDataset(final String name, final String description, final List<String> tsuids) {
        sendChecked(
                request("POST", "/dataset/import/" + segment(name))
                        .addFormParam("name", name)
                        .addFormParam("description", description)
                        .addFormParam("tsuidList", LIST_JOINER.join(tsuids)),
                "creating dataset " + name);
        LOGGER.debug()
                .setMessage("Dataset created")
                .addData("name", name)
                .addData("size", tsuids.size())
                .log();
    }

    @Override
    public DatasetRecord readDataset(final String name) {
        final Response response = sendChecked(request("GET", "/dataset/" + segment(name)), "reading dataset " + name);
        final ObjectNode node = asObject(readTree(response), "dataset " + name);
        node.put("name", name);
        return treeToValue(node, DatasetRecord.class);
    }

    @Override
    public void updateDataset(final String name, final String description, final List<String> tsuids) {
        sendChecked(
                request("PUT", "/dataset/" + segment(name))
                        .addFormParam("description", description)
                        .addFormParam("tsuidList", LIST_JOINER.join(tsuids))
                        .addFormParam("updateMode", "replace"),
                "updating dataset " + name);
    }

    @Override
    public void deleteDataset(final String name, final boolean deep) {
        final RequestBuilder builder = request("DELETE", "/dataset/" + segment(name));
        if (deep) {
            builder.addQueryParam("deep", "true");
        }
        sendChecked(builder, "deleting dataset " + name);
        LOGGER.debug()
                .setMessage("Dataset deleted")
                .addData("name", name)
                .addData("deep", deep)
                .log();
    }

    @Override
    public List<DatasetRecord> listDatasets() {
        final Response response = send(request("GET", "/dataset"), "listing datasets");
        if (response.getStatusCode() == 404) {
            return ImmutableList.of();
        }
        checkStatus(response, "listing datasets");
        return readBody(response, DATASET_LIST_TYPE_REFERENCE);
    }

    @Override
    public void importFunctionalIdentifier(final String tsuid, final String fid) {
        sendChecked(
                request("POST", "/metadata/funcId/" + segment(tsuid) + "/" + segment(fid)),
                "importing functional identifier " + fid);
    }

    @Override
    public FunctionalIdentifier readFunctionalIdentifier(final String tsuid) {
        final Response response = sendChecked(
                request("GET", "/metadata/funcId/" + segment(tsuid)),
                "reading functional identifier of " + tsuid);
        final JsonNode node = readTree(response);
        if (!node.hasNonNull("funcId")) {
            throw new NotFoundException(String.format("No functional identifier; tsuid=%s", tsuid));
        }
        return treeToValue(node, FunctionalIdentifier.class);
    }

    @Override
    public FunctionalIdentifier findFunctionalIdentifier(final String fid) {
        final Response response = sendChecked(
                request("POST", "/metadata/funcId").addFormParam("funcIds", fid),
                "searching functional identifier " + fid);
        final List<FunctionalIdentifier> matches = readBody(response, FID_LIST_TYPE_REFERENCE);
        for (final FunctionalIdentifier match : matches) {
            if (fid.equals(match.getFuncId())) {
                return match;
            }
        }
        throw new NotFoundException(String.format("Unknown functional identifier; fid=%s", fid));
    }

    @Override
    public List<FunctionalIdentifier> listFunctionalIdentifiers() {
        final Response response = send(request("GET", "/metadata/funcId"), "listing timeseries");
        if (response.getStatusCode() == 404) {
            return ImmutableList.of();
        }
        checkStatus(response, "listing timeseries");
        return readBody(response, FID_LIST_TYPE_REFERENCE);
    }

    @Override
    public List<String> matchTimeseries(final Map<String, List<String>> constraint) {
        final RequestBuilder builder = request("GET", "/metadata/tsmatch");
        for (final Map.Entry<String, List<String>> entry : constraint.entrySet()) {
            for (final String value : entry.getValue()) {
                builder.addQueryParam(entry.getKey(), value);
            }
        }
        final Response response = send(builder, "matching timeseries");
        if (response.getStatusCode() == 404) {
            return ImmutableList.of();
        }
        checkStatus(response, "matching timeseries");
        final ImmutableList.Builder<String> tsuids = ImmutableList.builder();
        for (final JsonNode item : readTree(response)) {
            tsuids.add(item.isTextual() ? item.asText() : item.path("tsuid").asText());
        }
        return tsuids.build();
    }

    @Override
    public void deleteTimeseries(final String tsuid) {
        sendChecked(request("DELETE", "/ts/" + segment(tsuid)), "deleting timeseries " + tsuid);
        LOGGER.debug()
                .setMessage("Timeseries deleted")
                .addData("tsuid", tsuid)
                .log();
    }

    @Override
    public void createMetadata(final MetadataRecord record) {
        sendChecked(
                request("POST", "/metadata/import/" + metadataPath(record))
                        .addQueryParam("dtype", record.getDtype().getWireValue()),
                "creating metadata " + record.getName());
    }

    @Override
    public void updateMetadata(final MetadataRecord record) {
        sendChecked(
                request("PUT", "/metadata/" + metadataPath(record))
                        .addQueryParam("dtype", record.getDtype().getWireValue()),
                "updating metadata " + record.getName());
    }

    @Override
    public void deleteMetadata(final String tsuid, final String name) {
        sendChecked(
                request("DELETE", "/metadata/" + segment(tsuid) + "/" + segment(name)),
                "deleting metadata " + name);
    }

    @Override
    public List<MetadataRecord> lookupMetadata(final Collection<String> tsuids) {
        final ImmutableList.Builder<MetadataRecord> records = ImmutableList.builder();
        for (final List<String> chunk : Iterables.partition(tsuids, LOOKUP_CHUNK_SIZE)) {
            final Response response = send(
                    request("GET", "/metadata/list/json").addQueryParam("tsuid", LIST_JOINER.join(chunk)),
                    "looking up metadata");
            if (response.getStatusCode() == 404) {
                continue;
            }
            checkStatus(response, "looking up metadata");
            final JsonNode node = readTree(response);
            if (!node.isArray()) {
                continue;
            }
            for (final JsonNode item : node) {
                records.add(treeToValue(item, MetadataRecord.class));
            }
        }
        return records.build();
    }

    @Override
    public void createTable(final ObjectNode table) {
        final String body;
        try {
            body = getObjectMapper().writeValueAsString(table);
        } catch (final JsonProcessingException e) {
            throw new ServerException("Unable to serialize table", e);
        }
        sendChecked(
                request("POST", "/table")
                        .setHeader("Content-Type", "application/json")
                        .setBody(body.getBytes(StandardCharsets.UTF_8)),
                "creating table " + table.path("table_desc").path("name").asText());
    }

    @Override
    public ObjectNode readTable(final String name) {
        final Response response = sendChecked(request("GET", "/table/" + segment(name)), "reading table " + name);
        return asObject(readTree(response), "table " + name);
    }

    @Override
    public List<String> listTables(@Nullable final String pattern, final boolean strict) {
        final RequestBuilder builder = request("GET", "/table").addQueryParam("strict", Boolean.toString(strict));
        if (pattern != null) {
            builder.addQueryParam("name", pattern);
        }
        final Response response = send(builder, "listing tables");
        if (response.getStatusCode() == 404) {
            return ImmutableList.of();
        }
        checkStatus(response, "listing tables");
        final ImmutableList.Builder<String> names = ImmutableList.builder();
        for (final JsonNode item : readTree(response)) {
            final JsonNode name = item.has("name") ? item.get("name") : item.path("table_desc").path("name");
            names.add(name.asText());
        }
        return names.build();
    }

    @Override
    public void deleteTable(final String name) {
        sendChecked(request("DELETE", "/table/" + segment(name)), "deleting table " + name);
    }

    private static String metadataPath(final MetadataRecord record) {
        return segment(record.getTsuid()) + "/" + segment(record.getName()) + "/" + segment(record.getValue());
    }

    private static ObjectNode asObject(final JsonNode node, final String what) {
        if (!node.isObject()) {
            throw new ServerException(String.format("Expected a json object; resource=%s, body=%s", what, node));
        }
        return (ObjectNode) node;
    }

    private static <T> T treeToValue(final JsonNode node, final Class<T> type) {
        try {
            return getObjectMapper().treeToValue(node, type);
        } catch (final JsonProcessingException e) {
            throw new ServerException(
                    String.format("Unable to parse response; type=%s, body=%s", type.getSimpleName(), node),
                    e);
        }
    }

    static final int LOOKUP_CHUNK_SIZE = 100;
    private static final Joiner LIST_JOINER = Joiner.on(',');
    private static final TypeReference<List<DatasetRecord>> DATASET_LIST_TYPE_REFERENCE = new DatasetListTypeReference();
    private static final TypeReference<List<FunctionalIdentifier>> FID_LIST_TYPE_REFERENCE =
            new FunctionalIdentifierListTypeReference();
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpDatamodelClient.class);

    private static final class DatasetListTypeReference extends TypeReference<List<DatasetRecord>> { }

    private static final class FunctionalIdentifierListTypeReference extends TypeReference<List<FunctionalIdentifier>> { }
}
