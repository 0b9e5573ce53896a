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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import fr.cs.ikats.api.client.model.DatasetRecord;
import fr.cs.ikats.api.client.model.FunctionalIdentifier;
import fr.cs.ikats.api.client.model.MetadataRecord;
import fr.cs.ikats.api.exceptions.BackendUnavailableException;
import fr.cs.ikats.api.exceptions.ConflictException;
import fr.cs.ikats.api.exceptions.IkatsException;
import fr.cs.ikats.api.exceptions.NotFoundException;
import fr.cs.ikats.api.exceptions.ServerException;
import fr.cs.ikats.api.exceptions.ValidationException;
import fr.cs.ikats.api.objects.MetadataType;
import org.asynchttpclient.AsyncHttpClient;
import org.asynchttpclient.DefaultAsyncHttpClient;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Tests for the {@link HttpDatamodelClient} class.
 *
 * @author CS Systemes d'Information
 */
public class HttpDatamodelClientTest {

    @Before
    public void setUp() {
        _wireMockServer = new WireMockServer(0);
        _wireMockServer.start();
        _wireMock = new WireMock(_wireMockServer.port());
        _httpClient = new DefaultAsyncHttpClient();
        _client = new HttpDatamodelClient(
                _httpClient,
                URI.create("http://localhost:" + _wireMockServer.port() + PATH),
                Duration.ofSeconds(5));
    }

    @After
    public void tearDown() throws IOException {
        _httpClient.close();
        _wireMockServer.stop();
    }

    @Test
    public void testCreateDataset() {
        _wireMock.register(WireMock.post(WireMock.urlEqualTo(PATH + "/dataset/import/my_ds"))
                .willReturn(WireMock.aResponse().withStatus(200)));

        _client.createDataset("my_ds", "Some description", ImmutableList.of("T1", "T2"));

        _wireMock.verifyThat(1, WireMock.postRequestedFor(WireMock.urlEqualTo(PATH + "/dataset/import/my_ds"))
                .withRequestBody(WireMock.containing("name=my_ds"))
                .withRequestBody(WireMock.containing("description=Some+description"))
                .withRequestBody(WireMock.containing("tsuidList=T1%2CT2")));
    }

    @Test(expected = ConflictException.class)
    public void testCreateDatasetConflict() {
        _wireMock.register(WireMock.post(WireMock.urlEqualTo(PATH + "/dataset/import/my_ds"))
                .willReturn(WireMock.aResponse().withStatus(409)));
        _client.createDataset("my_ds", "", ImmutableList.of("T1"));
    }

    @Test
    public void testReadDataset() {
        _wireMock.register(WireMock.get(WireMock.urlEqualTo(PATH + "/dataset/my_ds"))
                .willReturn(WireMock.aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"description\":\"desc\",\"fids\":["
                                + "{\"tsuid\":\"T1\",\"funcId\":\"F1\"},"
                                + "{\"tsuid\":\"T2\",\"funcId\":\"F2\"}]}")));

        final DatasetRecord record = _client.readDataset("my_ds");
        Assert.assertEquals("my_ds", record.getName());
        Assert.assertEquals("desc", record.getDescription());
        Assert.assertEquals(ImmutableList.of("T1", "T2"), record.getTsuids());
    }

    @Test(expected = NotFoundException.class)
    public void testReadDatasetNotFound() {
        _wireMock.register(WireMock.get(WireMock.urlEqualTo(PATH + "/dataset/my_ds"))
                .willReturn(WireMock.aResponse().withStatus(404)));
        _client.readDataset("my_ds");
    }

    @Test(expected = ValidationException.class)
    public void testBadRequest() {
        _wireMock.register(WireMock.delete(WireMock.urlEqualTo(PATH + "/table/my_table"))
                .willReturn(WireMock.aResponse().withStatus(400)));
        _client.deleteTable("my_table");
    }

    @Test(expected = BackendUnavailableException.class)
    public void testServiceUnavailable() {
        _wireMock.register(WireMock.get(WireMock.urlEqualTo(PATH + "/dataset/my_ds"))
                .willReturn(WireMock.aResponse().withStatus(503)));
        _client.readDataset("my_ds");
    }

    @Test(expected = ServerException.class)
    public void testServerError() {
        _wireMock.register(WireMock.get(WireMock.urlEqualTo(PATH + "/dataset/my_ds"))
                .willReturn(WireMock.aResponse().withStatus(500)));
        _client.readDataset("my_ds");
    }

    @Test
    public void testUnexpectedStatus() {
        _wireMock.register(WireMock.get(WireMock.urlEqualTo(PATH + "/dataset/my_ds"))
                .willReturn(WireMock.aResponse().withStatus(418)));
        try {
            _client.readDataset("my_ds");
            Assert.fail("Expected exception to be thrown");
        } catch (final IkatsException e) {
            Assert.assertEquals(IkatsException.class, e.getClass());
        }
    }

    @Test
    public void testListDatasetsEmpty() {
        _wireMock.register(WireMock.get(WireMock.urlEqualTo(PATH + "/dataset"))
                .willReturn(WireMock.aResponse().withStatus(404)));
        Assert.assertTrue(_client.listDatasets().isEmpty());
    }

    @Test
    public void testDeleteDatasetDeep() {
        _wireMock.register(WireMock.delete(WireMock.urlPathEqualTo(PATH + "/dataset/my_ds"))
                .willReturn(WireMock.aResponse().withStatus(204)));
        _client.deleteDataset("my_ds", true);
        _wireMock.verifyThat(1, WireMock.deleteRequestedFor(WireMock.urlPathEqualTo(PATH + "/dataset/my_ds"))
                .withQueryParam("deep", WireMock.equalTo("true")));
    }

    @Test
    public void testReadFunctionalIdentifier() {
        _wireMock.register(WireMock.get(WireMock.urlEqualTo(PATH + "/metadata/funcId/T1"))
                .willReturn(WireMock.aResponse()
                        .withStatus(200)
                        .withBody("{\"tsuid\":\"T1\",\"funcId\":\"F1\",\"id\":42}")));
        Assert.assertEquals(
                new FunctionalIdentifier.Builder().setTsuid("T1").setFuncId("F1").build(),
                _client.readFunctionalIdentifier("T1"));
    }

    @Test(expected = NotFoundException.class)
    public void testReadFunctionalIdentifierEmptyBody() {
        _wireMock.register(WireMock.get(WireMock.urlEqualTo(PATH + "/metadata/funcId/T1"))
                .willReturn(WireMock.aResponse().withStatus(200)));
        _client.readFunctionalIdentifier("T1");
    }

    @Test
    public void testMatchTimeseries() {
        _wireMock.register(WireMock.get(WireMock.urlPathEqualTo(PATH + "/metadata/tsmatch"))
                .willReturn(WireMock.aResponse()
                        .withStatus(200)
                        .withBody("[\"T1\",{\"tsuid\":\"T2\"}]")));
        Assert.assertEquals(
                ImmutableList.of("T1", "T2"),
                _client.matchTimeseries(ImmutableMap.<String, List<String>>of("unit", ImmutableList.of("kW"))));
        _wireMock.verifyThat(1, WireMock.getRequestedFor(WireMock.urlPathEqualTo(PATH + "/metadata/tsmatch"))
                .withQueryParam("unit", WireMock.equalTo("kW")));
    }

    @Test
    public void testCreateMetadata() {
        _wireMock.register(WireMock.post(WireMock.urlPathEqualTo(PATH + "/metadata/import/T1/unit/kW"))
                .willReturn(WireMock.aResponse().withStatus(200)));
        _client.createMetadata(new MetadataRecord.Builder()
                .setTsuid("T1")
                .setName("unit")
                .setValue("kW")
                .setDtype(MetadataType.STRING)
                .build());
        _wireMock.verifyThat(1, WireMock.postRequestedFor(WireMock.urlPathEqualTo(PATH + "/metadata/import/T1/unit/kW"))
                .withQueryParam("dtype", WireMock.equalTo("string")));
    }

    @Test
    public void testLookupMetadataChunks() {
        _wireMock.register(WireMock.get(WireMock.urlPathEqualTo(PATH + "/metadata/list/json"))
                .willReturn(WireMock.aResponse()
                        .withStatus(200)
                        .withBody("[{\"tsuid\":\"T0\",\"name\":\"unit\",\"value\":\"kW\",\"dtype\":\"string\"}]")));
        final List<String> tsuids = IntStream.range(0, HttpDatamodelClient.LOOKUP_CHUNK_SIZE + 1)
                .mapToObj(i -> "T" + i)
                .collect(Collectors.toList());

        final List<MetadataRecord> records = _client.lookupMetadata(tsuids);

        _wireMock.verifyThat(2, WireMock.getRequestedFor(WireMock.urlPathEqualTo(PATH + "/metadata/list/json")));
        Assert.assertEquals(2, records.size());
        Assert.assertEquals(MetadataType.STRING, records.get(0).getDtype());
    }

    @Test
    public void testCreateTable() {
        _wireMock.register(WireMock.post(WireMock.urlEqualTo(PATH + "/table"))
                .willReturn(WireMock.aResponse().withStatus(200)));
        final String table = "{\"table_desc\":{\"name\":\"my_table\"},\"content\":{\"cells\":[[1]]}}";

        _client.createTable((ObjectNode) readJson(table));

        _wireMock.verifyThat(1, WireMock.postRequestedFor(WireMock.urlEqualTo(PATH + "/table"))
                .withHeader("Content-Type", WireMock.containing("application/json"))
                .withRequestBody(WireMock.equalToJson(table)));
    }

    @Test
    public void testListTables() {
        _wireMock.register(WireMock.get(WireMock.urlPathEqualTo(PATH + "/table"))
                .willReturn(WireMock.aResponse()
                        .withStatus(200)
                        .withBody("[{\"name\":\"a\"},{\"table_desc\":{\"name\":\"b\"}}]")));
        Assert.assertEquals(ImmutableList.of("a", "b"), _client.listTables("*", false));
        _wireMock.verifyThat(1, WireMock.getRequestedFor(WireMock.urlPathEqualTo(PATH + "/table"))
                .withQueryParam("name", WireMock.equalTo("*"))
                .withQueryParam("strict", WireMock.equalTo("false")));
    }

    private static JsonNode readJson(final String json) {
        try {
            return HttpBackendClient.getObjectMapper().readTree(json);
        } catch (final IOException e) {
            throw new IllegalArgumentException(e);
        }
    }

    private WireMockServer _wireMockServer;
    private WireMock _wireMock;
    private AsyncHttpClient _httpClient;
    private HttpDatamodelClient _client;

    private static final String PATH = "/datamodel";
}
