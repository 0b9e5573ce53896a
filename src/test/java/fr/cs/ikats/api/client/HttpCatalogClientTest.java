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

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import fr.cs.ikats.api.client.model.OperatorParameterRecord;
import fr.cs.ikats.api.client.model.OperatorRecord;
import fr.cs.ikats.api.exceptions.NotFoundException;
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
import java.util.Optional;

/**
 * Tests for the {@link HttpCatalogClient} class.
 *
 * @author CS Systemes d'Information
 */
public class HttpCatalogClientTest {

    @Before
    public void setUp() {
        _wireMockServer = new WireMockServer(0);
        _wireMockServer.start();
        _wireMock = new WireMock(_wireMockServer.port());
        _httpClient = new DefaultAsyncHttpClient();
        _client = new HttpCatalogClient(
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
    public void testReadImplementation() {
        _wireMock.register(WireMock.get(WireMock.urlEqualTo(PATH + "/implementations/cut_ds"))
                .willReturn(WireMock.aResponse()
                        .withStatus(200)
                        .withBody(OPERATOR_JSON)));

        final OperatorRecord operator = _client.readImplementation("cut_ds");
        Assert.assertEquals("cut_ds", operator.getName());
        Assert.assertEquals(Optional.of(12L), operator.getId());
        Assert.assertEquals(Optional.of("Cut dataset"), operator.getLabel());
        Assert.assertEquals(Optional.of("Preprocessing"), operator.getFamily());
        Assert.assertEquals(1, operator.getInputs().size());
        Assert.assertEquals(0, operator.getOutputs().size());

        final OperatorParameterRecord parameter = operator.getParameters().get(0);
        Assert.assertEquals("start", parameter.getName());
        Assert.assertEquals(Optional.of("number"), parameter.getType());
        Assert.assertEquals(Optional.empty(), parameter.getLabel());
        Assert.assertEquals(Optional.of(1), parameter.getOrder());
        Assert.assertEquals(Optional.of(0), parameter.getDefaultValue());
    }

    @Test(expected = NotFoundException.class)
    public void testReadImplementationNotFound() {
        _wireMock.register(WireMock.get(WireMock.urlEqualTo(PATH + "/implementations/cut_ds"))
                .willReturn(WireMock.aResponse().withStatus(404)));
        _client.readImplementation("cut_ds");
    }

    @Test
    public void testListImplementations() {
        _wireMock.register(WireMock.get(WireMock.urlEqualTo(PATH + "/implementations"))
                .willReturn(WireMock.aResponse()
                        .withStatus(200)
                        .withBody("[" + OPERATOR_JSON + "]")));
        final List<OperatorRecord> operators = _client.listImplementations();
        Assert.assertEquals(1, operators.size());
        Assert.assertEquals("cut_ds", operators.get(0).getName());
    }

    @Test
    public void testListImplementationsEmpty() {
        _wireMock.register(WireMock.get(WireMock.urlEqualTo(PATH + "/implementations"))
                .willReturn(WireMock.aResponse().withStatus(404)));
        Assert.assertTrue(_client.listImplementations().isEmpty());
    }

    @Test(expected = ArithmeticException.class)
    public void testRequestTimeoutMustFitInMilliseconds() {
        new HttpCatalogClient(
                _httpClient,
                URI.create("http://localhost:" + _wireMockServer.port() + PATH),
                Duration.ofDays(30));
    }

    @Test
    public void testLongestRequestTimeout() {
        _wireMock.register(WireMock.get(WireMock.urlEqualTo(PATH + "/implementations"))
                .willReturn(WireMock.aResponse().withStatus(200).withBody("[]")));
        final HttpCatalogClient client = new HttpCatalogClient(
                _httpClient,
                URI.create("http://localhost:" + _wireMockServer.port() + PATH),
                Duration.ofMillis(Integer.MAX_VALUE));
        Assert.assertTrue(client.listImplementations().isEmpty());
    }

    private WireMockServer _wireMockServer;
    private WireMock _wireMock;
    private AsyncHttpClient _httpClient;
    private HttpCatalogClient _client;

    private static final String PATH = "/pybase/ikats/algo/catalogue";
    private static final String OPERATOR_JSON = "{\"name\":\"cut_ds\",\"id\":12,\"label\":\"Cut dataset\","
            + "\"description\":\"Cut every timeseries of a dataset\",\"family\":\"Preprocessing\","
            + "\"inputs\":[{\"name\":\"ds_name\",\"type\":\"ds_name\",\"order\":0}],"
            + "\"parameters\":[{\"name\":\"start\",\"type\":\"number\",\"order\":1,\"default_value\":0,\"unknown\":true}],"
            + "\"outputs\":[],\"visibility\":true}";
}
