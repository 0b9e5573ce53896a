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

import com.arpnetworking.commons.jackson.databind.ObjectMapperFactory;
import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;
import fr.cs.ikats.api.exceptions.BackendUnavailableException;
import fr.cs.ikats.api.exceptions.ConflictException;
import fr.cs.ikats.api.exceptions.IkatsException;
import fr.cs.ikats.api.exceptions.NotFoundException;
import fr.cs.ikats.api.exceptions.ServerException;
import fr.cs.ikats.api.exceptions.ValidationException;
import org.asynchttpclient.AsyncHttpClient;
import org.asynchttpclient.Request;
import org.asynchttpclient.RequestBuilder;
import org.asynchttpclient.Response;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.ExecutionException;

/**
 * Blocking request/response plumbing shared by the HTTP backend clients.
 * Maps transport failures and HTTP statuses to the
 * {@link IkatsException} family.
 *
 * @author CS Systemes d'Information
 */
abstract class HttpBackendClient {

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("uri", _uri)
                .put("requestTimeout", _requestTimeout)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    /**
     * Protected constructor.
     *
     * @param client Shared http client.
     * @param uri Root of the backend service.
     * @param requestTimeout Timeout applied to every request. Must fit in
     * an int number of milliseconds.
     * @throws ArithmeticException if the timeout does not fit
     */
    protected HttpBackendClient(final AsyncHttpClient client, final URI uri, final Duration requestTimeout) {
        _client = client;
        _uri = uri;
        _requestTimeout = requestTimeout;
        _requestTimeoutMillis = Math.toIntExact(requestTimeout.toMillis());
    }

    /**
     * Start a request on a path below the service root. Path segments must
     * already be escaped with {@link #segment(String)}.
     *
     * @param method The HTTP method.
     * @param path The path, starting with a slash.
     * @return A request builder.
     */
    protected RequestBuilder request(final String method, final String path) {
        return new RequestBuilder(method)
                .setUrl(_uri + path)
                .setRequestTimeout(_requestTimeoutMillis)
                .setHeader("Accept", "application/json");
    }

    /**
     * Execute a request and return the response whatever its status.
     *
     * @param builder The request.
     * @param action Description of the action for logs and errors.
     * @return The response.
     */
    protected Response send(final RequestBuilder builder, final String action) {
        final Request request = builder.build();
        LOGGER.trace()
                .setMessage("Sending request")
                .addData("action", action)
                .addData("method", request.getMethod())
                .addData("uri", request.getUrl())
                .log();
        try {
            final Response response = _client.executeRequest(request).get();
            if (LOGGER.isTraceEnabled()) {
                LOGGER.trace()
                        .setMessage("Received response")
                        .addData("action", action)
                        .addData("status", response.getStatusCode())
                        .addData("body", response.getResponseBody())
                        .log();
            }
            return response;
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendUnavailableException(
                    String.format("Interrupted while %s; uri=%s", action, request.getUrl()),
                    e);
        } catch (final ExecutionException e) {
            throw new BackendUnavailableException(
                    String.format("Request failed while %s; uri=%s", action, request.getUrl()),
                    e.getCause() == null ? e : e.getCause());
        }
    }

    /**
     * Execute a request and require a 2xx status.
     *
     * @param builder The request.
     * @param action Description of the action for logs and errors.
     * @return The successful response.
     */
    protected Response sendChecked(final RequestBuilder builder, final String action) {
        final Response response = send(builder, action);
        checkStatus(response, action);
        return response;
    }

    /**
     * Deserialize a response body.
     *
     * @param response The response.
     * @param type The target type.
     * @param <T> The target type.
     * @return The deserialized body.
     */
    protected <T> T readBody(final Response response, final Class<T> type) {
        try {
            return OBJECT_MAPPER.readValue(response.getResponseBody(), type);
        } catch (final IOException e) {
            throw new ServerException(
                    String.format("Unable to parse response; type=%s, responseBody=%s", type.getSimpleName(), response.getResponseBody()),
                    e);
        }
    }

    /**
     * Deserialize a response body.
     *
     * @param response The response.
     * @param type The target type.
     * @param <T> The target type.
     * @return The deserialized body.
     */
    protected <T> T readBody(final Response response, final TypeReference<T> type) {
        try {
            return OBJECT_MAPPER.readValue(response.getResponseBody(), type);
        } catch (final IOException e) {
            throw new ServerException(
                    String.format("Unable to parse response; type=%s, responseBody=%s", type.getType(), response.getResponseBody()),
                    e);
        }
    }

    /**
     * Parse a response body as a json tree. An empty body is read as a
     * missing node.
     *
     * @param response The response.
     * @return The json tree.
     */
    protected JsonNode readTree(final Response response) {
        final String body = response.getResponseBody();
        if (body == null || body.isEmpty()) {
            return OBJECT_MAPPER.missingNode();
        }
        try {
            return OBJECT_MAPPER.readTree(body);
        } catch (final IOException e) {
            throw new ServerException(String.format("Unable to parse response; responseBody=%s", body), e);
        }
    }

    /**
     * Escape a value used as one path segment.
     *
     * @param value The raw value.
     * @return The escaped value.
     */
    protected static String segment(final String value) {
        return PATH_SEGMENT_ESCAPER.escape(value);
    }

    /**
     * Raise the exception matching a non 2xx status.
     *
     * @param response The response.
     * @param action Description of the action.
     */
    static void checkStatus(final Response response, final String action) {
        final int status = response.getStatusCode();
        if (status / 100 == 2) {
            return;
        }
        final String message = String.format(
                "Received non 2xx response %s; uri=%s, status=%d, responseBody=%s",
                action,
                response.getUri(),
                status,
                response.getResponseBody());
        switch (status) {
            case 400:
                throw new ValidationException(message);
            case 404:
                throw new NotFoundException(message);
            case 409:
                throw new ConflictException(message);
            case 502:
            case 503:
            case 504:
                throw new BackendUnavailableException(message);
            default:
                if (status >= 500) {
                    throw new ServerException(message);
                }
                throw new IkatsException(message);
        }
    }

    static ObjectMapper getObjectMapper() {
        return OBJECT_MAPPER;
    }

    private final AsyncHttpClient _client;
    private final URI _uri;
    private final Duration _requestTimeout;
    private final int _requestTimeoutMillis;

    private static final Escaper PATH_SEGMENT_ESCAPER = UrlEscapers.urlPathSegmentEscaper();
    private static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.getInstance();
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpBackendClient.class);
}
