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

import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.collect.ImmutableList;
import fr.cs.ikats.api.client.model.OperatorRecord;
import org.asynchttpclient.AsyncHttpClient;
import org.asynchttpclient.Response;

import java.net.URI;
import java.time.Duration;
import java.util.List;

/**
 * {@link CatalogClient} talking to the catalog web application over HTTP.
 *
 * @author CS Systemes d'Information
 */
public final class HttpCatalogClient extends HttpBackendClient implements CatalogClient {

    /**
     * Public constructor.
     *
     * @param client Shared http client.
     * @param uri Root of the catalog api.
     * @param requestTimeout Timeout applied to every request.
     */
    public HttpCatalogClient(final AsyncHttpClient client, final URI uri, final Duration requestTimeout) {
        super(client, uri, requestTimeout);
    }

    @Override
    public List<OperatorRecord> listImplementations() {
        final Response response = send(request("GET", "/implementations"), "listing implementations");
        if (response.getStatusCode() == 404) {
            return ImmutableList.of();
        }
        checkStatus(response, "listing implementations");
        return readBody(response, OPERATOR_RECORD_LIST_TYPE_REFERENCE);
    }

    @Override
    public OperatorRecord readImplementation(final String name) {
        final Response response = sendChecked(
                request("GET", "/implementations/" + segment(name)),
                "reading implementation " + name);
        return readBody(response, OperatorRecord.class);
    }

    private static final TypeReference<List<OperatorRecord>> OPERATOR_RECORD_LIST_TYPE_REFERENCE =
            new OperatorRecordListTypeReference();

    private static final class OperatorRecordListTypeReference extends TypeReference<List<OperatorRecord>> { }
}
