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
package fr.cs.ikats.api;

import com.google.inject.AbstractModule;
import com.google.inject.Injector;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import fr.cs.ikats.api.client.CatalogClient;
import fr.cs.ikats.api.client.DatamodelClient;
import fr.cs.ikats.api.client.HttpCatalogClient;
import fr.cs.ikats.api.client.HttpDatamodelClient;
import fr.cs.ikats.api.client.HttpTimeseriesDbClient;
import fr.cs.ikats.api.client.InMemoryCatalogClient;
import fr.cs.ikats.api.client.InMemoryDatamodelClient;
import fr.cs.ikats.api.client.InMemoryTimeseriesDbClient;
import fr.cs.ikats.api.client.TimeseriesDbClient;
import fr.cs.ikats.api.configuration.IkatsConfiguration;
import fr.cs.ikats.api.manager.DatasetManager;
import fr.cs.ikats.api.manager.MetadataManager;
import fr.cs.ikats.api.manager.OperatorManager;
import fr.cs.ikats.api.manager.TableManager;
import fr.cs.ikats.api.manager.TimeseriesManager;
import org.asynchttpclient.AsyncHttpClient;
import org.asynchttpclient.DefaultAsyncHttpClient;
import org.asynchttpclient.DefaultAsyncHttpClientConfig;

/**
 * Guice module wiring the backend clients and the managers of one session.
 * The clients are either the HTTP adapters or, when emulating, the in memory
 * ones; the HTTP client is only created when an HTTP adapter needs it.
 *
 * @author CS Systemes d'Information
 */
public final class IkatsModule extends AbstractModule {

    /**
     * Public constructor.
     *
     * @param configuration The configuration.
     */
    public IkatsModule(final IkatsConfiguration configuration) {
        _configuration = configuration;
    }

    @Override
    protected void configure() {
        bind(IkatsConfiguration.class).toInstance(_configuration);
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private AsyncHttpClient provideHttpClient() {
        final DefaultAsyncHttpClientConfig.Builder clientConfigBuilder = new DefaultAsyncHttpClientConfig.Builder();
        clientConfigBuilder.setThreadPoolName(_configuration.getName() + "-http");
        clientConfigBuilder.setRequestTimeout(Math.toIntExact(_configuration.getRequestTimeout().toMillis()));
        return new DefaultAsyncHttpClient(clientConfigBuilder.build());
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private InMemoryTimeseriesDbClient provideInMemoryTimeseriesDbClient() {
        return new InMemoryTimeseriesDbClient();
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private TimeseriesDbClient provideTimeseriesDbClient(final Injector injector) {
        if (_configuration.isEmulate()) {
            return injector.getInstance(InMemoryTimeseriesDbClient.class);
        }
        return new HttpTimeseriesDbClient(
                injector.getInstance(AsyncHttpClient.class),
                _configuration.getTsdbUri(),
                _configuration.getRequestTimeout());
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private DatamodelClient provideDatamodelClient(final Injector injector) {
        if (_configuration.isEmulate()) {
            return new InMemoryDatamodelClient(injector.getInstance(InMemoryTimeseriesDbClient.class));
        }
        return new HttpDatamodelClient(
                injector.getInstance(AsyncHttpClient.class),
                _configuration.getDatamodelUri(),
                _configuration.getRequestTimeout());
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private CatalogClient provideCatalogClient(final Injector injector) {
        if (_configuration.isEmulate()) {
            return new InMemoryCatalogClient();
        }
        return new HttpCatalogClient(
                injector.getInstance(AsyncHttpClient.class),
                _configuration.getCatalogUri(),
                _configuration.getRequestTimeout());
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private MetadataManager provideMetadataManager(final DatamodelClient datamodel) {
        return new MetadataManager(datamodel);
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private TimeseriesManager provideTimeseriesManager(
            final DatamodelClient datamodel,
            final TimeseriesDbClient timeseriesDb,
            final MetadataManager metadataManager) {
        return new TimeseriesManager(datamodel, timeseriesDb, metadataManager);
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private DatasetManager provideDatasetManager(final DatamodelClient datamodel, final TimeseriesManager timeseriesManager) {
        return new DatasetManager(datamodel, timeseriesManager);
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private OperatorManager provideOperatorManager(final CatalogClient catalog) {
        return new OperatorManager(catalog);
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private TableManager provideTableManager(final DatamodelClient datamodel) {
        return new TableManager(datamodel);
    }

    private final IkatsConfiguration _configuration;
}
