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

import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Injector;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import fr.cs.ikats.api.configuration.IkatsConfiguration;
import fr.cs.ikats.api.manager.DatasetManager;
import fr.cs.ikats.api.manager.MetadataManager;
import fr.cs.ikats.api.manager.OperatorManager;
import fr.cs.ikats.api.manager.TableManager;
import fr.cs.ikats.api.manager.TimeseriesManager;
import org.asynchttpclient.AsyncHttpClient;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Entry point of the library. Exposes one manager per object family under a
 * short name and holds no other logic.
 *
 * <pre>
 * try (IkatsApi api = IkatsApi.create()) {
 *     final Dataset dataset = api.ds().get("portfolio");
 *     ...
 * }
 * </pre>
 *
 * @author CS Systemes d'Information
 */
public final class IkatsApi implements AutoCloseable {

    /**
     * Create a session from the {@code ikats} block of the application
     * configuration.
     *
     * @return The session.
     */
    public static IkatsApi create() {
        return create(ConfigFactory.load());
    }

    /**
     * Create a session from the {@code ikats} block of a configuration tree.
     *
     * @param config The configuration tree.
     * @return The session.
     */
    public static IkatsApi create(final Config config) {
        return create(IkatsConfiguration.fromConfig(config));
    }

    /**
     * Create a session.
     *
     * @param configuration The configuration.
     * @return The session.
     */
    public static IkatsApi create(final IkatsConfiguration configuration) {
        LOGGER.debug()
                .setMessage("Creating session")
                .addData("configuration", configuration)
                .log();
        final Injector injector = Guice.createInjector(new IkatsModule(configuration));
        return injector.getInstance(IkatsApi.class);
    }

    public DatasetManager ds() {
        return _datasetManager;
    }

    public TimeseriesManager ts() {
        return _timeseriesManager;
    }

    public MetadataManager md() {
        return _metadataManager;
    }

    public OperatorManager op() {
        return _operatorManager;
    }

    public TableManager table() {
        return _tableManager;
    }

    public IkatsConfiguration getConfiguration() {
        return _configuration;
    }

    /**
     * Release the HTTP client of the session, if one was created.
     */
    @Override
    public void close() {
        if (_configuration.isEmulate()) {
            return;
        }
        try {
            _injector.getInstance(AsyncHttpClient.class).close();
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
        LOGGER.debug()
                .setMessage("Session closed")
                .addData("name", _configuration.getName())
                .log();
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("configuration", _configuration)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    @Inject
    IkatsApi(
            final Injector injector,
            final IkatsConfiguration configuration,
            final DatasetManager datasetManager,
            final TimeseriesManager timeseriesManager,
            final MetadataManager metadataManager,
            final OperatorManager operatorManager,
            final TableManager tableManager) {
        _injector = injector;
        _configuration = configuration;
        _datasetManager = datasetManager;
        _timeseriesManager = timeseriesManager;
        _metadataManager = metadataManager;
        _operatorManager = operatorManager;
        _tableManager = tableManager;
    }

    private final Injector _injector;
    private final IkatsConfiguration _configuration;
    private final DatasetManager _datasetManager;
    private final TimeseriesManager _timeseriesManager;
    private final MetadataManager _metadataManager;
    private final OperatorManager _operatorManager;
    private final TableManager _tableManager;

    private static final Logger LOGGER = LoggerFactory.getLogger(IkatsApi.class);
}
