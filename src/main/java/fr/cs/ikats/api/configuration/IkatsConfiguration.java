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
package fr.cs.ikats.api.configuration;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;
import com.typesafe.config.Config;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.Range;
import net.sf.oval.constraint.ValidateWithMethod;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;

/**
 * Representation of the IKATS API configuration: where the backends are and
 * how to talk to them.
 *
 * @author CS Systemes d'Information
 */
public final class IkatsConfiguration {

    /**
     * Create a configuration from the {@code ikats} block of a Typesafe
     * {@link Config} tree. Missing keys fall back to the builder defaults.
     *
     * @param config The root configuration.
     * @return New {@link IkatsConfiguration} instance.
     */
    public static IkatsConfiguration fromConfig(final Config config) {
        final Builder builder = new Builder();
        if (!config.hasPath(ROOT_PATH)) {
            return builder.build();
        }
        final Config ikats = config.getConfig(ROOT_PATH);
        if (ikats.hasPath("host")) {
            builder.setHost(ikats.getString("host"));
        }
        if (ikats.hasPath("port")) {
            builder.setPort(ikats.getInt("port"));
        }
        if (ikats.hasPath("datamodelPath")) {
            builder.setDatamodelPath(ikats.getString("datamodelPath"));
        }
        if (ikats.hasPath("tsdbPath")) {
            builder.setTsdbPath(ikats.getString("tsdbPath"));
        }
        if (ikats.hasPath("catalogPath")) {
            builder.setCatalogPath(ikats.getString("catalogPath"));
        }
        if (ikats.hasPath("requestTimeout")) {
            builder.setRequestTimeout(ikats.getDuration("requestTimeout"));
        }
        if (ikats.hasPath("emulate")) {
            builder.setEmulate(ikats.getBoolean("emulate"));
        }
        if (ikats.hasPath("name")) {
            builder.setName(ikats.getString("name"));
        }
        return builder.build();
    }

    public String getHost() {
        return _host;
    }

    public int getPort() {
        return _port;
    }

    public String getDatamodelPath() {
        return _datamodelPath;
    }

    public String getTsdbPath() {
        return _tsdbPath;
    }

    public String getCatalogPath() {
        return _catalogPath;
    }

    public Duration getRequestTimeout() {
        return _requestTimeout;
    }

    public boolean isEmulate() {
        return _emulate;
    }

    public String getName() {
        return _name;
    }

    /**
     * Root of the datamodel (temporal data manager) web application.
     *
     * @return The datamodel {@link URI}.
     */
    public URI getDatamodelUri() {
        return URI.create(getBaseUrl() + _datamodelPath + DATAMODEL_ROOT);
    }

    /**
     * Root of the time series database HTTP API.
     *
     * @return The time series database {@link URI}.
     */
    public URI getTsdbUri() {
        return URI.create(getBaseUrl() + _tsdbPath);
    }

    /**
     * Root of the operator catalog web application.
     *
     * @return The catalog {@link URI}.
     */
    public URI getCatalogUri() {
        return URI.create(getBaseUrl() + _catalogPath + CATALOG_ROOT);
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("name", _name)
                .put("host", _host)
                .put("port", _port)
                .put("datamodelPath", _datamodelPath)
                .put("tsdbPath", _tsdbPath)
                .put("catalogPath", _catalogPath)
                .put("requestTimeout", _requestTimeout)
                .put("emulate", _emulate)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private String getBaseUrl() {
        return _host + ":" + _port;
    }

    private IkatsConfiguration(final Builder builder) {
        final String host = builder._host.toLowerCase(Locale.ROOT).startsWith("http")
                ? builder._host
                : "http://" + builder._host;
        _host = host.endsWith("/") ? host.substring(0, host.length() - 1) : host;
        _port = builder._port;
        _datamodelPath = builder._datamodelPath;
        _tsdbPath = builder._tsdbPath;
        _catalogPath = builder._catalogPath;
        _requestTimeout = builder._requestTimeout;
        _emulate = builder._emulate;
        _name = builder._name;
    }

    private final String _host;
    private final int _port;
    private final String _datamodelPath;
    private final String _tsdbPath;
    private final String _catalogPath;
    private final Duration _requestTimeout;
    private final boolean _emulate;
    private final String _name;

    private static final String ROOT_PATH = "ikats";
    private static final String DATAMODEL_ROOT = "/TemporalDataManagerWebApp/webapi";
    private static final String CATALOG_ROOT = "/ikats/algo/catalogue";

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link IkatsConfiguration}.
     */
    public static final class Builder extends OvalBuilder<IkatsConfiguration> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(IkatsConfiguration::new);
        }

        /**
         * The backend host, with or without scheme. Optional. Cannot be null
         * or empty. Default is {@code http://localhost}.
         *
         * @param value The host.
         * @return This instance of {@link Builder}.
         */
        public Builder setHost(final String value) {
            _host = value;
            return this;
        }

        /**
         * The backend port. Optional. Must be between 1 and 65535
         * (inclusive). Default is 80.
         *
         * @param value The port.
         * @return This instance of {@link Builder}.
         */
        public Builder setPort(final Integer value) {
            _port = value;
            return this;
        }

        /**
         * The path of the datamodel service behind the host. Optional.
         * Cannot be null. Default is {@code /datamodel}.
         *
         * @param value The path.
         * @return This instance of {@link Builder}.
         */
        public Builder setDatamodelPath(final String value) {
            _datamodelPath = value;
            return this;
        }

        /**
         * The path of the time series database behind the host. Optional.
         * Cannot be null. Default is {@code /tsdb}.
         *
         * @param value The path.
         * @return This instance of {@link Builder}.
         */
        public Builder setTsdbPath(final String value) {
            _tsdbPath = value;
            return this;
        }

        /**
         * The path of the catalog service behind the host. Optional. Cannot
         * be null. Default is {@code /pybase}.
         *
         * @param value The path.
         * @return This instance of {@link Builder}.
         */
        public Builder setCatalogPath(final String value) {
            _catalogPath = value;
            return this;
        }

        /**
         * The timeout applied to every backend request. Optional. Cannot be
         * null and must be positive. Default is 300 seconds.
         *
         * @param value The timeout.
         * @return This instance of {@link Builder}.
         */
        public Builder setRequestTimeout(final Duration value) {
            _requestTimeout = value;
            return this;
        }

        /**
         * Whether to use the in-memory backends instead of the remote ones.
         * Optional. Cannot be null. Default is false.
         *
         * @param value Whether to emulate the backends.
         * @return This instance of {@link Builder}.
         */
        public Builder setEmulate(final Boolean value) {
            _emulate = value;
            return this;
        }

        /**
         * The session name. Optional. Cannot be null or empty. Default is
         * {@code IKATS_SESSION}.
         *
         * @param value The session name.
         * @return This instance of {@link Builder}.
         */
        public Builder setName(final String value) {
            _name = value;
            return this;
        }

        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        private boolean validateRequestTimeout(final Duration requestTimeout) {
            return !requestTimeout.isNegative() && !requestTimeout.isZero();
        }

        @NotNull
        @NotEmpty
        private String _host = "http://localhost";
        @NotNull
        @Range(min = 1, max = 65535)
        private Integer _port = 80;
        @NotNull
        private String _datamodelPath = "/datamodel";
        @NotNull
        private String _tsdbPath = "/tsdb";
        @NotNull
        private String _catalogPath = "/pybase";
        @NotNull
        @ValidateWithMethod(methodName = "validateRequestTimeout", parameterType = Duration.class)
        private Duration _requestTimeout = Duration.ofSeconds(300);
        @NotNull
        private Boolean _emulate = false;
        @NotNull
        @NotEmpty
        private String _name = "IKATS_SESSION";
    }
}
