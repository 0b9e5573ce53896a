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
package fr.cs.ikats.api.client.model;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;

import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Input, parameter or output of an implementation as sent by the catalog.
 *
 * @author CS Systemes d'Information
 */
@JsonDeserialize(builder = OperatorParameterRecord.Builder.class)
public final class OperatorParameterRecord {

    public String getName() {
        return _name;
    }

    public Optional<String> getLabel() {
        return Optional.ofNullable(_label);
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(_description);
    }

    public Optional<String> getType() {
        return Optional.ofNullable(_type);
    }

    public Optional<Integer> getOrder() {
        return Optional.ofNullable(_order);
    }

    public Optional<Object> getDefaultValue() {
        return Optional.ofNullable(_defaultValue);
    }

    public Optional<Object> getDomain() {
        return Optional.ofNullable(_domain);
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
                .put("type", _type)
                .put("order", _order)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private OperatorParameterRecord(final Builder builder) {
        _name = builder._name;
        _label = builder._label;
        _description = builder._description;
        _type = builder._type;
        _order = builder._order;
        _defaultValue = builder._defaultValue;
        _domain = builder._domain;
    }

    private final String _name;
    private final String _label;
    private final String _description;
    private final String _type;
    private final Integer _order;
    private final Object _defaultValue;
    private final Object _domain;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link OperatorParameterRecord}. Only the name is required.
     */
    @JsonPOJOBuilder(withPrefix = "set")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Builder extends OvalBuilder<OperatorParameterRecord> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(OperatorParameterRecord::new);
        }

        public Builder setName(final String value) {
            _name = value;
            return this;
        }

        public Builder setLabel(@Nullable final String value) {
            _label = value;
            return this;
        }

        public Builder setDescription(@Nullable final String value) {
            _description = value;
            return this;
        }

        public Builder setType(@Nullable final String value) {
            _type = value;
            return this;
        }

        public Builder setOrder(@Nullable final Integer value) {
            _order = value;
            return this;
        }

        /**
         * Set the default value, sent by the catalog as `default_value`.
         *
         * @param value The default value.
         * @return This {@link Builder} instance.
         */
        @JsonProperty("default_value")
        public Builder setDefaultValue(@Nullable final Object value) {
            _defaultValue = value;
            return this;
        }

        public Builder setDomain(@Nullable final Object value) {
            _domain = value;
            return this;
        }

        @NotNull
        @NotEmpty
        private String _name;
        private String _label;
        private String _description;
        private String _type;
        private Integer _order;
        private Object _defaultValue;
        private Object _domain;
    }
}
