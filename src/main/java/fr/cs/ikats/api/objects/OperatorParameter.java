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
package fr.cs.ikats.api.objects;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;

import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Declared input, parameter or output of an {@link Operator}.
 *
 * @author CS Systemes d'Information
 */
public final class OperatorParameter {

    public String getName() {
        return _name;
    }

    public String getLabel() {
        return _label;
    }

    public String getDescription() {
        return _description;
    }

    public String getType() {
        return _type;
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
                .put("label", _label)
                .put("type", _type)
                .put("order", _order)
                .put("defaultValue", _defaultValue)
                .put("domain", _domain)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private OperatorParameter(final Builder builder) {
        _name = builder._name;
        _label = builder._label == null ? builder._name : builder._label;
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
     * {@link OperatorParameter}.
     */
    public static final class Builder extends OvalBuilder<OperatorParameter> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(OperatorParameter::new);
        }

        /**
         * Set the name. Required. Cannot be null or empty.
         *
         * @param value The name.
         * @return This {@link Builder} instance.
         */
        public Builder setName(final String value) {
            _name = value;
            return this;
        }

        /**
         * Set the display label. Optional. Defaults to the name.
         *
         * @param value The label.
         * @return This {@link Builder} instance.
         */
        public Builder setLabel(@Nullable final String value) {
            _label = value;
            return this;
        }

        /**
         * Set the description. Optional. Default is empty.
         *
         * @param value The description.
         * @return This {@link Builder} instance.
         */
        public Builder setDescription(@Nullable final String value) {
            _description = value == null ? "" : value;
            return this;
        }

        /**
         * Set the declared type. Optional. Default is empty.
         *
         * @param value The type.
         * @return This {@link Builder} instance.
         */
        public Builder setType(@Nullable final String value) {
            _type = value == null ? "" : value;
            return this;
        }

        /**
         * Set the position among its siblings. Optional.
         *
         * @param value The order.
         * @return This {@link Builder} instance.
         */
        public Builder setOrder(@Nullable final Integer value) {
            _order = value;
            return this;
        }

        /**
         * Set the default value. Optional.
         *
         * @param value The default value.
         * @return This {@link Builder} instance.
         */
        public Builder setDefaultValue(@Nullable final Object value) {
            _defaultValue = value;
            return this;
        }

        /**
         * Set the domain of accepted values. Optional.
         *
         * @param value The domain.
         * @return This {@link Builder} instance.
         */
        public Builder setDomain(@Nullable final Object value) {
            _domain = value;
            return this;
        }

        @NotNull
        @NotEmpty
        private String _name;
        private String _label;
        @NotNull
        private String _description = "";
        @NotNull
        private String _type = "";
        private Integer _order;
        private Object _defaultValue;
        private Object _domain;
    }
}
