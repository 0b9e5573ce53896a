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
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Objects;
import fr.cs.ikats.api.objects.MetadataType;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;

/**
 * One metadata entry of one timeseries as stored by the datamodel.
 *
 * @author CS Systemes d'Information
 */
@JsonDeserialize(builder = MetadataRecord.Builder.class)
public final class MetadataRecord {

    public String getTsuid() {
        return _tsuid;
    }

    public String getName() {
        return _name;
    }

    public String getValue() {
        return _value;
    }

    public MetadataType getDtype() {
        return _dtype;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final MetadataRecord other = (MetadataRecord) object;

        return Objects.equal(_tsuid, other._tsuid)
                && Objects.equal(_name, other._name)
                && Objects.equal(_value, other._value)
                && Objects.equal(_dtype, other._dtype);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_tsuid, _name, _value, _dtype);
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("tsuid", _tsuid)
                .put("name", _name)
                .put("value", _value)
                .put("dtype", _dtype)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private MetadataRecord(final Builder builder) {
        _tsuid = builder._tsuid;
        _name = builder._name;
        _value = builder._value;
        _dtype = builder._dtype;
    }

    private final String _tsuid;
    private final String _name;
    private final String _value;
    private final MetadataType _dtype;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link MetadataRecord}.
     */
    @JsonPOJOBuilder(withPrefix = "set")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Builder extends OvalBuilder<MetadataRecord> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(MetadataRecord::new);
        }

        /**
         * Set the owning timeseries. Required. Cannot be null or empty.
         *
         * @param value The tsuid.
         * @return This {@link Builder} instance.
         */
        public Builder setTsuid(final String value) {
            _tsuid = value;
            return this;
        }

        /**
         * Set the key. Required. Cannot be null or empty.
         *
         * @param value The key.
         * @return This {@link Builder} instance.
         */
        public Builder setName(final String value) {
            _name = value;
            return this;
        }

        /**
         * Set the value in its textual form. Required. Cannot be null.
         *
         * @param value The value.
         * @return This {@link Builder} instance.
         */
        public Builder setValue(final String value) {
            _value = value;
            return this;
        }

        /**
         * Set the data type. Optional. Cannot be null. Default is
         * {@link MetadataType#STRING}.
         *
         * @param value The data type.
         * @return This {@link Builder} instance.
         */
        public Builder setDtype(final MetadataType value) {
            _dtype = value;
            return this;
        }

        @NotNull
        @NotEmpty
        private String _tsuid;
        @NotNull
        @NotEmpty
        private String _name;
        @NotNull
        private String _value;
        @NotNull
        private MetadataType _dtype = MetadataType.STRING;
    }
}
