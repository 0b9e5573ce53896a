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
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;

/**
 * Association between a timeseries unique identifier and its functional
 * identifier, as recorded by the datamodel.
 *
 * @author CS Systemes d'Information
 */
@JsonDeserialize(builder = FunctionalIdentifier.Builder.class)
public final class FunctionalIdentifier {

    public String getTsuid() {
        return _tsuid;
    }

    public String getFuncId() {
        return _funcId;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final FunctionalIdentifier other = (FunctionalIdentifier) object;

        return Objects.equal(_tsuid, other._tsuid)
                && Objects.equal(_funcId, other._funcId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_tsuid, _funcId);
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
                .put("funcId", _funcId)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private FunctionalIdentifier(final Builder builder) {
        _tsuid = builder._tsuid;
        _funcId = builder._funcId;
    }

    private final String _tsuid;
    private final String _funcId;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link FunctionalIdentifier}.
     */
    @JsonPOJOBuilder(withPrefix = "set")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Builder extends OvalBuilder<FunctionalIdentifier> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(FunctionalIdentifier::new);
        }

        /**
         * Set the timeseries unique identifier. Required. Cannot be null or empty.
         *
         * @param value The tsuid.
         * @return This {@link Builder} instance.
         */
        public Builder setTsuid(final String value) {
            _tsuid = value;
            return this;
        }

        /**
         * Set the functional identifier. Required. Cannot be null or empty.
         *
         * @param value The functional identifier.
         * @return This {@link Builder} instance.
         */
        public Builder setFuncId(final String value) {
            _funcId = value;
            return this;
        }

        @NotNull
        @NotEmpty
        private String _tsuid;
        @NotNull
        @NotEmpty
        private String _funcId;
    }
}
