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
import com.google.common.collect.ImmutableList;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;

import java.util.List;
import javax.annotation.Nullable;

/**
 * Dataset as stored by the datamodel. The listing route only fills the name
 * and the description; the read route also fills the member tsuids.
 *
 * @author CS Systemes d'Information
 */
@JsonDeserialize(builder = DatasetRecord.Builder.class)
public final class DatasetRecord {

    public String getName() {
        return _name;
    }

    public String getDescription() {
        return _description;
    }

    public ImmutableList<String> getTsuids() {
        return _tsuids;
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
                .put("description", _description)
                .put("tsuids", _tsuids)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private DatasetRecord(final Builder builder) {
        _name = builder._name;
        _description = builder._description;
        _tsuids = ImmutableList.copyOf(builder._tsuids);
    }

    private final String _name;
    private final String _description;
    private final ImmutableList<String> _tsuids;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link DatasetRecord}.
     */
    @JsonPOJOBuilder(withPrefix = "set")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Builder extends OvalBuilder<DatasetRecord> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(DatasetRecord::new);
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
         * Set the description. Optional. Null is read as empty. Default is empty.
         *
         * @param value The description.
         * @return This {@link Builder} instance.
         */
        public Builder setDescription(@Nullable final String value) {
            _description = value == null ? "" : value;
            return this;
        }

        /**
         * Set the members from their functional identifier records, as sent
         * by the datamodel. Optional. Null is read as empty.
         *
         * @param value The member records.
         * @return This {@link Builder} instance.
         */
        public Builder setFids(@Nullable final List<FunctionalIdentifier> value) {
            _tsuids = value == null
                    ? ImmutableList.of()
                    : value.stream().map(FunctionalIdentifier::getTsuid).collect(ImmutableList.toImmutableList());
            return this;
        }

        /**
         * Set the members. Optional. Null is read as empty. Default is empty.
         *
         * @param value The member tsuids.
         * @return This {@link Builder} instance.
         */
        public Builder setTsuids(@Nullable final List<String> value) {
            _tsuids = value == null ? ImmutableList.of() : value;
            return this;
        }

        @NotNull
        @NotEmpty
        private String _name;
        @NotNull
        private String _description = "";
        @NotNull
        private List<String> _tsuids = ImmutableList.of();
    }
}
