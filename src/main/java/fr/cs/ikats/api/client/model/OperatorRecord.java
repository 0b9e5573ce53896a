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
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Implementation as stored by the catalog. Absent text fields stay absent
 * here; defaults are applied when the record is turned into an operator.
 *
 * @author CS Systemes d'Information
 */
@JsonDeserialize(builder = OperatorRecord.Builder.class)
public final class OperatorRecord {

    public String getName() {
        return _name;
    }

    public Optional<Long> getId() {
        return Optional.ofNullable(_id);
    }

    public Optional<String> getLabel() {
        return Optional.ofNullable(_label);
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(_description);
    }

    public Optional<String> getFamily() {
        return Optional.ofNullable(_family);
    }

    public ImmutableList<OperatorParameterRecord> getInputs() {
        return _inputs;
    }

    public ImmutableList<OperatorParameterRecord> getParameters() {
        return _parameters;
    }

    public ImmutableList<OperatorParameterRecord> getOutputs() {
        return _outputs;
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
                .put("id", _id)
                .put("family", _family)
                .put("inputs", _inputs)
                .put("parameters", _parameters)
                .put("outputs", _outputs)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private OperatorRecord(final Builder builder) {
        _name = builder._name;
        _id = builder._id;
        _label = builder._label;
        _description = builder._description;
        _family = builder._family;
        _inputs = ImmutableList.copyOf(builder._inputs);
        _parameters = ImmutableList.copyOf(builder._parameters);
        _outputs = ImmutableList.copyOf(builder._outputs);
    }

    private final String _name;
    private final Long _id;
    private final String _label;
    private final String _description;
    private final String _family;
    private final ImmutableList<OperatorParameterRecord> _inputs;
    private final ImmutableList<OperatorParameterRecord> _parameters;
    private final ImmutableList<OperatorParameterRecord> _outputs;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link OperatorRecord}.
     */
    @JsonPOJOBuilder(withPrefix = "set")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Builder extends OvalBuilder<OperatorRecord> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(OperatorRecord::new);
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
         * Set the catalog identifier. Optional.
         *
         * @param value The identifier.
         * @return This {@link Builder} instance.
         */
        public Builder setId(@Nullable final Long value) {
            _id = value;
            return this;
        }

        /**
         * Set the label. Optional.
         *
         * @param value The label.
         * @return This {@link Builder} instance.
         */
        public Builder setLabel(@Nullable final String value) {
            _label = value;
            return this;
        }

        /**
         * Set the description. Optional.
         *
         * @param value The description.
         * @return This {@link Builder} instance.
         */
        public Builder setDescription(@Nullable final String value) {
            _description = value;
            return this;
        }

        /**
         * Set the family. Optional.
         *
         * @param value The family.
         * @return This {@link Builder} instance.
         */
        public Builder setFamily(@Nullable final String value) {
            _family = value;
            return this;
        }

        /**
         * Set the inputs. Optional. Null is read as empty.
         *
         * @param value The inputs.
         * @return This {@link Builder} instance.
         */
        public Builder setInputs(@Nullable final List<OperatorParameterRecord> value) {
            _inputs = value == null ? ImmutableList.of() : value;
            return this;
        }

        /**
         * Set the parameters. Optional. Null is read as empty.
         *
         * @param value The parameters.
         * @return This {@link Builder} instance.
         */
        public Builder setParameters(@Nullable final List<OperatorParameterRecord> value) {
            _parameters = value == null ? ImmutableList.of() : value;
            return this;
        }

        /**
         * Set the outputs. Optional. Null is read as empty.
         *
         * @param value The outputs.
         * @return This {@link Builder} instance.
         */
        public Builder setOutputs(@Nullable final List<OperatorParameterRecord> value) {
            _outputs = value == null ? ImmutableList.of() : value;
            return this;
        }

        @NotNull
        @NotEmpty
        private String _name;
        private Long _id;
        private String _label;
        private String _description;
        private String _family;
        @NotNull
        private List<OperatorParameterRecord> _inputs = ImmutableList.of();
        @NotNull
        private List<OperatorParameterRecord> _parameters = ImmutableList.of();
        @NotNull
        private List<OperatorParameterRecord> _outputs = ImmutableList.of();
    }
}
