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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import fr.cs.ikats.api.exceptions.ValidationException;

import java.util.Locale;

/**
 * Data type of a metadata value as stored by the datamodel.
 *
 * @author CS Systemes d'Information
 */
public enum MetadataType {
    /**
     * Free text.
     */
    STRING,
    /**
     * Decimal or integral number.
     */
    NUMBER,
    /**
     * Date expressed as milliseconds since epoch.
     */
    DATE,
    /**
     * Structured value serialized as text.
     */
    COMPLEX;

    /**
     * Name of the type on the wire.
     *
     * @return The lower case wire value.
     */
    @JsonValue
    public String getWireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a wire value, case insensitive.
     *
     * @param value The wire value.
     * @return The matching {@link MetadataType}.
     */
    @JsonCreator
    public static MetadataType fromWireValue(final String value) {
        for (final MetadataType type : values()) {
            if (type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new ValidationException(String.format("Unknown metadata type; type=%s", value));
    }
}
