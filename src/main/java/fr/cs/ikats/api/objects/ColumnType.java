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
import javax.annotation.Nullable;

/**
 * Optional typing of a table column.
 *
 * @author CS Systemes d'Information
 */
public enum ColumnType {
    STRING {
        @Override
        public boolean accepts(@Nullable final Object value) {
            return value == null || value instanceof CharSequence;
        }
    },
    NUMBER {
        @Override
        public boolean accepts(@Nullable final Object value) {
            return value == null || value instanceof Number;
        }
    },
    BOOLEAN {
        @Override
        public boolean accepts(@Nullable final Object value) {
            return value == null || value instanceof Boolean;
        }
    };

    /**
     * Whether a cell value conforms to this column type. A missing value
     * conforms to every type.
     *
     * @param value The cell value.
     * @return True if and only if the value can be stored in the column.
     */
    public abstract boolean accepts(@Nullable Object value);

    @JsonValue
    public String getWireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a wire value, case insensitive.
     *
     * @param value The wire value.
     * @return The matching {@link ColumnType}.
     */
    @JsonCreator
    public static ColumnType fromWireValue(final String value) {
        for (final ColumnType type : values()) {
            if (type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new ValidationException(String.format("Unknown column type; type=%s", value));
    }
}
