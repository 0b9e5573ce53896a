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

import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;
import com.google.common.base.Objects;

/**
 * Typed value of one metadata key. Values travel as text; the type tells how
 * to read them.
 *
 * @author CS Systemes d'Information
 */
public final class MetadataEntry {

    /**
     * Public constructor.
     *
     * @param value The value as text.
     * @param type The type.
     */
    public MetadataEntry(final String value, final MetadataType type) {
        _value = value;
        _type = type;
    }

    public String getValue() {
        return _value;
    }

    public MetadataType getType() {
        return _type;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final MetadataEntry other = (MetadataEntry) object;

        return Objects.equal(_value, other._value)
                && _type == other._type;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_value, _type);
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("value", _value)
                .put("type", _type)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private final String _value;
    private final MetadataType _type;
}
