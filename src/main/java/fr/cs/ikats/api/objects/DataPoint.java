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
 * One timestamped value of a timeseries.
 *
 * @author CS Systemes d'Information
 */
public final class DataPoint {

    /**
     * Public constructor.
     *
     * @param timestamp Milliseconds since epoch.
     * @param value The value.
     */
    public DataPoint(final long timestamp, final double value) {
        _timestamp = timestamp;
        _value = value;
    }

    public long getTimestamp() {
        return _timestamp;
    }

    public double getValue() {
        return _value;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final DataPoint other = (DataPoint) object;

        return _timestamp == other._timestamp
                && Double.compare(_value, other._value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_timestamp, _value);
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("timestamp", _timestamp)
                .put("value", _value)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private final long _timestamp;
    private final double _value;
}
