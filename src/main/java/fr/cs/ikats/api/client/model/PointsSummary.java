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

import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;

/**
 * Outcome of writing points to the time series database: first and last
 * timestamps written and the number of points.
 *
 * @author CS Systemes d'Information
 */
public final class PointsSummary {

    /**
     * Public constructor.
     *
     * @param startDate First timestamp in milliseconds since epoch.
     * @param endDate Last timestamp in milliseconds since epoch.
     * @param count Number of points written.
     */
    public PointsSummary(final long startDate, final long endDate, final long count) {
        _startDate = startDate;
        _endDate = endDate;
        _count = count;
    }

    public long getStartDate() {
        return _startDate;
    }

    public long getEndDate() {
        return _endDate;
    }

    public long getCount() {
        return _count;
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("startDate", _startDate)
                .put("endDate", _endDate)
                .put("count", _count)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private final long _startDate;
    private final long _endDate;
    private final long _count;
}
