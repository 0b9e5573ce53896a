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
package fr.cs.ikats.api.client;

import fr.cs.ikats.api.client.model.PointsSummary;
import fr.cs.ikats.api.objects.DataPoint;

import java.util.List;

/**
 * Contract of the time series database. Only handles points; structural
 * information lives in the datamodel.
 *
 * @author CS Systemes d'Information
 */
public interface TimeseriesDbClient {

    /**
     * Allocate a new timeseries unique identifier.
     *
     * @param fid Functional identifier of the timeseries being created.
     * @return The new tsuid.
     */
    String assignTsuid(String fid);

    /**
     * Write points.
     *
     * @param tsuid The timeseries.
     * @param points The points sorted by timestamp; not empty.
     * @return The range and the number of points written.
     */
    PointsSummary addPoints(String tsuid, List<DataPoint> points);

    /**
     * Read the points of a range.
     *
     * @param tsuid The timeseries.
     * @param start First timestamp, inclusive, in milliseconds since epoch.
     * @param end Last timestamp, inclusive, in milliseconds since epoch.
     * @return The points sorted by timestamp.
     */
    List<DataPoint> readPoints(String tsuid, long start, long end);

    /**
     * Count the points stored for a timeseries.
     *
     * @param tsuid The timeseries.
     * @return The number of points.
     */
    long countPoints(String tsuid);
}
