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
package fr.cs.ikats.api.test;

import com.google.common.collect.ImmutableList;
import fr.cs.ikats.api.client.model.OperatorParameterRecord;
import fr.cs.ikats.api.client.model.OperatorRecord;
import fr.cs.ikats.api.objects.DataPoint;

import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.UUID;

/**
 * Creates reasonable random instances of common data types for testing. This is
 * strongly preferred over mocking data type classes as mocking should be
 * reserved for defining behavior and not data.
 *
 * @author CS Systemes d'Information
 */
public final class TestBeanFactory {

    /**
     * Create a new pseudo-random tsuid.
     *
     * @return New pseudo-random tsuid.
     */
    public static String createTsuid() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 24).toUpperCase(Locale.ROOT);
    }

    /**
     * Create a new pseudo-random functional identifier.
     *
     * @return New pseudo-random functional identifier.
     */
    public static String createFid() {
        return "fid_" + UUID.randomUUID();
    }

    /**
     * Create a new pseudo-random name usable for datasets and tables.
     *
     * @return New pseudo-random name.
     */
    public static String createName() {
        return "name_" + UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * Create pseudo-random points with strictly increasing timestamps.
     *
     * @param start Timestamp of the first point.
     * @param count Number of points.
     * @return New points.
     */
    public static List<DataPoint> createPoints(final long start, final int count) {
        final ImmutableList.Builder<DataPoint> points = ImmutableList.builder();
        for (int i = 0; i < count; ++i) {
            points.add(new DataPoint(start + i * 1000L, RANDOM.nextDouble()));
        }
        return points.build();
    }

    /**
     * Create a builder for pseudo-random {@link OperatorRecord}.
     *
     * @return New builder for pseudo-random {@link OperatorRecord}.
     */
    public static OperatorRecord.Builder createOperatorRecordBuilder() {
        return new OperatorRecord.Builder()
                .setName("operator_" + UUID.randomUUID())
                .setId(RANDOM.nextLong())
                .setLabel("label-" + UUID.randomUUID())
                .setDescription("description-" + UUID.randomUUID())
                .setFamily("family-" + UUID.randomUUID())
                .setInputs(ImmutableList.of(createOperatorParameterRecord()))
                .setParameters(ImmutableList.of(createOperatorParameterRecord()))
                .setOutputs(ImmutableList.of(createOperatorParameterRecord()));
    }

    /**
     * Create a new reasonable pseudo-random {@link OperatorRecord}.
     *
     * @return New reasonable pseudo-random {@link OperatorRecord}.
     */
    public static OperatorRecord createOperatorRecord() {
        return createOperatorRecordBuilder().build();
    }

    /**
     * Create a new reasonable pseudo-random {@link OperatorParameterRecord}.
     *
     * @return New reasonable pseudo-random {@link OperatorParameterRecord}.
     */
    public static OperatorParameterRecord createOperatorParameterRecord() {
        return new OperatorParameterRecord.Builder()
                .setName("parameter_" + UUID.randomUUID())
                .setType("number")
                .setOrder(RANDOM.nextInt(10))
                .setDefaultValue(RANDOM.nextInt(100))
                .build();
    }

    private TestBeanFactory() {}

    private static final Random RANDOM = new Random();
}
