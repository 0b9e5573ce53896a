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
package fr.cs.ikats.api.manager;

import com.google.common.collect.ImmutableList;
import org.junit.Assert;
import org.junit.Test;

import java.util.Iterator;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Tests for the {@link LazyListing} class.
 *
 * @author CS Systemes d'Information
 */
public class LazyListingTest {

    @Test
    public void testNothingQueriedAtCreation() {
        final AtomicInteger queries = new AtomicInteger();
        LazyListing.of(() -> {
            queries.incrementAndGet();
            return ImmutableList.of("a");
        });
        Assert.assertEquals(0, queries.get());
    }

    @Test
    public void testEveryIterationQueriesAgain() {
        final AtomicInteger queries = new AtomicInteger();
        final LazyListing<String> listing = LazyListing.of(() -> {
            queries.incrementAndGet();
            return ImmutableList.of("a", "b");
        });
        Assert.assertEquals(ImmutableList.of("a", "b"), listing.toList());
        Assert.assertEquals("a,b", listing.stream().collect(Collectors.joining(",")));
        Assert.assertEquals(2, queries.get());
    }

    @Test
    public void testHydrationIsLazy() {
        final AtomicInteger hydrated = new AtomicInteger();
        final LazyListing<Integer> listing = LazyListing.of(
                () -> ImmutableList.of("1", "22", "333"),
                key -> {
                    hydrated.incrementAndGet();
                    return key.length();
                });
        final Iterator<Integer> iterator = listing.iterator();
        Assert.assertEquals(0, hydrated.get());
        Assert.assertEquals(Integer.valueOf(1), iterator.next());
        Assert.assertEquals(1, hydrated.get());
        Assert.assertEquals(ImmutableList.of(1, 2, 3), listing.toList());
    }

    @Test
    public void testEmpty() {
        Assert.assertTrue(LazyListing.<String>of(ImmutableList::of).toList().isEmpty());
        Assert.assertFalse(LazyListing.<String>fromIterator(() -> ImmutableList.<String>of().iterator()).iterator().hasNext());
    }
}
