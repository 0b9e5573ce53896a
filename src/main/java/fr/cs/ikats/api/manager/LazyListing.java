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
import com.google.common.collect.Iterators;

import java.util.Iterator;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Finite and restartable sequence of objects read from a backend. Nothing is
 * queried when the listing is created; every iteration runs the query again
 * and no cursor survives between iterations.
 *
 * @param <T> The listed type.
 * @author CS Systemes d'Information
 */
public final class LazyListing<T> implements Iterable<T> {

    /**
     * Listing over a query returning the objects.
     *
     * @param query The query.
     * @param <T> The listed type.
     * @return The listing.
     */
    public static <T> LazyListing<T> of(final Supplier<? extends Iterable<T>> query) {
        return new LazyListing<>(() -> query.get().iterator());
    }

    /**
     * Listing over a query returning keys, each key being hydrated into an
     * object only when the iteration reaches it.
     *
     * @param keys The key query.
     * @param hydrate The hydration of one key.
     * @param <K> The key type.
     * @param <T> The listed type.
     * @return The listing.
     */
    public static <K, T> LazyListing<T> of(
            final Supplier<? extends Iterable<K>> keys,
            final Function<? super K, ? extends T> hydrate) {
        return new LazyListing<>(() -> Iterators.transform(keys.get().iterator(), hydrate::apply));
    }

    /**
     * Listing over a query building its own iterator.
     *
     * @param query The query.
     * @param <T> The listed type.
     * @return The listing.
     */
    public static <T> LazyListing<T> fromIterator(final Supplier<? extends Iterator<T>> query) {
        return new LazyListing<>(query::get);
    }

    @Override
    public Iterator<T> iterator() {
        return _query.get();
    }

    /**
     * Stream over a fresh run of the query.
     *
     * @return The stream.
     */
    public Stream<T> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    /**
     * Run the query and hydrate every object.
     *
     * @return The objects.
     */
    public ImmutableList<T> toList() {
        return ImmutableList.copyOf(iterator());
    }

    private LazyListing(final Supplier<Iterator<T>> query) {
        _query = query;
    }

    private final Supplier<Iterator<T>> _query;
}
