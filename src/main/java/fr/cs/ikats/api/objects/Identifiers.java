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

import fr.cs.ikats.api.exceptions.ValidationException;

import javax.annotation.Nullable;

/**
 * Well-formedness rules of object identifiers.
 *
 * @author CS Systemes d'Information
 */
public final class Identifiers {

    /**
     * Check a dataset name: not empty, no whitespace.
     *
     * @param name The name.
     * @return The name.
     */
    public static String checkDatasetName(@Nullable final String name) {
        return checkName("dataset name", name, 1);
    }

    /**
     * Check a table name: not empty, no whitespace.
     *
     * @param name The name.
     * @return The name.
     */
    public static String checkTableName(@Nullable final String name) {
        return checkName("table name", name, 1);
    }

    /**
     * Check a functional identifier: at least 3 characters, no whitespace.
     *
     * @param fid The functional identifier.
     * @return The functional identifier.
     */
    public static String checkFid(@Nullable final String fid) {
        return checkName("functional identifier", fid, MIN_FID_LENGTH);
    }

    private static String checkName(final String what, @Nullable final String value, final int minLength) {
        if (value == null) {
            throw new ValidationException(String.format("Missing %s", what));
        }
        if (value.length() < minLength) {
            throw new ValidationException(String.format("The %s is too short; value=%s, minLength=%d", what, value, minLength));
        }
        if (value.chars().anyMatch(Character::isWhitespace)) {
            throw new ValidationException(String.format("The %s contains whitespace; value=%s", what, value));
        }
        return value;
    }

    private Identifiers() {}

    private static final int MIN_FID_LENGTH = 3;
}
