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
package fr.cs.ikats.api.exceptions;

import java.io.Serial;

/**
 * Base of the functional errors raised by the IKATS API. Catch it to handle every
 * backend or validation failure at once, or catch one of its specializations.
 *
 * @author CS Systemes d'Information
 */
public class IkatsException extends RuntimeException {

    /**
     * Public constructor.
     *
     * @param message The detail message.
     */
    public IkatsException(final String message) {
        super(message);
    }

    /**
     * Public constructor.
     *
     * @param message The detail message.
     * @param cause The cause.
     */
    public IkatsException(final String message, final Throwable cause) {
        super(message, cause);
    }

    @Serial
    private static final long serialVersionUID = 4718244155230713917L;
}
