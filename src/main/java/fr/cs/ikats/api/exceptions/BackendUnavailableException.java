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
 * Thrown on transport failures: connection errors, timeouts, interruptions and gateway
 * responses (HTTP 502, 503 and 504).
 *
 * @author CS Systemes d'Information
 */
public final class BackendUnavailableException extends IkatsException {

    /**
     * Public constructor.
     *
     * @param message The detail message.
     */
    public BackendUnavailableException(final String message) {
        super(message);
    }

    /**
     * Public constructor.
     *
     * @param message The detail message.
     * @param cause The cause.
     */
    public BackendUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }

    @Serial
    private static final long serialVersionUID = 2217791932601349305L;
}
