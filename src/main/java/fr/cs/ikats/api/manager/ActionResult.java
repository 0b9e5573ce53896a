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

import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import fr.cs.ikats.api.exceptions.IkatsException;

import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Outcome of one mutating action. The action runs once; callers then either
 * raise the captured failure or read it as a status.
 *
 * Only failures of the {@link IkatsException} family are captured, anything
 * else propagates from {@link #attempt(String, String, Runnable)}.
 *
 * @author CS Systemes d'Information
 */
public final class ActionResult {

    /**
     * Run an action and capture its outcome.
     *
     * @param action Name of the action, for logs.
     * @param identifier Identifier of the object acted upon, for logs.
     * @param body The action.
     * @return The outcome.
     */
    public static ActionResult attempt(final String action, final String identifier, final Runnable body) {
        try {
            body.run();
            return new ActionResult(action, identifier, null);
        } catch (final IkatsException e) {
            return new ActionResult(action, identifier, e);
        }
    }

    /**
     * Successful outcome.
     *
     * @param action Name of the action, for logs.
     * @param identifier Identifier of the object acted upon, for logs.
     * @return The outcome.
     */
    public static ActionResult success(final String action, final String identifier) {
        return new ActionResult(action, identifier, null);
    }

    /**
     * Failed outcome.
     *
     * @param action Name of the action, for logs.
     * @param identifier Identifier of the object acted upon, for logs.
     * @param failure The failure.
     * @return The outcome.
     */
    public static ActionResult failure(final String action, final String identifier, final IkatsException failure) {
        return new ActionResult(action, identifier, failure);
    }

    public boolean isSuccess() {
        return _failure == null;
    }

    public Optional<IkatsException> getFailure() {
        return Optional.ofNullable(_failure);
    }

    /**
     * Raise the captured failure, if any.
     */
    public void orThrow() {
        if (_failure != null) {
            throw _failure;
        }
    }

    /**
     * Apply the caller's choice between raising and reporting a status.
     * Failures reported as a status are logged.
     *
     * @param raiseException Whether a failure is raised.
     * @return True on success; false on failure when not raising.
     */
    public boolean resolve(final boolean raiseException) {
        if (raiseException) {
            orThrow();
            return true;
        }
        if (_failure != null) {
            LOGGER.warn()
                    .setMessage("Action failed")
                    .addData("action", _action)
                    .addData("identifier", _identifier)
                    .setThrowable(_failure)
                    .log();
            return false;
        }
        return true;
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("action", _action)
                .put("identifier", _identifier)
                .put("success", isSuccess())
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private ActionResult(final String action, final String identifier, @Nullable final IkatsException failure) {
        _action = action;
        _identifier = identifier;
        _failure = failure;
    }

    private final String _action;
    private final String _identifier;
    private final IkatsException _failure;

    private static final Logger LOGGER = LoggerFactory.getLogger(ActionResult.class);
}
