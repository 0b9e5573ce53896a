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

import fr.cs.ikats.api.exceptions.ConflictException;
import fr.cs.ikats.api.exceptions.NotFoundException;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests for the {@link ActionResult} class.
 *
 * @author CS Systemes d'Information
 */
public class ActionResultTest {

    @Test
    public void testSuccess() {
        final ActionResult result = ActionResult.attempt("save", "D1", () -> { });
        Assert.assertTrue(result.isSuccess());
        Assert.assertFalse(result.getFailure().isPresent());
        Assert.assertTrue(result.resolve(true));
        Assert.assertTrue(result.resolve(false));
    }

    @Test
    public void testFailureReportedAsStatus() {
        final ActionResult result = ActionResult.attempt("save", "D1", () -> {
            throw new ConflictException("exists");
        });
        Assert.assertFalse(result.isSuccess());
        Assert.assertTrue(result.getFailure().get() instanceof ConflictException);
        Assert.assertFalse(result.resolve(false));
    }

    @Test(expected = ConflictException.class)
    public void testFailureRaised() {
        ActionResult.attempt("save", "D1", () -> {
            throw new ConflictException("exists");
        }).resolve(true);
    }

    @Test(expected = IllegalStateException.class)
    public void testForeignExceptionPropagates() {
        ActionResult.attempt("save", "D1", () -> {
            throw new IllegalStateException("bug");
        });
    }

    @Test
    public void testFactories() {
        Assert.assertTrue(ActionResult.success("delete", "T1").isSuccess());
        final ActionResult failure = ActionResult.failure("delete", "T1", new NotFoundException("absent"));
        Assert.assertFalse(failure.isSuccess());
        try {
            failure.orThrow();
            Assert.fail("Expected exception to be thrown");
        } catch (final NotFoundException e) {
            Assert.assertEquals("absent", e.getMessage());
        }
    }
}
