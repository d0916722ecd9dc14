/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.wallet.api.init;

import dev.mars.wallet.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class InitializationExceptionTest {

    @Test
    void messageNamesStepAndCause() {
        IllegalStateException cause = new IllegalStateException("connection refused");
        InitializationException ex = new InitializationException("database", cause);

        assertEquals("database", ex.getStepName());
        assertSame(cause, ex.getCause());
        assertEquals("Initialization step 'database' failed: connection refused", ex.getMessage());
    }

    @Test
    void messageOnlyHasNoStep() {
        InitializationException ex = new InitializationException("initialize() may only be called once");

        assertNull(ex.getStepName());
        assertNull(ex.getCause());
    }
}
