/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.spectree.cli;

import io.spectree.cli.fixtures.CliFixtures;
import io.spectree.core.AbortReason;
import io.spectree.core.Suite;
import io.spectree.core.SuiteResolutionException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ClassSuiteResolverTest {

    private final ClassSuiteResolver resolver = new ClassSuiteResolver();

    private AbortReason reasonOf(String className) {
        return assertThrows(SuiteResolutionException.class, () -> resolver.resolve(className)).getReason();
    }

    @Test
    void testResolve() {
        Suite suite = resolver.resolve(CliFixtures.PassingSuite.class.getName());
        assertEquals("PassingSuite", suite.getName());
        assertEquals(CliFixtures.PassingSuite.class.getName(), suite.getId());
        assertEquals(2, suite.getExamples().size());
    }

    @Test
    void testFailureReasons() {
        assertEquals(AbortReason.IDENTIFIER_NOT_FOUND, reasonOf("does.not.Exist"));
        assertEquals(AbortReason.INSTANTIATION_NOT_PERMITTED, reasonOf("java.lang.String"));
        assertEquals(AbortReason.INSTANTIATION_NOT_PERMITTED, reasonOf(CliFixtures.AbstractSuite.class.getName()));
        assertEquals(AbortReason.ENTRY_POINT_MISSING, reasonOf(CliFixtures.NoDefaultConstructorSuite.class.getName()));
        assertEquals(AbortReason.INSTANTIATION_FAILED, reasonOf(CliFixtures.ExplodingSuite.class.getName()));
        assertEquals(AbortReason.ACCESS_DENIED, reasonOf("io.spectree.cli.fixtures.HiddenSuite"));
    }

    @Test
    void testInstantiationFailureKeepsCause() {
        SuiteResolutionException e = assertThrows(SuiteResolutionException.class,
                () -> resolver.resolve(CliFixtures.ExplodingSuite.class.getName()));
        assertTrue(e.getCause() instanceof IllegalStateException);
    }

}
