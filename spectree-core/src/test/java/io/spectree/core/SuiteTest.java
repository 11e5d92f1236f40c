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
package io.spectree.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SuiteTest {

    public static class StackSpec extends Suite {

        public StackSpec() {
            describe("A Stack", () -> {
                it("be empty when created", () -> {
                });
                describe("when full", () -> {
                    it("complain on push", () -> {
                    });
                    specify("peek returns the top", () -> {
                    });
                });
                it("pop values in last-in-first-out order", () -> {
                });
            });
            specify("standalone", () -> {
            });
        }

    }

    @Test
    void testSubclassAuthoring() {
        Suite suite = new StackSpec();
        assertEquals("StackSpec", suite.getName());
        assertEquals(StackSpec.class.getName(), suite.getId());
        assertEquals(List.of(
                "A Stack should be empty when created",
                "A Stack when full should complain on push",
                "A Stack when full peek returns the top",
                "A Stack should pop values in last-in-first-out order",
                "standalone"), suite.getTestNames());
    }

    @Test
    void testPositionsPerBranch() {
        List<Example> examples = new StackSpec().getExamples();
        assertEquals(0, examples.get(0).getPositionIndex());
        assertEquals(0, examples.get(1).getPositionIndex());
        assertEquals(1, examples.get(2).getPositionIndex());
        assertEquals(1, examples.get(3).getPositionIndex());
        assertEquals(0, examples.get(4).getPositionIndex());
        assertTrue(examples.get(4).getParent().isTrunk());
    }

    @Test
    void testDescribeRestoresBranchAfterFailure() {
        Suite suite = Suite.named("S");
        assertThrows(IllegalStateException.class, () -> suite.describe("broken", () -> {
            throw new IllegalStateException("boom");
        }));
        suite.it("works", () -> {
        });
        assertEquals(List.of("it should works"), suite.getTestNames());
    }

    @Test
    void testDuplicateNames() {
        Suite suite = Suite.named("S").it("x", () -> {
        });
        assertThrows(IllegalArgumentException.class, () -> suite.it("x", () -> {
        }));
        // same raw name under another description is fine
        suite.describe("Other", () -> suite.it("x", () -> {
        }));
        assertEquals(List.of("it should x", "Other should x"), suite.getTestNames());
    }

    @Test
    void testBlankTagsRejected() {
        Suite suite = Suite.named("S");
        assertThrows(IllegalArgumentException.class, () -> suite.tags(""));
        assertThrows(IllegalArgumentException.class, () -> suite.it("x", Set.of(" "), () -> {
        }));
    }

    @Test
    void testNestingRejectsCycles() {
        Suite a = Suite.named("A");
        Suite b = Suite.named("B");
        Suite c = Suite.named("C");
        a.nest(b);
        b.nest(c);
        assertThrows(IllegalArgumentException.class, () -> c.nest(a));
        assertThrows(IllegalArgumentException.class, () -> a.nest(a));
        assertThrows(NullPointerException.class, () -> a.nest((Suite) null));
        // sharing without a cycle is allowed
        a.nest(c);
        assertEquals(List.of(b, c), a.getNestedSuites());
    }

    @Test
    void testIds() {
        assertNull(Suite.named("plain").getId());
        assertEquals("custom", Suite.named("plain").id("custom").getId());
        Suite anonymous = new Suite("anon") {
        };
        assertNull(anonymous.getId());
    }

    @Test
    void testBehavesLikeAddsNothingOnDuplicate() {
        Behavior shared = new Behavior()
                .specify("a", () -> {
                })
                .specify("b", () -> {
                })
                .specify("c", () -> {
                })
                .specify("d", () -> {
                });
        Suite suite = Suite.named("S").specify("c", () -> {
        });
        assertThrows(IllegalArgumentException.class, () -> suite.behavesLike(shared));
        assertEquals(List.of("c"), suite.getTestNames());
        // a failed attempt leaves positions untouched
        suite.specify("e", () -> {
        });
        assertEquals(1, suite.getExample("e").getPositionIndex());
    }

}
