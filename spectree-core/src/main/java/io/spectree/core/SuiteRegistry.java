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

import io.spectree.common.Resources;
import io.spectree.log.LogContext;
import org.slf4j.Logger;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * In-memory resolver populated by the host program. Each resolution calls the
 * registered factory again, so every rerun gets a fresh suite.
 */
public class SuiteRegistry implements SuiteResolver {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final Map<String, Supplier<? extends Suite>> factories = new ConcurrentHashMap<>();

    public SuiteRegistry register(String suiteId, Supplier<? extends Suite> factory) {
        Objects.requireNonNull(suiteId, "suiteId was null");
        Objects.requireNonNull(factory, "factory was null");
        factories.put(suiteId, factory);
        return this;
    }

    /**
     * Registers under the class name, the identifier subclasses report by default.
     */
    public SuiteRegistry register(Class<? extends Suite> type, Supplier<? extends Suite> factory) {
        return register(type.getName(), factory);
    }

    public Set<String> getSuiteIds() {
        return factories.keySet();
    }

    @Override
    public Suite resolve(String suiteId) {
        Supplier<? extends Suite> factory = factories.get(suiteId);
        if (factory == null) {
            throw new SuiteResolutionException(AbortReason.IDENTIFIER_NOT_FOUND,
                    Resources.get("cannotFindSuite", suiteId));
        }
        Suite suite;
        try {
            suite = factory.get();
        } catch (SecurityException e) {
            throw new SuiteResolutionException(AbortReason.ACCESS_DENIED,
                    Resources.get("accessDenied", suiteId), e);
        } catch (NoClassDefFoundError e) {
            throw new SuiteResolutionException(AbortReason.DEPENDENCY_MISSING,
                    Resources.get("dependencyMissing", e.getMessage()), e);
        } catch (RuntimeException | LinkageError e) {
            throw new SuiteResolutionException(AbortReason.INSTANTIATION_FAILED,
                    Resources.get("suiteInstantiationFailed", suiteId), e);
        }
        if (suite == null) {
            throw new SuiteResolutionException(AbortReason.INSTANTIATION_FAILED,
                    Resources.get("suiteInstantiationFailed", suiteId));
        }
        if (suite.getId() == null) {
            suite.id(suiteId);
        }
        logger.debug("resolved suite {} to {}", suiteId, suite);
        return suite;
    }

}
