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

import io.spectree.common.Resources;
import io.spectree.core.AbortReason;
import io.spectree.core.Suite;
import io.spectree.core.SuiteResolutionException;
import io.spectree.core.SuiteResolver;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.Objects;

/**
 * Resolves a suite identifier as the name of a {@link Suite} subclass with a
 * public no-arg constructor.
 */
public class ClassSuiteResolver implements SuiteResolver {

    private final ClassLoader classLoader;

    public ClassSuiteResolver() {
        this(Thread.currentThread().getContextClassLoader());
    }

    public ClassSuiteResolver(ClassLoader classLoader) {
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader was null");
    }

    @Override
    public Suite resolve(String className) {
        try {
            Class<?> type = Class.forName(className, true, classLoader);
            if (!Suite.class.isAssignableFrom(type) || type.isInterface()
                    || Modifier.isAbstract(type.getModifiers())) {
                throw new SuiteResolutionException(AbortReason.INSTANTIATION_NOT_PERMITTED,
                        Resources.get("cannotInstantiateSuite", className));
            }
            Constructor<?> constructor = type.getConstructor();
            return (Suite) constructor.newInstance();
        } catch (ClassNotFoundException e) {
            throw new SuiteResolutionException(AbortReason.IDENTIFIER_NOT_FOUND,
                    Resources.get("cannotFindSuite", className), e);
        } catch (NoSuchMethodException e) {
            throw new SuiteResolutionException(AbortReason.ENTRY_POINT_MISSING,
                    Resources.get("cannotFindEntryPoint", className), e);
        } catch (InstantiationException e) {
            throw new SuiteResolutionException(AbortReason.INSTANTIATION_NOT_PERMITTED,
                    Resources.get("cannotInstantiateSuite", className), e);
        } catch (IllegalAccessException | SecurityException e) {
            throw new SuiteResolutionException(AbortReason.ACCESS_DENIED,
                    Resources.get("accessDenied", className), e);
        } catch (InvocationTargetException e) {
            throw new SuiteResolutionException(AbortReason.INSTANTIATION_FAILED,
                    Resources.get("suiteInstantiationFailed", className), e.getCause());
        } catch (NoClassDefFoundError e) {
            throw new SuiteResolutionException(AbortReason.DEPENDENCY_MISSING,
                    Resources.get("dependencyMissing", e.getMessage()), e);
        } catch (ExceptionInInitializerError e) {
            throw new SuiteResolutionException(AbortReason.INSTANTIATION_FAILED,
                    Resources.get("suiteInstantiationFailed", className), e.getCause());
        }
    }

}
