/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.kms.service;

import java.util.ServiceLoader;
import java.util.stream.Stream;

/**
 * Factory for {@link TestKmsFacade}s, discovered using {@link ServiceLoader}.
 * @param <C> The config type
 */
public interface TestKmsFacadeFactory<C> {

    /**
     * Creates a TestKmsFacade instance
     *
     * @return instance
     */
    TestKmsFacade<C> build();

    /**
     * Discovers the available {@link TestKmsFacadeFactory}.
     * @return factories
     */
    @SuppressWarnings("unchecked")
    static <C> Stream<TestKmsFacadeFactory<C>> getTestKmsFacadeFactories() {
        return ServiceLoader.load(TestKmsFacadeFactory.class)
                .stream()
                .map(p -> (TestKmsFacadeFactory<C>) p.get());
    }
}
