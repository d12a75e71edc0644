/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.kms.service;

import java.lang.reflect.Parameter;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolutionException;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TestKmsFacadeInvocationContextProviderTest {

    @Mock
    ExtensionContext extensionContext;

    @Mock
    ExtensionContext.Store store;

    @Mock
    TestKmsFacade<?> testKmsFacade;

    private FacadeParameterContext stringParam;
    private FacadeParameterContext testKmsFacadeParam;
    private TestKmsFacadeInvocationContextProvider provider;

    @BeforeEach
    void setUp() {
        stringParam = new FacadeParameterContext(String.class);
        testKmsFacadeParam = new FacadeParameterContext(TestKmsFacade.class);
        provider = new TestKmsFacadeInvocationContextProvider();
        when(extensionContext.getStore(any(ExtensionContext.Namespace.class))).thenReturn(store);
    }

    @Test
    void shouldNotSupportOtherParameterTypes() {
        doReturn(Map.of()).when(store).getOrComputeIfAbsent(anyString(), any(), any(Class.class));

        assertThat(provider.supportsParameter(stringParam, extensionContext)).isFalse();
    }

    @Test
    void shouldSupportFacadeParameter() {
        doReturn(Map.of(TestKmsFacade.class, testKmsFacade)).when(store).getOrComputeIfAbsent(anyString(), any(), any(Class.class));

        assertThat(provider.supportsParameter(testKmsFacadeParam, extensionContext)).isTrue();
    }

    @Test
    void shouldStartResolvedFacade() {
        doReturn(Map.of(TestKmsFacade.class, testKmsFacade)).when(store).getOrComputeIfAbsent(anyString(), any(), any(Class.class));

        var resolved = provider.resolveParameter(testKmsFacadeParam, extensionContext);

        assertThat(resolved).isSameAs(testKmsFacade);
        verify(testKmsFacade).start();
    }

    @Test
    void shouldThrowWhenResolvingUnknownParameter() {
        doReturn(Map.of(TestKmsFacade.class, testKmsFacade)).when(store).getOrComputeIfAbsent(anyString(), any(), any(Class.class));

        assertThatThrownBy(() -> provider.resolveParameter(stringParam, extensionContext))
                .isInstanceOf(ParameterResolutionException.class)
                .hasMessageStartingWith("Unable to resolve");
    }

    @SuppressWarnings("unchecked")
    @Test
    void shouldDiscoverFacadesWithServiceLoader() {
        final ArgumentCaptor<Function<String, ?>> loader = ArgumentCaptor.captor();
        doReturn(Map.of()).when(store).getOrComputeIfAbsent(anyString(), loader.capture(), any(Class.class));

        provider.supportsParameter(stringParam, extensionContext);

        assertThat(loader.getValue().apply("ignored")).isInstanceOf(Map.class);
    }

    private record FacadeParameterContext(Class<?> parameterType) implements ParameterContext {

        @Override
        public Parameter getParameter() {
            try {
                return Target.class.getMethod("accept", parameterType).getParameters()[0];
            }
            catch (NoSuchMethodException e) {
                throw new IllegalStateException(e);
            }
        }

        @Override
        public int getIndex() {
            return 0;
        }

        @Override
        public Optional<Object> getTarget() {
            return Optional.empty();
        }

        @SuppressWarnings("unused")
        public static class Target {

            public void accept(String arg) {
            }

            public void accept(TestKmsFacade<?> arg) {
            }
        }
    }
}
