/*
 * Copyright 2024 Firefly Software Solutions Inc.
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
package com.firefly.core.retention.adapter.noop;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.List;

/**
 * Dynamic-proxy no-op implementation of any port interface.
 *
 * <p>Methods whose name starts with a lookup prefix return an empty publisher
 * ({@code Mono<Boolean>} lookups return false). All other reactive methods fail
 * with {@link UnsupportedOperationException}. {@code getAdapterName()} returns
 * {@code "NoOp" + portName + "Adapter"}.</p>
 *
 * @param <T> the port interface
 */
public class NoOpGenericAdapter<T> extends NoOpAdapterBase implements InvocationHandler {

    private static final List<String> LOOKUP_PREFIXES = List.of("get", "find", "exists", "is", "list", "count");

    private final Class<T> portInterface;

    public NoOpGenericAdapter(String portName, Class<T> portInterface) {
        super(portName);
        this.portInterface = portInterface;
    }

    /**
     * Creates the proxy instance.
     *
     * @return a proxy implementing the port interface
     */
    public T getProxy() {
        Object proxy = Proxy.newProxyInstance(portInterface.getClassLoader(), new Class<?>[]{portInterface}, this);
        return portInterface.cast(proxy);
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) {
        String name = method.getName();

        if (method.getDeclaringClass() == Object.class) {
            return handleObjectMethod(proxy, name, args);
        }
        if ("getAdapterName".equals(name)) {
            return "NoOp" + getPortName() + "Adapter";
        }

        Class<?> returnType = method.getReturnType();
        boolean lookup = LOOKUP_PREFIXES.stream().anyMatch(name::startsWith);

        if (Flux.class.isAssignableFrom(returnType)) {
            return lookup ? emptyResults(name) : Flux.from(unsupported(name));
        }
        if (Mono.class.isAssignableFrom(returnType)) {
            if (lookup && isBooleanLookup(name)) {
                logNotConfigured(name);
                return Mono.just(false);
            }
            return lookup ? emptyResult(name) : unsupported(name);
        }

        logNotConfigured(name);
        throw new UnsupportedOperationException(getPortName() + "." + name + " is not available");
    }

    private boolean isBooleanLookup(String name) {
        return name.startsWith("exists") || name.startsWith("is");
    }

    private Object handleObjectMethod(Object proxy, String name, Object[] args) {
        if ("equals".equals(name)) {
            return proxy == args[0];
        }
        if ("hashCode".equals(name)) {
            return System.identityHashCode(proxy);
        }
        return "NoOp" + getPortName() + "Adapter";
    }
}
