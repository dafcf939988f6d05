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
package com.firefly.core.retention.adapter;

import org.springframework.stereotype.Component;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a bean as a retention adapter so the {@link AdapterRegistry} can discover it.
 *
 * <p>Adapters are registered under their {@link #type()} and under every port
 * interface they implement. When several adapters implement the same port the
 * one with the highest {@link #priority()} wins the fallback selection.</p>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Component
public @interface RetentionAdapter {

    /**
     * Adapter type, matched against {@code firefly.retention.adapter-type}.
     */
    String type();

    /**
     * Selection priority; higher wins.
     */
    int priority() default 0;

    String description() default "";

    String version() default "1.0";

    String vendor() default "Firefly Software Solutions Inc.";

    AdapterFeature[] supportedFeatures() default {};

    String[] requiredProperties() default {};

    String[] optionalProperties() default {};

    /**
     * Set to false to keep the bean out of the registry.
     */
    boolean enabled() default true;
}
