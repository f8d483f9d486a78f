/*
 * Copyright 2024 Vincent DABURON
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package io.github.vdaburon.jmeter.jmx.model;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Generate the in memory identity of the test elements.
 * The identity is unique in the running process and is never written in the jmx file.
 */
public final class ElementIds {

    private static final String K_PREFIX = "elt-";
    private static final AtomicLong COUNTER = new AtomicLong();

    private ElementIds() {
    }

    /**
     * @return a new identity, never returned before by this process
     */
    public static String next() {
        return K_PREFIX + COUNTER.incrementAndGet();
    }
}
