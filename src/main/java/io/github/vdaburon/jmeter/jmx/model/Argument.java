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

import java.util.Objects;

/**
 * A name / value pair of an Arguments collection (user defined variables, backend listener parameters ...)
 */
public class Argument {

    public static final String K_DEFAULT_METADATA = "=";

    private String name;
    private String value;
    private String metadata;

    public Argument(String name, String value) {
        this(name, value, K_DEFAULT_METADATA);
    }

    public Argument(String name, String value, String metadata) {
        this.name = name;
        this.value = value;
        this.metadata = metadata;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    /**
     * @return the separator shown in the gui, usually "=", null when the file has none
     */
    public String getMetadata() {
        return metadata;
    }

    public void setMetadata(String metadata) {
        this.metadata = metadata;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Argument argument = (Argument) o;
        return Objects.equals(name, argument.name) && Objects.equals(value, argument.value) && Objects.equals(metadata, argument.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value, metadata);
    }

    @Override
    public String toString() {
        return name + (metadata != null ? metadata : K_DEFAULT_METADATA) + value;
    }
}
