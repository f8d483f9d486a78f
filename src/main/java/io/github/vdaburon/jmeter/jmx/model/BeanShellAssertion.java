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
 * BeanShell Assertion, the script is inline (query) or read from a file
 */
public class BeanShellAssertion extends PlanElement {

    private String query = "";
    private String filename = "";
    private String parameters = "";
    private boolean resetInterpreter;

    public BeanShellAssertion() {
        super(ElementKind.BEANSHELL_ASSERTION);
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    public String getParameters() {
        return parameters;
    }

    public void setParameters(String parameters) {
        this.parameters = parameters;
    }

    public boolean isResetInterpreter() {
        return resetInterpreter;
    }

    public void setResetInterpreter(boolean resetInterpreter) {
        this.resetInterpreter = resetInterpreter;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        BeanShellAssertion that = (BeanShellAssertion) o;
        return resetInterpreter == that.resetInterpreter
                && Objects.equals(query, that.query)
                && Objects.equals(filename, that.filename)
                && Objects.equals(parameters, that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), query, filename, parameters, resetInterpreter);
    }
}
