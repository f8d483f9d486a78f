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

import java.util.ArrayList;
import java.util.List;

/**
 * The "User Defined Variables" config element (testclass Arguments)
 */
public class UserDefinedVariables extends PlanElement {

    private final List<Argument> variables = new ArrayList<>();

    public UserDefinedVariables() {
        super(ElementKind.ARGUMENTS);
    }

    /**
     * @return the live list of variables
     */
    public List<Argument> getVariables() {
        return variables;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        return variables.equals(((UserDefinedVariables) o).variables);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + variables.hashCode();
    }
}
