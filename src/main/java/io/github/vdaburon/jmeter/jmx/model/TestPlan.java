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
import java.util.Objects;

/**
 * The root element of a plan. Its children are the top level elements (thread groups, config elements, listeners ...)
 */
public class TestPlan extends PlanElement {

    private boolean functionalMode;
    private boolean serializeThreadGroups;
    private boolean tearDownOnShutdown;
    private String userDefineClasspath = "";
    private final List<Argument> userDefinedVariables = new ArrayList<>();

    public TestPlan() {
        super(ElementKind.TEST_PLAN);
    }

    public boolean isFunctionalMode() {
        return functionalMode;
    }

    public void setFunctionalMode(boolean functionalMode) {
        this.functionalMode = functionalMode;
    }

    public boolean isSerializeThreadGroups() {
        return serializeThreadGroups;
    }

    public void setSerializeThreadGroups(boolean serializeThreadGroups) {
        this.serializeThreadGroups = serializeThreadGroups;
    }

    public boolean isTearDownOnShutdown() {
        return tearDownOnShutdown;
    }

    public void setTearDownOnShutdown(boolean tearDownOnShutdown) {
        this.tearDownOnShutdown = tearDownOnShutdown;
    }

    public String getUserDefineClasspath() {
        return userDefineClasspath;
    }

    public void setUserDefineClasspath(String userDefineClasspath) {
        this.userDefineClasspath = userDefineClasspath;
    }

    /**
     * @return the live list of the plan global variables
     */
    public List<Argument> getUserDefinedVariables() {
        return userDefinedVariables;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        TestPlan testPlan = (TestPlan) o;
        return functionalMode == testPlan.functionalMode
                && serializeThreadGroups == testPlan.serializeThreadGroups
                && tearDownOnShutdown == testPlan.tearDownOnShutdown
                && Objects.equals(userDefineClasspath, testPlan.userDefineClasspath)
                && userDefinedVariables.equals(testPlan.userDefinedVariables);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), functionalMode, serializeThreadGroups, tearDownOnShutdown, userDefineClasspath, userDefinedVariables);
    }
}
