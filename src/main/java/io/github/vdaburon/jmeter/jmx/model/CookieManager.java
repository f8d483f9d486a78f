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

public class CookieManager extends PlanElement {

    private boolean clearEachIteration;
    private boolean controlledByThreadGroup;
    private String policy;

    public CookieManager() {
        super(ElementKind.COOKIE_MANAGER);
    }

    public boolean isClearEachIteration() {
        return clearEachIteration;
    }

    public void setClearEachIteration(boolean clearEachIteration) {
        this.clearEachIteration = clearEachIteration;
    }

    public boolean isControlledByThreadGroup() {
        return controlledByThreadGroup;
    }

    public void setControlledByThreadGroup(boolean controlledByThreadGroup) {
        this.controlledByThreadGroup = controlledByThreadGroup;
    }

    /**
     * @return the cookie policy (standard, rfc2109 ...), null for the JMeter default
     */
    public String getPolicy() {
        return policy;
    }

    public void setPolicy(String policy) {
        this.policy = policy;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        CookieManager that = (CookieManager) o;
        return clearEachIteration == that.clearEachIteration
                && controlledByThreadGroup == that.controlledByThreadGroup
                && Objects.equals(policy, that.policy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), clearEachIteration, controlledByThreadGroup, policy);
    }
}
