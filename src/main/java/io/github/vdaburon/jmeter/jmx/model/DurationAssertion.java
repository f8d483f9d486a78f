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
 * Duration Assertion, the sample fails if it lasts longer than duration milliseconds
 */
public class DurationAssertion extends PlanElement {

    private IntOrExpression duration;
    private String scope;

    public DurationAssertion() {
        super(ElementKind.DURATION_ASSERTION);
    }

    /**
     * @return the maximum duration in milliseconds, null when not set
     */
    public IntOrExpression getDuration() {
        return duration;
    }

    public void setDuration(IntOrExpression duration) {
        this.duration = duration;
    }

    public String getScope() {
        return scope;
    }

    public void setScope(String scope) {
        this.scope = scope;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        DurationAssertion that = (DurationAssertion) o;
        return Objects.equals(duration, that.duration) && Objects.equals(scope, that.scope);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), duration, scope);
    }
}
