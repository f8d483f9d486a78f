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
 * If Controller. With useExpression the condition is a variable or function returning "true",
 * e.g. <code>${__jexl3(${COUNT} &gt; 0)}</code>
 */
public class IfController extends PlanElement {

    private String condition = "";
    private boolean evaluateAll;
    private boolean useExpression = true;

    public IfController() {
        super(ElementKind.IF_CONTROLLER);
    }

    public String getCondition() {
        return condition;
    }

    public void setCondition(String condition) {
        this.condition = condition;
    }

    public boolean isEvaluateAll() {
        return evaluateAll;
    }

    public void setEvaluateAll(boolean evaluateAll) {
        this.evaluateAll = evaluateAll;
    }

    public boolean isUseExpression() {
        return useExpression;
    }

    public void setUseExpression(boolean useExpression) {
        this.useExpression = useExpression;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        IfController that = (IfController) o;
        return evaluateAll == that.evaluateAll
                && useExpression == that.useExpression
                && Objects.equals(condition, that.condition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), condition, evaluateAll, useExpression);
    }
}
