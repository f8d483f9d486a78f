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

public class BoundaryExtractor extends PlanElement {

    private String refName = "";
    private String leftBoundary = "";
    private String rightBoundary = "";
    private String defaultValue = "";
    private IntOrExpression matchNumber = IntOrExpression.of(1);
    private String useHeaders = RegexExtractor.K_USE_BODY;
    private boolean defaultEmptyValue;

    public BoundaryExtractor() {
        super(ElementKind.BOUNDARY_EXTRACTOR);
    }

    public String getRefName() {
        return refName;
    }

    public void setRefName(String refName) {
        this.refName = refName;
    }

    public String getLeftBoundary() {
        return leftBoundary;
    }

    public void setLeftBoundary(String leftBoundary) {
        this.leftBoundary = leftBoundary;
    }

    public String getRightBoundary() {
        return rightBoundary;
    }

    public void setRightBoundary(String rightBoundary) {
        this.rightBoundary = rightBoundary;
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    public void setDefaultValue(String defaultValue) {
        this.defaultValue = defaultValue;
    }

    public IntOrExpression getMatchNumber() {
        return matchNumber;
    }

    public void setMatchNumber(IntOrExpression matchNumber) {
        this.matchNumber = Objects.requireNonNull(matchNumber, "matchNumber");
    }

    public String getUseHeaders() {
        return useHeaders;
    }

    public void setUseHeaders(String useHeaders) {
        this.useHeaders = useHeaders;
    }

    public boolean isDefaultEmptyValue() {
        return defaultEmptyValue;
    }

    public void setDefaultEmptyValue(boolean defaultEmptyValue) {
        this.defaultEmptyValue = defaultEmptyValue;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        BoundaryExtractor that = (BoundaryExtractor) o;
        return defaultEmptyValue == that.defaultEmptyValue
                && Objects.equals(refName, that.refName)
                && Objects.equals(leftBoundary, that.leftBoundary)
                && Objects.equals(rightBoundary, that.rightBoundary)
                && Objects.equals(defaultValue, that.defaultValue)
                && matchNumber.equals(that.matchNumber)
                && Objects.equals(useHeaders, that.useHeaders);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), refName, leftBoundary, rightBoundary, defaultValue, matchNumber, useHeaders, defaultEmptyValue);
    }
}
