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

public class JsonAssertion extends PlanElement {

    private String jsonPath = "";
    private String expectedValue = "";
    private boolean jsonValidation;
    private boolean expectNull;
    private boolean invert;
    private boolean regex = true;

    public JsonAssertion() {
        super(ElementKind.JSON_ASSERTION);
    }

    public String getJsonPath() {
        return jsonPath;
    }

    public void setJsonPath(String jsonPath) {
        this.jsonPath = jsonPath;
    }

    public String getExpectedValue() {
        return expectedValue;
    }

    public void setExpectedValue(String expectedValue) {
        this.expectedValue = expectedValue;
    }

    /**
     * @return true to compare the value found with the expected value, false to only check the path exists
     */
    public boolean isJsonValidation() {
        return jsonValidation;
    }

    public void setJsonValidation(boolean jsonValidation) {
        this.jsonValidation = jsonValidation;
    }

    public boolean isExpectNull() {
        return expectNull;
    }

    public void setExpectNull(boolean expectNull) {
        this.expectNull = expectNull;
    }

    public boolean isInvert() {
        return invert;
    }

    public void setInvert(boolean invert) {
        this.invert = invert;
    }

    public boolean isRegex() {
        return regex;
    }

    public void setRegex(boolean regex) {
        this.regex = regex;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        JsonAssertion that = (JsonAssertion) o;
        return jsonValidation == that.jsonValidation
                && expectNull == that.expectNull
                && invert == that.invert
                && regex == that.regex
                && Objects.equals(jsonPath, that.jsonPath)
                && Objects.equals(expectedValue, that.expectedValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), jsonPath, expectedValue, jsonValidation, expectNull, invert, regex);
    }
}
