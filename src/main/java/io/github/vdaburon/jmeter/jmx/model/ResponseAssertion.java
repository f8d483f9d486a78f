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
 * Response Assertion.
 * testType is a bit field : 1 matches, 2 contains, 4 not, 8 equals, 16 substring, 32 or.
 */
public class ResponseAssertion extends PlanElement {

    public static final String K_FIELD_RESPONSE_DATA = "Assertion.response_data";
    public static final String K_FIELD_RESPONSE_CODE = "Assertion.response_code";
    public static final String K_FIELD_RESPONSE_MESSAGE = "Assertion.response_message";
    public static final String K_FIELD_RESPONSE_HEADERS = "Assertion.response_headers";

    public static final int K_TYPE_MATCH = 1;
    public static final int K_TYPE_CONTAINS = 2;
    public static final int K_TYPE_NOT = 4;
    public static final int K_TYPE_EQUALS = 8;
    public static final int K_TYPE_SUBSTRING = 16;
    public static final int K_TYPE_OR = 32;

    private String testField = K_FIELD_RESPONSE_DATA;
    private int testType = K_TYPE_CONTAINS;
    private final List<String> testStrings = new ArrayList<>();
    private boolean assumeSuccess;
    private String customMessage;
    private String scope;

    public ResponseAssertion() {
        super(ElementKind.RESPONSE_ASSERTION);
    }

    public String getTestField() {
        return testField;
    }

    public void setTestField(String testField) {
        this.testField = testField;
    }

    public int getTestType() {
        return testType;
    }

    public void setTestType(int testType) {
        this.testType = testType;
    }

    /**
     * @return the live list of patterns to test
     */
    public List<String> getTestStrings() {
        return testStrings;
    }

    public boolean isAssumeSuccess() {
        return assumeSuccess;
    }

    public void setAssumeSuccess(boolean assumeSuccess) {
        this.assumeSuccess = assumeSuccess;
    }

    /**
     * @return the failure message, null when not set
     */
    public String getCustomMessage() {
        return customMessage;
    }

    public void setCustomMessage(String customMessage) {
        this.customMessage = customMessage;
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
        ResponseAssertion that = (ResponseAssertion) o;
        return testType == that.testType
                && assumeSuccess == that.assumeSuccess
                && Objects.equals(testField, that.testField)
                && testStrings.equals(that.testStrings)
                && Objects.equals(customMessage, that.customMessage)
                && Objects.equals(scope, that.scope);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), testField, testType, testStrings, assumeSuccess, customMessage, scope);
    }
}
