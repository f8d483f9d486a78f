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
 * Regular Expression Extractor.
 * matchNumber : 0 random match, -1 all matches (refName_1, refName_2 ...), n the nth match.
 */
public class RegexExtractor extends PlanElement {

    /** field to check : the body */
    public static final String K_USE_BODY = "false";
    public static final String K_USE_HEADERS = "true";
    public static final String K_USE_URL = "URL";
    public static final String K_USE_CODE = "code";
    public static final String K_USE_MESSAGE = "message";

    private String refName = "";
    private String regex = "";
    private String template = "$1$";
    private String defaultValue = "";
    private IntOrExpression matchNumber = IntOrExpression.of(1);
    private String useHeaders = K_USE_BODY;
    private boolean defaultEmptyValue;
    private String scope;
    private String scopeVariable;

    public RegexExtractor() {
        super(ElementKind.REGEX_EXTRACTOR);
    }

    public String getRefName() {
        return refName;
    }

    public void setRefName(String refName) {
        this.refName = refName;
    }

    public String getRegex() {
        return regex;
    }

    public void setRegex(String regex) {
        this.regex = regex;
    }

    public String getTemplate() {
        return template;
    }

    public void setTemplate(String template) {
        this.template = template;
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

    /**
     * @return all, parent, children or variable, null for the main sample only
     */
    public String getScope() {
        return scope;
    }

    public void setScope(String scope) {
        this.scope = scope;
    }

    public String getScopeVariable() {
        return scopeVariable;
    }

    public void setScopeVariable(String scopeVariable) {
        this.scopeVariable = scopeVariable;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        RegexExtractor that = (RegexExtractor) o;
        return defaultEmptyValue == that.defaultEmptyValue
                && Objects.equals(refName, that.refName)
                && Objects.equals(regex, that.regex)
                && Objects.equals(template, that.template)
                && Objects.equals(defaultValue, that.defaultValue)
                && matchNumber.equals(that.matchNumber)
                && Objects.equals(useHeaders, that.useHeaders)
                && Objects.equals(scope, that.scope)
                && Objects.equals(scopeVariable, that.scopeVariable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), refName, regex, template, defaultValue, matchNumber, useHeaders, defaultEmptyValue, scope, scopeVariable);
    }
}
