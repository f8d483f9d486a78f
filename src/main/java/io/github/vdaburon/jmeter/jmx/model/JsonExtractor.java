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
 * JSON Extractor (JSONPostProcessor). Names, expressions, match numbers and default values are ';' separated lists.
 */
public class JsonExtractor extends PlanElement {

    private String referenceNames = "";
    private String jsonPathExprs = "";
    private String matchNumbers = "1";
    private String defaultValues = "";
    private boolean computeConcatenation;
    private String scope;

    public JsonExtractor() {
        super(ElementKind.JSON_EXTRACTOR);
    }

    public String getReferenceNames() {
        return referenceNames;
    }

    public void setReferenceNames(String referenceNames) {
        this.referenceNames = referenceNames;
    }

    public String getJsonPathExprs() {
        return jsonPathExprs;
    }

    public void setJsonPathExprs(String jsonPathExprs) {
        this.jsonPathExprs = jsonPathExprs;
    }

    public String getMatchNumbers() {
        return matchNumbers;
    }

    public void setMatchNumbers(String matchNumbers) {
        this.matchNumbers = matchNumbers;
    }

    public String getDefaultValues() {
        return defaultValues;
    }

    public void setDefaultValues(String defaultValues) {
        this.defaultValues = defaultValues;
    }

    public boolean isComputeConcatenation() {
        return computeConcatenation;
    }

    public void setComputeConcatenation(boolean computeConcatenation) {
        this.computeConcatenation = computeConcatenation;
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
        JsonExtractor that = (JsonExtractor) o;
        return computeConcatenation == that.computeConcatenation
                && Objects.equals(referenceNames, that.referenceNames)
                && Objects.equals(jsonPathExprs, that.jsonPathExprs)
                && Objects.equals(matchNumbers, that.matchNumbers)
                && Objects.equals(defaultValues, that.defaultValues)
                && Objects.equals(scope, that.scope);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), referenceNames, jsonPathExprs, matchNumbers, defaultValues, computeConcatenation, scope);
    }
}
