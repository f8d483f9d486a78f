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


package io.github.vdaburon.jmeter.jmx.analysis;

import java.util.Objects;

/**
 * A finding of the {@link TestPlanAnalyzer}
 */
public class AnalysisResult {

    public enum Severity {
        INFO, WARNING, ERROR
    }

    public enum Category {
        PERFORMANCE, BEST_PRACTICE, SECURITY, MAINTAINABILITY
    }

    private final Severity severity;
    private final Category category;
    private final String message;
    private final String element;
    private final String suggestion;

    /**
     * @param element the name of the element concerned, null for the whole plan
     */
    public AnalysisResult(Severity severity, Category category, String message, String element, String suggestion) {
        this.severity = severity;
        this.category = category;
        this.message = message;
        this.element = element;
        this.suggestion = suggestion;
    }

    public Severity getSeverity() {
        return severity;
    }

    public Category getCategory() {
        return category;
    }

    public String getMessage() {
        return message;
    }

    public String getElement() {
        return element;
    }

    public String getSuggestion() {
        return suggestion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AnalysisResult that = (AnalysisResult) o;
        return severity == that.severity
                && category == that.category
                && Objects.equals(message, that.message)
                && Objects.equals(element, that.element)
                && Objects.equals(suggestion, that.suggestion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(severity, category, message, element, suggestion);
    }

    @Override
    public String toString() {
        return "[" + severity + "][" + category + "] " + message + (suggestion != null ? " => " + suggestion : "");
    }
}
