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


package io.github.vdaburon.jmeter.jmx;

import java.util.Objects;

/**
 * Something of the file that is not in the parsed tree.
 * A plan read with a diagnostic of kind {@link Kind#UNKNOWN_ELEMENT_DROPPED} is not written back identical.
 */
public class ParseDiagnostic {

    public enum Kind {
        /** the testclass has no codec, the element and its hashTree are not in the tree */
        UNKNOWN_ELEMENT_DROPPED,
        /** an element tag without its hashTree, or beside the TestPlan in the root hashTree, ignored */
        UNPAIRED_ELEMENT,
        /** a hashTree without its element tag, or beside the TestPlan pair in the root hashTree, ignored */
        UNPAIRED_CONTAINER
    }

    private final Kind kind;
    private final String tagName;
    private final String testClass;
    private final String testName;
    private final String parentPath;

    public ParseDiagnostic(Kind kind, String tagName, String testClass, String testName, String parentPath) {
        this.kind = kind;
        this.tagName = tagName;
        this.testClass = testClass;
        this.testName = testName;
        this.parentPath = parentPath;
    }

    public Kind getKind() {
        return kind;
    }

    public String getTagName() {
        return tagName;
    }

    public String getTestClass() {
        return testClass;
    }

    public String getTestName() {
        return testName;
    }

    /**
     * @return the names of the ancestors separated by '/', e.g. <code>Test Plan/Thread Group</code>
     */
    public String getParentPath() {
        return parentPath;
    }

    public String getMessage() {
        switch (kind) {
            case UNKNOWN_ELEMENT_DROPPED:
                return "Unknown element " + tagName + " testclass=" + testClass + " testname=" + testName + " dropped with its children under " + parentPath;
            case UNPAIRED_ELEMENT:
                return "Element " + tagName + " testname=" + testName + " not paired with a hashTree, ignored under " + parentPath;
            default:
                return "hashTree not paired with an element, ignored under " + parentPath;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ParseDiagnostic that = (ParseDiagnostic) o;
        return kind == that.kind
                && Objects.equals(tagName, that.tagName)
                && Objects.equals(testClass, that.testClass)
                && Objects.equals(testName, that.testName)
                && Objects.equals(parentPath, that.parentPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, tagName, testClass, testName, parentPath);
    }

    @Override
    public String toString() {
        return kind + " : " + getMessage();
    }
}
