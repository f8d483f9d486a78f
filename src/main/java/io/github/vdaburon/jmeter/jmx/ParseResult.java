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

import io.github.vdaburon.jmeter.jmx.model.JmxTestPlan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The parsed plan and what the parser could not keep
 */
public class ParseResult {

    private final JmxTestPlan testPlan;
    private final List<ParseDiagnostic> diagnostics;

    public ParseResult(JmxTestPlan testPlan, List<ParseDiagnostic> diagnostics) {
        this.testPlan = testPlan;
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    public JmxTestPlan getTestPlan() {
        return testPlan;
    }

    public List<ParseDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<ParseDiagnostic> getDiagnostics(ParseDiagnostic.Kind kind) {
        List<ParseDiagnostic> listDiagnostics = new ArrayList<>();
        for (ParseDiagnostic diagnostic : diagnostics) {
            if (diagnostic.getKind() == kind) {
                listDiagnostics.add(diagnostic);
            }
        }
        return listDiagnostics;
    }

    /**
     * @return true if elements of unknown kind were dropped, the plan written back will not contain them
     */
    public boolean hasDroppedElements() {
        return !getDiagnostics(ParseDiagnostic.Kind.UNKNOWN_ELEMENT_DROPPED).isEmpty();
    }
}
