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
 * Loop Controller, runs its children loops times (-1 for ever)
 */
public class LoopController extends PlanElement {

    private IntOrExpression loops = IntOrExpression.of(1);
    private boolean continueForever = true;

    public LoopController() {
        super(ElementKind.LOOP_CONTROLLER);
    }

    public IntOrExpression getLoops() {
        return loops;
    }

    public void setLoops(IntOrExpression loops) {
        this.loops = Objects.requireNonNull(loops, "loops");
    }

    public boolean isContinueForever() {
        return continueForever;
    }

    public void setContinueForever(boolean continueForever) {
        this.continueForever = continueForever;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        LoopController that = (LoopController) o;
        return continueForever == that.continueForever && loops.equals(that.loops);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), loops, continueForever);
    }
}
