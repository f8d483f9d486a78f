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
 * Transaction Controller, measures the time of its children samplers.
 * With parent set the children are reported as sub results of one sample.
 */
public class TransactionController extends PlanElement {

    private boolean parent;
    private boolean includeTimers;

    public TransactionController() {
        super(ElementKind.TRANSACTION_CONTROLLER);
    }

    public boolean isParent() {
        return parent;
    }

    public void setParent(boolean parent) {
        this.parent = parent;
    }

    public boolean isIncludeTimers() {
        return includeTimers;
    }

    public void setIncludeTimers(boolean includeTimers) {
        this.includeTimers = includeTimers;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        TransactionController that = (TransactionController) o;
        return parent == that.parent && includeTimers == that.includeTimers;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), parent, includeTimers);
    }
}
