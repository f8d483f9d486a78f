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

public class CacheManager extends PlanElement {

    private boolean clearEachIteration;
    private boolean useExpires = true;
    private boolean controlledByThread;

    public CacheManager() {
        super(ElementKind.CACHE_MANAGER);
    }

    public boolean isClearEachIteration() {
        return clearEachIteration;
    }

    public void setClearEachIteration(boolean clearEachIteration) {
        this.clearEachIteration = clearEachIteration;
    }

    public boolean isUseExpires() {
        return useExpires;
    }

    public void setUseExpires(boolean useExpires) {
        this.useExpires = useExpires;
    }

    public boolean isControlledByThread() {
        return controlledByThread;
    }

    public void setControlledByThread(boolean controlledByThread) {
        this.controlledByThread = controlledByThread;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        CacheManager that = (CacheManager) o;
        return clearEachIteration == that.clearEachIteration && useExpires == that.useExpires && controlledByThread == that.controlledByThread;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), clearEachIteration, useExpires, controlledByThread);
    }
}
