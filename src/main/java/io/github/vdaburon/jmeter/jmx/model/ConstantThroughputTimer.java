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
 * Constant Throughput Timer.
 * calcMode : 0 this thread only, 1 all active threads, 2 all active threads in current thread group,
 * 3 all active threads (shared), 4 all active threads in current thread group (shared).
 */
public class ConstantThroughputTimer extends PlanElement {

    public static final int K_CALC_MODE_THIS_THREAD = 0;
    public static final int K_CALC_MODE_ALL_THREADS = 1;
    public static final int K_CALC_MODE_THREAD_GROUP = 2;
    public static final int K_CALC_MODE_ALL_THREADS_SHARED = 3;
    public static final int K_CALC_MODE_THREAD_GROUP_SHARED = 4;

    private String throughput = "0.0";
    private int calcMode = K_CALC_MODE_THIS_THREAD;

    public ConstantThroughputTimer() {
        super(ElementKind.CONSTANT_THROUGHPUT_TIMER);
    }

    /**
     * @return the target throughput in samples per minute, a number or an expression
     */
    public String getThroughput() {
        return throughput;
    }

    public void setThroughput(String throughput) {
        this.throughput = throughput;
    }

    public int getCalcMode() {
        return calcMode;
    }

    public void setCalcMode(int calcMode) {
        this.calcMode = calcMode;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        ConstantThroughputTimer that = (ConstantThroughputTimer) o;
        return calcMode == that.calcMode && Objects.equals(throughput, that.throughput);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), throughput, calcMode);
    }
}
