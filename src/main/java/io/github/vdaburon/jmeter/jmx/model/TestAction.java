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
 * Flow Control Action (TestAction). The default action is a pause of duration milliseconds of the current thread.
 */
public class TestAction extends PlanElement {

    public static final int K_ACTION_STOP = 0;
    public static final int K_ACTION_PAUSE = 1;
    public static final int K_ACTION_STOP_NOW = 2;
    public static final int K_ACTION_RESTART_NEXT_LOOP = 3;
    public static final int K_ACTION_START_NEXT_ITERATION_CURRENT_LOOP = 4;
    public static final int K_ACTION_BREAK_CURRENT_LOOP = 5;

    public static final int K_TARGET_THREAD = 0;
    public static final int K_TARGET_ALL_THREADS = 2;

    private int action = K_ACTION_PAUSE;
    private int target = K_TARGET_THREAD;
    private IntOrExpression duration = IntOrExpression.of(0);

    public TestAction() {
        super(ElementKind.TEST_ACTION);
    }

    public int getAction() {
        return action;
    }

    public void setAction(int action) {
        this.action = action;
    }

    public int getTarget() {
        return target;
    }

    public void setTarget(int target) {
        this.target = target;
    }

    public IntOrExpression getDuration() {
        return duration;
    }

    public void setDuration(IntOrExpression duration) {
        this.duration = Objects.requireNonNull(duration, "duration");
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        TestAction that = (TestAction) o;
        return action == that.action && target == that.target && duration.equals(that.duration);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), action, target, duration);
    }
}
