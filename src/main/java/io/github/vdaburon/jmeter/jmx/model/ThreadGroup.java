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
 * A Thread Group, a setUp Thread Group or a tearDown Thread Group.
 * The loop settings come from the nested <code>ThreadGroup.main_controller</code> LoopController.
 */
public class ThreadGroup extends PlanElement {

    public static final String K_ON_ERROR_CONTINUE = "continue";
    public static final String K_ON_ERROR_START_NEXT_LOOP = "startnextloop";
    public static final String K_ON_ERROR_STOP_THREAD = "stopthread";
    public static final String K_ON_ERROR_STOP_TEST = "stoptest";
    public static final String K_ON_ERROR_STOP_TEST_NOW = "stoptestnow";

    /** loops value for "Infinite" in the gui */
    public static final int K_INFINITE_LOOPS = -1;

    private IntOrExpression numThreads = IntOrExpression.of(1);
    private IntOrExpression rampTime = IntOrExpression.of(1);
    private IntOrExpression loops = IntOrExpression.of(1);
    private boolean continueForever;
    private String onSampleError = K_ON_ERROR_CONTINUE;
    private boolean scheduler;
    private IntOrExpression duration;
    private IntOrExpression delay;
    private boolean sameUserOnNextIteration = true;
    private boolean delayedStart;

    public ThreadGroup() {
        this(ElementKind.THREAD_GROUP);
    }

    /**
     * @param kind THREAD_GROUP, SETUP_THREAD_GROUP or POST_THREAD_GROUP
     */
    public ThreadGroup(ElementKind kind) {
        super(kind);
        if (!kind.isThreadGroup()) {
            throw new IllegalArgumentException("Not a thread group kind : " + kind);
        }
    }

    public IntOrExpression getNumThreads() {
        return numThreads;
    }

    public void setNumThreads(IntOrExpression numThreads) {
        this.numThreads = Objects.requireNonNull(numThreads, "numThreads");
    }

    public IntOrExpression getRampTime() {
        return rampTime;
    }

    public void setRampTime(IntOrExpression rampTime) {
        this.rampTime = Objects.requireNonNull(rampTime, "rampTime");
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

    /**
     * @return true if the threads loop until the scheduler or the test stops them
     */
    public boolean isInfinite() {
        return continueForever || (loops.isInt() && loops.getInt() == K_INFINITE_LOOPS);
    }

    public String getOnSampleError() {
        return onSampleError;
    }

    public void setOnSampleError(String onSampleError) {
        this.onSampleError = onSampleError;
    }

    public boolean isScheduler() {
        return scheduler;
    }

    public void setScheduler(boolean scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * @return the scheduler duration in seconds, null when not set
     */
    public IntOrExpression getDuration() {
        return duration;
    }

    public void setDuration(IntOrExpression duration) {
        this.duration = duration;
    }

    /**
     * @return the scheduler startup delay in seconds, null when not set
     */
    public IntOrExpression getDelay() {
        return delay;
    }

    public void setDelay(IntOrExpression delay) {
        this.delay = delay;
    }

    public boolean isSameUserOnNextIteration() {
        return sameUserOnNextIteration;
    }

    public void setSameUserOnNextIteration(boolean sameUserOnNextIteration) {
        this.sameUserOnNextIteration = sameUserOnNextIteration;
    }

    public boolean isDelayedStart() {
        return delayedStart;
    }

    public void setDelayedStart(boolean delayedStart) {
        this.delayedStart = delayedStart;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        ThreadGroup that = (ThreadGroup) o;
        return continueForever == that.continueForever
                && scheduler == that.scheduler
                && sameUserOnNextIteration == that.sameUserOnNextIteration
                && delayedStart == that.delayedStart
                && numThreads.equals(that.numThreads)
                && rampTime.equals(that.rampTime)
                && loops.equals(that.loops)
                && Objects.equals(onSampleError, that.onSampleError)
                && Objects.equals(duration, that.duration)
                && Objects.equals(delay, that.delay);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), numThreads, rampTime, loops, continueForever, onSampleError, scheduler, duration, delay,
                sameUserOnNextIteration, delayedStart);
    }
}
