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


package io.github.vdaburon.jmeter.jmx.codec;

import io.github.vdaburon.jmeter.jmx.JmxProperties;
import io.github.vdaburon.jmeter.jmx.model.ElementKind;
import io.github.vdaburon.jmeter.jmx.model.ThreadGroup;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Codec of the thread groups (ThreadGroup, setUp and tearDown thread groups share the same properties)
 * <pre>
 * &lt;ThreadGroup guiclass="ThreadGroupGui" testclass="ThreadGroup" testname="Thread Group" enabled="true"&gt;
 *   &lt;stringProp name="ThreadGroup.num_threads"&gt;1&lt;/stringProp&gt;
 *   &lt;stringProp name="ThreadGroup.ramp_time"&gt;1&lt;/stringProp&gt;
 *   &lt;elementProp name="ThreadGroup.main_controller" elementType="LoopController" guiclass="LoopControlPanel" testclass="LoopController" testname="Loop Controller"&gt;
 *     &lt;stringProp name="LoopController.loops"&gt;1&lt;/stringProp&gt;
 *     &lt;boolProp name="LoopController.continue_forever"&gt;false&lt;/boolProp&gt;
 *   &lt;/elementProp&gt;
 *   &lt;stringProp name="ThreadGroup.on_sample_error"&gt;continue&lt;/stringProp&gt;
 *   &lt;boolProp name="ThreadGroup.delayedStart"&gt;false&lt;/boolProp&gt;
 *   &lt;boolProp name="ThreadGroup.scheduler"&gt;false&lt;/boolProp&gt;
 *   &lt;stringProp name="ThreadGroup.duration"&gt;&lt;/stringProp&gt;
 *   &lt;stringProp name="ThreadGroup.delay"&gt;&lt;/stringProp&gt;
 *   &lt;boolProp name="ThreadGroup.same_user_on_next_iteration"&gt;true&lt;/boolProp&gt;
 * &lt;/ThreadGroup&gt;
 * </pre>
 * The loop count is read from the nested LoopController, a thread group without loop count runs once.
 */
public class ThreadGroupCodec extends AbstractElementCodec<ThreadGroup> {

    public static final String K_MAIN_CONTROLLER = "ThreadGroup.main_controller";
    public static final String K_LOOPS = "LoopController.loops";
    public static final String K_CONTINUE_FOREVER = "LoopController.continue_forever";

    public ThreadGroupCodec(ElementKind kind) {
        super(kind);
        if (!kind.isThreadGroup()) {
            throw new IllegalArgumentException("Not a thread group kind : " + kind);
        }
    }

    @Override
    protected ThreadGroup newElement() {
        return new ThreadGroup(kind());
    }

    @Override
    protected void readProperties(Element node, ThreadGroup element) {
        JmxProperties.getIntOrExpression(node, "ThreadGroup.num_threads").ifPresent(element::setNumThreads);
        JmxProperties.getIntOrExpression(node, "ThreadGroup.ramp_time").ifPresent(element::setRampTime);

        Element eltLoopController = JmxProperties.findElementPropByType(node, "LoopController");
        if (eltLoopController != null) {
            JmxProperties.getIntOrExpression(eltLoopController, K_LOOPS).ifPresent(element::setLoops);
            element.setContinueForever(JmxProperties.getBool(eltLoopController, K_CONTINUE_FOREVER, element.isContinueForever()));
        }

        element.setOnSampleError(JmxProperties.getString(node, "ThreadGroup.on_sample_error").orElse(element.getOnSampleError()));
        element.setDelayedStart(JmxProperties.getBool(node, "ThreadGroup.delayedStart", element.isDelayedStart()));
        element.setScheduler(JmxProperties.getBool(node, "ThreadGroup.scheduler", element.isScheduler()));
        element.setDuration(JmxProperties.getIntOrExpression(node, "ThreadGroup.duration").orElse(null));
        element.setDelay(JmxProperties.getIntOrExpression(node, "ThreadGroup.delay").orElse(null));
        element.setSameUserOnNextIteration(JmxProperties.getBool(node, "ThreadGroup.same_user_on_next_iteration", element.isSameUserOnNextIteration()));
    }

    @Override
    protected void writeProperties(Document document, Element node, ThreadGroup element) {
        JmxProperties.setIntOrExpression(document, node, "ThreadGroup.num_threads", element.getNumThreads());
        JmxProperties.setIntOrExpression(document, node, "ThreadGroup.ramp_time", element.getRampTime());

        Element eltLoopController = JmxProperties.createElementProp(document, K_MAIN_CONTROLLER, "LoopController", "LoopControlPanel", "LoopController", "Loop Controller");
        JmxProperties.setIntOrExpression(document, eltLoopController, K_LOOPS, element.getLoops());
        JmxProperties.setBool(document, eltLoopController, K_CONTINUE_FOREVER, element.isContinueForever());
        node.appendChild(eltLoopController);

        JmxProperties.setString(document, node, "ThreadGroup.on_sample_error", element.getOnSampleError());
        JmxProperties.setBool(document, node, "ThreadGroup.delayedStart", element.isDelayedStart());
        JmxProperties.setBool(document, node, "ThreadGroup.scheduler", element.isScheduler());
        JmxProperties.setIntOrExpression(document, node, "ThreadGroup.duration", element.getDuration());
        JmxProperties.setIntOrExpression(document, node, "ThreadGroup.delay", element.getDelay());
        JmxProperties.setBool(document, node, "ThreadGroup.same_user_on_next_iteration", element.isSameUserOnNextIteration());
    }
}
