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
import io.github.vdaburon.jmeter.jmx.model.TestAction;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Flow Control Action
 * <pre>
 * &lt;TestAction guiclass="TestActionGui" testclass="TestAction" testname="fca PAUSE" enabled="true"&gt;
 *   &lt;intProp name="ActionProcessor.action"&gt;1&lt;/intProp&gt;
 *   &lt;intProp name="ActionProcessor.target"&gt;0&lt;/intProp&gt;
 *   &lt;stringProp name="ActionProcessor.duration"&gt;${K_THINK_TIME}&lt;/stringProp&gt;
 * &lt;/TestAction&gt;
 * </pre>
 */
public class TestActionCodec extends AbstractElementCodec<TestAction> {

    public TestActionCodec() {
        super(ElementKind.TEST_ACTION);
    }

    @Override
    protected TestAction newElement() {
        return new TestAction();
    }

    @Override
    protected void readProperties(Element node, TestAction element) {
        element.setAction(JmxProperties.getInt(node, "ActionProcessor.action").orElse(element.getAction()));
        element.setTarget(JmxProperties.getInt(node, "ActionProcessor.target").orElse(element.getTarget()));
        JmxProperties.getIntOrExpression(node, "ActionProcessor.duration").ifPresent(element::setDuration);
    }

    @Override
    protected void writeProperties(Document document, Element node, TestAction element) {
        JmxProperties.setInt(document, node, "ActionProcessor.action", element.getAction());
        JmxProperties.setInt(document, node, "ActionProcessor.target", element.getTarget());
        JmxProperties.setIntOrExpression(document, node, "ActionProcessor.duration", element.getDuration());
    }
}
