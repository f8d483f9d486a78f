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
import io.github.vdaburon.jmeter.jmx.model.LoopController;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * <pre>
 * &lt;LoopController guiclass="LoopControlPanel" testclass="LoopController" testname="Loop Controller" enabled="true"&gt;
 *   &lt;stringProp name="LoopController.loops"&gt;${LOOP_COUNT}&lt;/stringProp&gt;
 *   &lt;boolProp name="LoopController.continue_forever"&gt;true&lt;/boolProp&gt;
 * &lt;/LoopController&gt;
 * </pre>
 */
public class LoopControllerCodec extends AbstractElementCodec<LoopController> {

    public LoopControllerCodec() {
        super(ElementKind.LOOP_CONTROLLER);
    }

    @Override
    protected LoopController newElement() {
        return new LoopController();
    }

    @Override
    protected void readProperties(Element node, LoopController element) {
        JmxProperties.getIntOrExpression(node, ThreadGroupCodec.K_LOOPS).ifPresent(element::setLoops);
        element.setContinueForever(JmxProperties.getBool(node, ThreadGroupCodec.K_CONTINUE_FOREVER, element.isContinueForever()));
    }

    @Override
    protected void writeProperties(Document document, Element node, LoopController element) {
        JmxProperties.setIntOrExpression(document, node, ThreadGroupCodec.K_LOOPS, element.getLoops());
        JmxProperties.setBool(document, node, ThreadGroupCodec.K_CONTINUE_FOREVER, element.isContinueForever());
    }
}
