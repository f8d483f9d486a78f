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
import io.github.vdaburon.jmeter.jmx.model.IfController;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

public class IfControllerCodec extends AbstractElementCodec<IfController> {

    public IfControllerCodec() {
        super(ElementKind.IF_CONTROLLER);
    }

    @Override
    protected IfController newElement() {
        return new IfController();
    }

    @Override
    protected void readProperties(Element node, IfController element) {
        element.setCondition(JmxProperties.getString(node, "IfController.condition").orElse(element.getCondition()));
        element.setEvaluateAll(JmxProperties.getBool(node, "IfController.evaluateAll", element.isEvaluateAll()));
        element.setUseExpression(JmxProperties.getBool(node, "IfController.useExpression", element.isUseExpression()));
    }

    @Override
    protected void writeProperties(Document document, Element node, IfController element) {
        JmxProperties.setString(document, node, "IfController.condition", element.getCondition());
        JmxProperties.setBool(document, node, "IfController.evaluateAll", element.isEvaluateAll());
        JmxProperties.setBool(document, node, "IfController.useExpression", element.isUseExpression());
    }
}
