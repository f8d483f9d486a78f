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
import io.github.vdaburon.jmeter.jmx.model.WhileController;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

public class WhileControllerCodec extends AbstractElementCodec<WhileController> {

    public WhileControllerCodec() {
        super(ElementKind.WHILE_CONTROLLER);
    }

    @Override
    protected WhileController newElement() {
        return new WhileController();
    }

    @Override
    protected void readProperties(Element node, WhileController element) {
        element.setCondition(JmxProperties.getString(node, "WhileController.condition").orElse(element.getCondition()));
    }

    @Override
    protected void writeProperties(Document document, Element node, WhileController element) {
        JmxProperties.setString(document, node, "WhileController.condition", element.getCondition());
    }
}
