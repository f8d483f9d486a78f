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
import io.github.vdaburon.jmeter.jmx.model.ConstantTimer;
import io.github.vdaburon.jmeter.jmx.model.ElementKind;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

public class ConstantTimerCodec extends AbstractElementCodec<ConstantTimer> {

    public static final String K_DELAY = "ConstantTimer.delay";

    public ConstantTimerCodec() {
        super(ElementKind.CONSTANT_TIMER);
    }

    @Override
    protected ConstantTimer newElement() {
        return new ConstantTimer();
    }

    @Override
    protected void readProperties(Element node, ConstantTimer element) {
        element.setDelay(JmxProperties.getString(node, K_DELAY).orElse(element.getDelay()));
    }

    @Override
    protected void writeProperties(Document document, Element node, ConstantTimer element) {
        JmxProperties.setString(document, node, K_DELAY, element.getDelay());
    }
}
