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
import io.github.vdaburon.jmeter.jmx.model.UniformRandomTimer;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * The constant part of the delay is stored under the ConstantTimer name, as JMeter does
 */
public class UniformRandomTimerCodec extends AbstractElementCodec<UniformRandomTimer> {

    public UniformRandomTimerCodec() {
        super(ElementKind.UNIFORM_RANDOM_TIMER);
    }

    @Override
    protected UniformRandomTimer newElement() {
        return new UniformRandomTimer();
    }

    @Override
    protected void readProperties(Element node, UniformRandomTimer element) {
        element.setDelay(JmxProperties.getString(node, ConstantTimerCodec.K_DELAY).orElse(element.getDelay()));
        element.setRange(JmxProperties.getString(node, "RandomTimer.range").orElse(element.getRange()));
    }

    @Override
    protected void writeProperties(Document document, Element node, UniformRandomTimer element) {
        JmxProperties.setString(document, node, ConstantTimerCodec.K_DELAY, element.getDelay());
        JmxProperties.setString(document, node, "RandomTimer.range", element.getRange());
    }
}
