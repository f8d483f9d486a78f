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
import io.github.vdaburon.jmeter.jmx.model.ConstantThroughputTimer;
import io.github.vdaburon.jmeter.jmx.model.ElementKind;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Constant Throughput Timer, a TestBean : the properties have no prefix and the throughput is a doubleProp
 */
public class ConstantThroughputTimerCodec extends AbstractElementCodec<ConstantThroughputTimer> {

    public static final String K_THROUGHPUT = "throughput";
    public static final String K_CALC_MODE = "calcMode";

    public ConstantThroughputTimerCodec() {
        super(ElementKind.CONSTANT_THROUGHPUT_TIMER);
    }

    @Override
    protected ConstantThroughputTimer newElement() {
        return new ConstantThroughputTimer();
    }

    @Override
    protected void readProperties(Element node, ConstantThroughputTimer element) {
        element.setThroughput(JmxProperties.getDoubleText(node, K_THROUGHPUT).orElse(element.getThroughput()));
        element.setCalcMode(JmxProperties.getInt(node, K_CALC_MODE).orElse(element.getCalcMode()));
    }

    @Override
    protected void writeProperties(Document document, Element node, ConstantThroughputTimer element) {
        JmxProperties.setInt(document, node, K_CALC_MODE, element.getCalcMode());
        JmxProperties.setDoubleText(document, node, K_THROUGHPUT, element.getThroughput());
    }
}
