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
import io.github.vdaburon.jmeter.jmx.model.DurationAssertion;
import io.github.vdaburon.jmeter.jmx.model.ElementKind;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

public class DurationAssertionCodec extends AbstractElementCodec<DurationAssertion> {

    public DurationAssertionCodec() {
        super(ElementKind.DURATION_ASSERTION);
    }

    @Override
    protected DurationAssertion newElement() {
        return new DurationAssertion();
    }

    @Override
    protected void readProperties(Element node, DurationAssertion element) {
        element.setDuration(JmxProperties.getIntOrExpression(node, "DurationAssertion.duration").orElse(null));
        element.setScope(JmxProperties.getString(node, RegexExtractorCodec.K_SCOPE).orElse(null));
    }

    @Override
    protected void writeProperties(Document document, Element node, DurationAssertion element) {
        JmxProperties.setIntOrExpression(document, node, "DurationAssertion.duration", element.getDuration());
        JmxProperties.setString(document, node, RegexExtractorCodec.K_SCOPE, element.getScope());
    }
}
