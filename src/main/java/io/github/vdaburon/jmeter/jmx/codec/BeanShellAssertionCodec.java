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
import io.github.vdaburon.jmeter.jmx.model.BeanShellAssertion;
import io.github.vdaburon.jmeter.jmx.model.ElementKind;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

public class BeanShellAssertionCodec extends AbstractElementCodec<BeanShellAssertion> {

    public static final String K_QUERY = "BeanShellAssertion.query";
    public static final String K_FILENAME = "BeanShellAssertion.filename";
    public static final String K_PARAMETERS = "BeanShellAssertion.parameters";
    public static final String K_RESET_INTERPRETER = "BeanShellAssertion.resetInterpreter";

    public BeanShellAssertionCodec() {
        super(ElementKind.BEANSHELL_ASSERTION);
    }

    @Override
    protected BeanShellAssertion newElement() {
        return new BeanShellAssertion();
    }

    @Override
    protected void readProperties(Element node, BeanShellAssertion element) {
        element.setQuery(JmxProperties.getString(node, K_QUERY).orElse(element.getQuery()));
        element.setFilename(JmxProperties.getString(node, K_FILENAME).orElse(element.getFilename()));
        element.setParameters(JmxProperties.getString(node, K_PARAMETERS).orElse(element.getParameters()));
        element.setResetInterpreter(JmxProperties.getBool(node, K_RESET_INTERPRETER, element.isResetInterpreter()));
    }

    @Override
    protected void writeProperties(Document document, Element node, BeanShellAssertion element) {
        JmxProperties.setString(document, node, K_QUERY, element.getQuery());
        JmxProperties.setString(document, node, K_FILENAME, element.getFilename());
        JmxProperties.setString(document, node, K_PARAMETERS, element.getParameters());
        JmxProperties.setBool(document, node, K_RESET_INTERPRETER, element.isResetInterpreter());
    }
}
