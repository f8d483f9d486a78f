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
import io.github.vdaburon.jmeter.jmx.model.JsonExtractor;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * <pre>
 * &lt;JSONPostProcessor guiclass="JSONPostProcessorGui" testclass="JSONPostProcessor" testname="JSON Extractor" enabled="true"&gt;
 *   &lt;stringProp name="JSONPostProcessor.referenceNames"&gt;TOKEN&lt;/stringProp&gt;
 *   &lt;stringProp name="JSONPostProcessor.jsonPathExprs"&gt;$.access_token&lt;/stringProp&gt;
 *   &lt;stringProp name="JSONPostProcessor.match_numbers"&gt;1&lt;/stringProp&gt;
 *   &lt;stringProp name="JSONPostProcessor.defaultValues"&gt;NOT_FOUND&lt;/stringProp&gt;
 *   &lt;boolProp name="JSONPostProcessor.compute_concat"&gt;false&lt;/boolProp&gt;
 * &lt;/JSONPostProcessor&gt;
 * </pre>
 */
public class JsonExtractorCodec extends AbstractElementCodec<JsonExtractor> {

    public JsonExtractorCodec() {
        super(ElementKind.JSON_EXTRACTOR);
    }

    @Override
    protected JsonExtractor newElement() {
        return new JsonExtractor();
    }

    @Override
    protected void readProperties(Element node, JsonExtractor element) {
        element.setReferenceNames(JmxProperties.getString(node, "JSONPostProcessor.referenceNames").orElse(element.getReferenceNames()));
        element.setJsonPathExprs(JmxProperties.getString(node, "JSONPostProcessor.jsonPathExprs").orElse(element.getJsonPathExprs()));
        element.setMatchNumbers(JmxProperties.getString(node, "JSONPostProcessor.match_numbers").orElse(element.getMatchNumbers()));
        element.setDefaultValues(JmxProperties.getString(node, "JSONPostProcessor.defaultValues").orElse(element.getDefaultValues()));
        element.setComputeConcatenation(JmxProperties.getBool(node, "JSONPostProcessor.compute_concat", element.isComputeConcatenation()));
        element.setScope(JmxProperties.getString(node, RegexExtractorCodec.K_SCOPE).orElse(null));
    }

    @Override
    protected void writeProperties(Document document, Element node, JsonExtractor element) {
        JmxProperties.setString(document, node, "JSONPostProcessor.referenceNames", element.getReferenceNames());
        JmxProperties.setString(document, node, "JSONPostProcessor.jsonPathExprs", element.getJsonPathExprs());
        JmxProperties.setString(document, node, "JSONPostProcessor.match_numbers", element.getMatchNumbers());
        JmxProperties.setString(document, node, "JSONPostProcessor.defaultValues", element.getDefaultValues());
        JmxProperties.setBool(document, node, "JSONPostProcessor.compute_concat", element.isComputeConcatenation());
        JmxProperties.setString(document, node, RegexExtractorCodec.K_SCOPE, element.getScope());
    }
}
