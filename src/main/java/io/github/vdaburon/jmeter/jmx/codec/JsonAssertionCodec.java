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
import io.github.vdaburon.jmeter.jmx.model.JsonAssertion;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * <pre>
 * &lt;JSONPathAssertion guiclass="JSONPathAssertionGui" testclass="JSONPathAssertion" testname="JSON Assertion" enabled="true"&gt;
 *   &lt;stringProp name="JSON_PATH"&gt;$.status&lt;/stringProp&gt;
 *   &lt;stringProp name="EXPECTED_VALUE"&gt;UP&lt;/stringProp&gt;
 *   &lt;boolProp name="JSONVALIDATION"&gt;true&lt;/boolProp&gt;
 *   &lt;boolProp name="EXPECT_NULL"&gt;false&lt;/boolProp&gt;
 *   &lt;boolProp name="INVERT"&gt;false&lt;/boolProp&gt;
 *   &lt;boolProp name="ISREGEX"&gt;true&lt;/boolProp&gt;
 * &lt;/JSONPathAssertion&gt;
 * </pre>
 */
public class JsonAssertionCodec extends AbstractElementCodec<JsonAssertion> {

    public JsonAssertionCodec() {
        super(ElementKind.JSON_ASSERTION);
    }

    @Override
    protected JsonAssertion newElement() {
        return new JsonAssertion();
    }

    @Override
    protected void readProperties(Element node, JsonAssertion element) {
        element.setJsonPath(JmxProperties.getString(node, "JSON_PATH").orElse(element.getJsonPath()));
        element.setExpectedValue(JmxProperties.getString(node, "EXPECTED_VALUE").orElse(element.getExpectedValue()));
        element.setJsonValidation(JmxProperties.getBool(node, "JSONVALIDATION", element.isJsonValidation()));
        element.setExpectNull(JmxProperties.getBool(node, "EXPECT_NULL", element.isExpectNull()));
        element.setInvert(JmxProperties.getBool(node, "INVERT", element.isInvert()));
        element.setRegex(JmxProperties.getBool(node, "ISREGEX", element.isRegex()));
    }

    @Override
    protected void writeProperties(Document document, Element node, JsonAssertion element) {
        JmxProperties.setString(document, node, "JSON_PATH", element.getJsonPath());
        JmxProperties.setString(document, node, "EXPECTED_VALUE", element.getExpectedValue());
        JmxProperties.setBool(document, node, "JSONVALIDATION", element.isJsonValidation());
        JmxProperties.setBool(document, node, "EXPECT_NULL", element.isExpectNull());
        JmxProperties.setBool(document, node, "INVERT", element.isInvert());
        JmxProperties.setBool(document, node, "ISREGEX", element.isRegex());
    }
}
