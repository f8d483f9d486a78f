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
import io.github.vdaburon.jmeter.jmx.model.ResponseAssertion;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * <pre>
 * &lt;ResponseAssertion guiclass="AssertionGui" testclass="ResponseAssertion" testname="Response Assertion" enabled="true"&gt;
 *   &lt;collectionProp name="Asserion.test_strings"&gt;
 *     &lt;stringProp name="49586"&gt;200&lt;/stringProp&gt;
 *   &lt;/collectionProp&gt;
 *   &lt;stringProp name="Assertion.custom_message"&gt;&lt;/stringProp&gt;
 *   &lt;stringProp name="Assertion.test_field"&gt;Assertion.response_code&lt;/stringProp&gt;
 *   &lt;boolProp name="Assertion.assume_success"&gt;false&lt;/boolProp&gt;
 *   &lt;intProp name="Assertion.test_type"&gt;8&lt;/intProp&gt;
 * &lt;/ResponseAssertion&gt;
 * </pre>
 * "Asserion" is the spelling JMeter writes.
 */
public class ResponseAssertionCodec extends AbstractElementCodec<ResponseAssertion> {

    public static final String K_TEST_STRINGS = "Asserion.test_strings";

    public ResponseAssertionCodec() {
        super(ElementKind.RESPONSE_ASSERTION);
    }

    @Override
    protected ResponseAssertion newElement() {
        return new ResponseAssertion();
    }

    @Override
    protected void readProperties(Element node, ResponseAssertion element) {
        element.getTestStrings().addAll(JmxProperties.getStringCollection(node, K_TEST_STRINGS));
        element.setCustomMessage(JmxProperties.getString(node, "Assertion.custom_message").orElse(null));
        element.setTestField(JmxProperties.getString(node, "Assertion.test_field").orElse(element.getTestField()));
        element.setAssumeSuccess(JmxProperties.getBool(node, "Assertion.assume_success", element.isAssumeSuccess()));
        element.setTestType(JmxProperties.getInt(node, "Assertion.test_type").orElse(element.getTestType()));
        element.setScope(JmxProperties.getString(node, RegexExtractorCodec.K_SCOPE).orElse(null));
    }

    @Override
    protected void writeProperties(Document document, Element node, ResponseAssertion element) {
        JmxProperties.setStringCollection(document, node, K_TEST_STRINGS, element.getTestStrings());
        JmxProperties.setString(document, node, "Assertion.custom_message", element.getCustomMessage());
        JmxProperties.setString(document, node, "Assertion.test_field", element.getTestField());
        JmxProperties.setBool(document, node, "Assertion.assume_success", element.isAssumeSuccess());
        JmxProperties.setInt(document, node, "Assertion.test_type", element.getTestType());
        JmxProperties.setString(document, node, RegexExtractorCodec.K_SCOPE, element.getScope());
    }
}
