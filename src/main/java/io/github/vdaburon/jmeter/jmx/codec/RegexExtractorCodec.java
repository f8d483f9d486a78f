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
import io.github.vdaburon.jmeter.jmx.model.RegexExtractor;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * <pre>
 * &lt;RegexExtractor guiclass="RegexExtractorGui" testclass="RegexExtractor" testname="Regular Expression Extractor" enabled="true"&gt;
 *   &lt;stringProp name="RegexExtractor.useHeaders"&gt;false&lt;/stringProp&gt;
 *   &lt;stringProp name="RegexExtractor.refname"&gt;SESSION_ID&lt;/stringProp&gt;
 *   &lt;stringProp name="RegexExtractor.regex"&gt;jsessionid=(\w+)&lt;/stringProp&gt;
 *   &lt;stringProp name="RegexExtractor.template"&gt;$1$&lt;/stringProp&gt;
 *   &lt;stringProp name="RegexExtractor.default"&gt;NOT_FOUND&lt;/stringProp&gt;
 *   &lt;boolProp name="RegexExtractor.default_empty_value"&gt;false&lt;/boolProp&gt;
 *   &lt;stringProp name="RegexExtractor.match_number"&gt;1&lt;/stringProp&gt;
 * &lt;/RegexExtractor&gt;
 * </pre>
 */
public class RegexExtractorCodec extends AbstractElementCodec<RegexExtractor> {

    public static final String K_SCOPE = "Sample.scope";
    public static final String K_SCOPE_VARIABLE = "Scope.variable";

    public RegexExtractorCodec() {
        super(ElementKind.REGEX_EXTRACTOR);
    }

    @Override
    protected RegexExtractor newElement() {
        return new RegexExtractor();
    }

    @Override
    protected void readProperties(Element node, RegexExtractor element) {
        element.setUseHeaders(JmxProperties.getString(node, "RegexExtractor.useHeaders").orElse(element.getUseHeaders()));
        element.setRefName(JmxProperties.getString(node, "RegexExtractor.refname").orElse(element.getRefName()));
        element.setRegex(JmxProperties.getString(node, "RegexExtractor.regex").orElse(element.getRegex()));
        element.setTemplate(JmxProperties.getString(node, "RegexExtractor.template").orElse(element.getTemplate()));
        element.setDefaultValue(JmxProperties.getString(node, "RegexExtractor.default").orElse(element.getDefaultValue()));
        element.setDefaultEmptyValue(JmxProperties.getBool(node, "RegexExtractor.default_empty_value", element.isDefaultEmptyValue()));
        JmxProperties.getIntOrExpression(node, "RegexExtractor.match_number").ifPresent(element::setMatchNumber);
        element.setScope(JmxProperties.getString(node, K_SCOPE).orElse(null));
        element.setScopeVariable(JmxProperties.getString(node, K_SCOPE_VARIABLE).orElse(null));
    }

    @Override
    protected void writeProperties(Document document, Element node, RegexExtractor element) {
        JmxProperties.setString(document, node, "RegexExtractor.useHeaders", element.getUseHeaders());
        JmxProperties.setString(document, node, "RegexExtractor.refname", element.getRefName());
        JmxProperties.setString(document, node, "RegexExtractor.regex", element.getRegex());
        JmxProperties.setString(document, node, "RegexExtractor.template", element.getTemplate());
        JmxProperties.setString(document, node, "RegexExtractor.default", element.getDefaultValue());
        JmxProperties.setBool(document, node, "RegexExtractor.default_empty_value", element.isDefaultEmptyValue());
        JmxProperties.setIntOrExpression(document, node, "RegexExtractor.match_number", element.getMatchNumber());
        JmxProperties.setString(document, node, K_SCOPE, element.getScope());
        JmxProperties.setString(document, node, K_SCOPE_VARIABLE, element.getScopeVariable());
    }
}
