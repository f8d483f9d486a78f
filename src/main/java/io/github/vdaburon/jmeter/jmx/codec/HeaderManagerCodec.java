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
import io.github.vdaburon.jmeter.jmx.model.Header;
import io.github.vdaburon.jmeter.jmx.model.HeaderManager;
import org.apache.commons.lang3.StringUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * <pre>
 * &lt;HeaderManager guiclass="HeaderPanel" testclass="HeaderManager" testname="HTTP Header Manager" enabled="true"&gt;
 *   &lt;collectionProp name="HeaderManager.headers"&gt;
 *     &lt;elementProp name="" elementType="Header"&gt;
 *       &lt;stringProp name="Header.name"&gt;Accept&lt;/stringProp&gt;
 *       &lt;stringProp name="Header.value"&gt;application/json&lt;/stringProp&gt;
 *     &lt;/elementProp&gt;
 *   &lt;/collectionProp&gt;
 * &lt;/HeaderManager&gt;
 * </pre>
 */
public class HeaderManagerCodec extends AbstractElementCodec<HeaderManager> {

    public static final String K_HEADERS = "HeaderManager.headers";

    public HeaderManagerCodec() {
        super(ElementKind.HEADER_MANAGER);
    }

    @Override
    protected HeaderManager newElement() {
        return new HeaderManager();
    }

    @Override
    protected void readProperties(Element node, HeaderManager element) {
        Element eltCollection = JmxProperties.findCollectionProp(node, K_HEADERS);
        if (eltCollection == null) {
            return;
        }
        for (Element eltHeader : JmxProperties.childElements(eltCollection, JmxProperties.K_ELEMENT_PROP)) {
            String name = JmxProperties.getString(eltHeader, "Header.name").orElse("");
            String value = JmxProperties.getString(eltHeader, "Header.value").orElse("");
            element.getHeaders().add(new Header(name, value));
        }
    }

    @Override
    protected void writeProperties(Document document, Element node, HeaderManager element) {
        Element eltCollection = JmxProperties.createProperty(document, JmxProperties.K_COLLECTION_PROP, K_HEADERS, null);
        for (Header header : element.getHeaders()) {
            Element eltHeader = JmxProperties.createElementProp(document, "", "Header", null, null, null);
            JmxProperties.setString(document, eltHeader, "Header.name", StringUtils.defaultString(header.getName()));
            JmxProperties.setString(document, eltHeader, "Header.value", StringUtils.defaultString(header.getValue()));
            eltCollection.appendChild(eltHeader);
        }
        node.appendChild(eltCollection);
    }
}
