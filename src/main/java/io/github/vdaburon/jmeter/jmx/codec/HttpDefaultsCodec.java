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
import io.github.vdaburon.jmeter.jmx.model.HttpDefaults;
import org.apache.commons.lang3.StringUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * HTTP Request Defaults, a ConfigTestElement with the HttpDefaultsGui.
 * The other ConfigTestElement (Java Request Defaults, TCP Sampler Config, Simple Config Element) are not decoded here.
 */
public class HttpDefaultsCodec extends AbstractHttpCodec<HttpDefaults> {

    public HttpDefaultsCodec() {
        super(ElementKind.HTTP_DEFAULTS);
    }

    /**
     * @return true for the HttpDefaultsGui guiclass, short or qualified, or no guiclass at all
     */
    @Override
    public boolean accepts(Element node) {
        String guiClass = node.getAttribute(JmxProperties.K_ATTR_GUICLASS);
        String expected = ElementKind.HTTP_DEFAULTS.getGuiClass();
        return StringUtils.isEmpty(guiClass) || expected.equals(guiClass) || guiClass.endsWith("." + expected);
    }

    @Override
    protected HttpDefaults newElement() {
        return new HttpDefaults();
    }

    @Override
    protected void writeProperties(Document document, Element node, HttpDefaults element) {
        writeHttpArguments(document, node, element);
        writeTarget(document, node, element);
        writeTimeouts(document, node, element);
    }
}
