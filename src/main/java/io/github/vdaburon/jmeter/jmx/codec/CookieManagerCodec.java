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
import io.github.vdaburon.jmeter.jmx.model.CookieManager;
import io.github.vdaburon.jmeter.jmx.model.ElementKind;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * <pre>
 * &lt;CookieManager guiclass="CookiePanel" testclass="CookieManager" testname="HTTP Cookie Manager" enabled="true"&gt;
 *   &lt;collectionProp name="CookieManager.cookies"/&gt;
 *   &lt;boolProp name="CookieManager.clearEachIteration"&gt;false&lt;/boolProp&gt;
 *   &lt;boolProp name="CookieManager.controlledByThreadGroup"&gt;false&lt;/boolProp&gt;
 * &lt;/CookieManager&gt;
 * </pre>
 * The user defined cookies are not kept, the collection is written empty.
 */
public class CookieManagerCodec extends AbstractElementCodec<CookieManager> {

    public CookieManagerCodec() {
        super(ElementKind.COOKIE_MANAGER);
    }

    @Override
    protected CookieManager newElement() {
        return new CookieManager();
    }

    @Override
    protected void readProperties(Element node, CookieManager element) {
        element.setClearEachIteration(JmxProperties.getBool(node, "CookieManager.clearEachIteration", element.isClearEachIteration()));
        element.setControlledByThreadGroup(JmxProperties.getBool(node, "CookieManager.controlledByThreadGroup", element.isControlledByThreadGroup()));
        element.setPolicy(JmxProperties.getString(node, "CookieManager.policy").orElse(null));
    }

    @Override
    protected void writeProperties(Document document, Element node, CookieManager element) {
        node.appendChild(JmxProperties.createProperty(document, JmxProperties.K_COLLECTION_PROP, "CookieManager.cookies", null));
        JmxProperties.setBool(document, node, "CookieManager.clearEachIteration", element.isClearEachIteration());
        JmxProperties.setBool(document, node, "CookieManager.controlledByThreadGroup", element.isControlledByThreadGroup());
        JmxProperties.setString(document, node, "CookieManager.policy", element.getPolicy());
    }
}
