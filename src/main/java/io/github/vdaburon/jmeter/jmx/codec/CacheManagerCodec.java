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
import io.github.vdaburon.jmeter.jmx.model.CacheManager;
import io.github.vdaburon.jmeter.jmx.model.ElementKind;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * <pre>
 * &lt;CacheManager guiclass="CacheManagerGui" testclass="CacheManager" testname="HTTP Cache Manager" enabled="true"&gt;
 *   &lt;boolProp name="clearEachIteration"&gt;false&lt;/boolProp&gt;
 *   &lt;boolProp name="useExpires"&gt;true&lt;/boolProp&gt;
 *   &lt;boolProp name="CacheManager.controlledByThread"&gt;false&lt;/boolProp&gt;
 * &lt;/CacheManager&gt;
 * </pre>
 */
public class CacheManagerCodec extends AbstractElementCodec<CacheManager> {

    public CacheManagerCodec() {
        super(ElementKind.CACHE_MANAGER);
    }

    @Override
    protected CacheManager newElement() {
        return new CacheManager();
    }

    @Override
    protected void readProperties(Element node, CacheManager element) {
        element.setClearEachIteration(JmxProperties.getBool(node, "clearEachIteration", element.isClearEachIteration()));
        element.setUseExpires(JmxProperties.getBool(node, "useExpires", element.isUseExpires()));
        element.setControlledByThread(JmxProperties.getBool(node, "CacheManager.controlledByThread", element.isControlledByThread()));
    }

    @Override
    protected void writeProperties(Document document, Element node, CacheManager element) {
        JmxProperties.setBool(document, node, "clearEachIteration", element.isClearEachIteration());
        JmxProperties.setBool(document, node, "useExpires", element.isUseExpires());
        JmxProperties.setBool(document, node, "CacheManager.controlledByThread", element.isControlledByThread());
    }
}
