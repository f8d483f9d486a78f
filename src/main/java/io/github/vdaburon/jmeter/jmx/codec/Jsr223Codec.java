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
import io.github.vdaburon.jmeter.jmx.model.Jsr223Element;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Codec of the JSR223 Sampler, PreProcessor and PostProcessor, test beans with the same string properties
 * <pre>
 * &lt;JSR223PostProcessor guiclass="TestBeanGUI" testclass="JSR223PostProcessor" testname="JSR223 PostProcessor" enabled="true"&gt;
 *   &lt;stringProp name="scriptLanguage"&gt;groovy&lt;/stringProp&gt;
 *   &lt;stringProp name="parameters"&gt;&lt;/stringProp&gt;
 *   &lt;stringProp name="filename"&gt;&lt;/stringProp&gt;
 *   &lt;stringProp name="cacheKey"&gt;true&lt;/stringProp&gt;
 *   &lt;stringProp name="script"&gt;vars.put("TOKEN", prev.getResponseDataAsString())&lt;/stringProp&gt;
 * &lt;/JSR223PostProcessor&gt;
 * </pre>
 */
public class Jsr223Codec extends AbstractElementCodec<Jsr223Element> {

    public Jsr223Codec(ElementKind kind) {
        super(kind);
    }

    @Override
    protected Jsr223Element newElement() {
        return new Jsr223Element(kind());
    }

    @Override
    protected void readProperties(Element node, Jsr223Element element) {
        element.setScriptLanguage(JmxProperties.getString(node, "scriptLanguage").orElse(element.getScriptLanguage()));
        element.setParameters(JmxProperties.getString(node, "parameters").orElse(element.getParameters()));
        element.setFilename(JmxProperties.getString(node, "filename").orElse(element.getFilename()));
        element.setCacheKey(JmxProperties.getString(node, "cacheKey").orElse(element.getCacheKey()));
        element.setScript(JmxProperties.getString(node, "script").orElse(element.getScript()));
    }

    @Override
    protected void writeProperties(Document document, Element node, Jsr223Element element) {
        JmxProperties.setString(document, node, "scriptLanguage", element.getScriptLanguage());
        JmxProperties.setString(document, node, "parameters", element.getParameters());
        JmxProperties.setString(document, node, "filename", element.getFilename());
        JmxProperties.setString(document, node, "cacheKey", element.getCacheKey());
        JmxProperties.setString(document, node, "script", element.getScript());
    }
}
