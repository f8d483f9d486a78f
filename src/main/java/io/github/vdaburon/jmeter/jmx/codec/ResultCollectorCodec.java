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
import io.github.vdaburon.jmeter.jmx.model.ResultCollector;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.Map;

/**
 * Listener
 * <pre>
 * &lt;ResultCollector guiclass="ViewResultsFullVisualizer" testclass="ResultCollector" testname="View Results Tree" enabled="true"&gt;
 *   &lt;boolProp name="ResultCollector.error_logging"&gt;false&lt;/boolProp&gt;
 *   &lt;objProp&gt;
 *     &lt;name&gt;saveConfig&lt;/name&gt;
 *     &lt;value class="SampleSaveConfiguration"&gt;
 *       &lt;time&gt;true&lt;/time&gt;
 *       &lt;latency&gt;true&lt;/latency&gt;
 *       ...
 *       &lt;connectTime&gt;true&lt;/connectTime&gt;
 *     &lt;/value&gt;
 *   &lt;/objProp&gt;
 *   &lt;stringProp name="filename"&gt;&lt;/stringProp&gt;
 * &lt;/ResultCollector&gt;
 * </pre>
 * The save configuration flags read replace the default flags, in the order of the file.
 */
public class ResultCollectorCodec extends AbstractElementCodec<ResultCollector> {

    public static final String K_SAVE_CONFIG = "saveConfig";
    public static final String K_SAVE_CONFIG_CLASS = "SampleSaveConfiguration";

    public ResultCollectorCodec() {
        super(ElementKind.RESULT_COLLECTOR);
    }

    @Override
    protected ResultCollector newElement() {
        return new ResultCollector();
    }

    @Override
    protected void readProperties(Element node, ResultCollector element) {
        element.setErrorLogging(JmxProperties.getBool(node, "ResultCollector.error_logging", element.isErrorLogging()));
        Element eltValue = JmxProperties.findObjPropValue(node, K_SAVE_CONFIG);
        if (eltValue != null) {
            Map<String, String> saveConfig = element.getSaveConfig();
            saveConfig.clear();
            for (Element eltFlag : JmxProperties.childElements(eltValue)) {
                saveConfig.put(eltFlag.getTagName(), eltFlag.getTextContent().trim());
            }
        }
        element.setFilename(JmxProperties.getString(node, "filename").orElse(element.getFilename()));
    }

    @Override
    protected void writeProperties(Document document, Element node, ResultCollector element) {
        JmxProperties.setBool(document, node, "ResultCollector.error_logging", element.isErrorLogging());

        Element eltObjProp = document.createElement(JmxProperties.K_OBJ_PROP);
        Element eltName = document.createElement("name");
        eltName.setTextContent(K_SAVE_CONFIG);
        eltObjProp.appendChild(eltName);
        Element eltValue = document.createElement("value");
        eltValue.setAttribute("class", K_SAVE_CONFIG_CLASS);
        for (Map.Entry<String, String> entry : element.getSaveConfig().entrySet()) {
            Element eltFlag = document.createElement(entry.getKey());
            eltFlag.setTextContent(entry.getValue());
            eltValue.appendChild(eltFlag);
        }
        eltObjProp.appendChild(eltValue);
        node.appendChild(eltObjProp);

        JmxProperties.setString(document, node, "filename", element.getFilename());
    }
}
