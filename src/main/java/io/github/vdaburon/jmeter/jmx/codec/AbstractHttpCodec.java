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
import io.github.vdaburon.jmeter.jmx.model.AbstractHttpElement;
import io.github.vdaburon.jmeter.jmx.model.Argument;
import io.github.vdaburon.jmeter.jmx.model.ElementKind;
import io.github.vdaburon.jmeter.jmx.model.HttpArgument;
import org.apache.commons.lang3.StringUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Properties shared by the HTTP Request and the HTTP Request Defaults : target server, path, timeouts and parameters.
 * <pre>
 * &lt;elementProp name="HTTPsampler.Arguments" elementType="Arguments" guiclass="HTTPArgumentsPanel" testclass="Arguments" testname="User Defined Variables"&gt;
 *   &lt;collectionProp name="Arguments.arguments"&gt;
 *     &lt;elementProp name="q" elementType="HTTPArgument"&gt;
 *       &lt;boolProp name="HTTPArgument.always_encode"&gt;false&lt;/boolProp&gt;
 *       &lt;stringProp name="Argument.value"&gt;jmeter&lt;/stringProp&gt;
 *       &lt;stringProp name="Argument.metadata"&gt;=&lt;/stringProp&gt;
 *       &lt;boolProp name="HTTPArgument.use_equals"&gt;true&lt;/boolProp&gt;
 *       &lt;stringProp name="Argument.name"&gt;q&lt;/stringProp&gt;
 *     &lt;/elementProp&gt;
 *   &lt;/collectionProp&gt;
 * &lt;/elementProp&gt;
 * &lt;stringProp name="HTTPSampler.domain"&gt;api.example.com&lt;/stringProp&gt;
 * &lt;stringProp name="HTTPSampler.port"&gt;&lt;/stringProp&gt;
 * &lt;stringProp name="HTTPSampler.protocol"&gt;https&lt;/stringProp&gt;
 * &lt;stringProp name="HTTPSampler.contentEncoding"&gt;&lt;/stringProp&gt;
 * &lt;stringProp name="HTTPSampler.path"&gt;/ping&lt;/stringProp&gt;
 * </pre>
 */
public abstract class AbstractHttpCodec<T extends AbstractHttpElement> extends AbstractElementCodec<T> {

    public static final String K_HTTP_ARGUMENTS = "HTTPsampler.Arguments";

    protected AbstractHttpCodec(ElementKind kind) {
        super(kind);
    }

    @Override
    protected void readProperties(Element node, T element) {
        Element eltArguments = JmxProperties.findElementProp(node, K_HTTP_ARGUMENTS);
        if (eltArguments == null) {
            eltArguments = JmxProperties.findElementPropByType(node, "Arguments");
        }
        if (eltArguments != null) {
            Element eltCollection = JmxProperties.findCollectionProp(eltArguments, K_ARGUMENTS_COLLECTION);
            if (eltCollection != null) {
                for (Element eltEntry : JmxProperties.childElements(eltCollection, JmxProperties.K_ELEMENT_PROP)) {
                    element.getArguments().add(readHttpArgument(eltEntry));
                }
            }
        }

        element.setDomain(JmxProperties.getString(node, "HTTPSampler.domain").orElse(element.getDomain()));
        element.setPort(JmxProperties.getIntOrExpression(node, "HTTPSampler.port").orElse(null));
        element.setProtocol(JmxProperties.getString(node, "HTTPSampler.protocol").orElse(element.getProtocol()));
        element.setContentEncoding(JmxProperties.getString(node, "HTTPSampler.contentEncoding").orElse(element.getContentEncoding()));
        element.setPath(JmxProperties.getString(node, "HTTPSampler.path").orElse(element.getPath()));
        element.setConnectTimeout(JmxProperties.getString(node, "HTTPSampler.connect_timeout").orElse(element.getConnectTimeout()));
        element.setResponseTimeout(JmxProperties.getString(node, "HTTPSampler.response_timeout").orElse(element.getResponseTimeout()));
    }

    private static HttpArgument readHttpArgument(Element eltEntry) {
        String name = JmxProperties.getString(eltEntry, "Argument.name").orElse(eltEntry.getAttribute(JmxProperties.K_ATTR_NAME));
        String value = JmxProperties.getString(eltEntry, "Argument.value").orElse("");
        String metadata = JmxProperties.getString(eltEntry, "Argument.metadata").orElse(Argument.K_DEFAULT_METADATA);
        boolean alwaysEncode = JmxProperties.getBool(eltEntry, "HTTPArgument.always_encode");
        HttpArgument argument = new HttpArgument(name, value, metadata, alwaysEncode);
        argument.setUseEquals(JmxProperties.getBool(eltEntry, "HTTPArgument.use_equals", argument.isUseEquals()));
        argument.setContentType(JmxProperties.getString(eltEntry, "HTTPArgument.content_type").orElse(null));
        return argument;
    }

    /**
     * Append the arguments structure, always present even without argument as JMeter writes it
     */
    protected void writeHttpArguments(Document document, Element node, T element) {
        Element eltArguments = JmxProperties.createElementProp(document, K_HTTP_ARGUMENTS, "Arguments", "HTTPArgumentsPanel", "Arguments", "User Defined Variables");
        Element eltCollection = JmxProperties.createProperty(document, JmxProperties.K_COLLECTION_PROP, K_ARGUMENTS_COLLECTION, null);
        for (HttpArgument argument : element.getArguments()) {
            String name = StringUtils.defaultString(argument.getName());
            Element eltEntry = JmxProperties.createElementProp(document, name, "HTTPArgument", null, null, null);
            JmxProperties.setBool(document, eltEntry, "HTTPArgument.always_encode", argument.isAlwaysEncode());
            JmxProperties.setString(document, eltEntry, "Argument.value", StringUtils.defaultString(argument.getValue()));
            JmxProperties.setString(document, eltEntry, "Argument.metadata", StringUtils.defaultString(argument.getMetadata(), Argument.K_DEFAULT_METADATA));
            JmxProperties.setBool(document, eltEntry, "HTTPArgument.use_equals", argument.isUseEquals());
            JmxProperties.setString(document, eltEntry, "Argument.name", name);
            JmxProperties.setString(document, eltEntry, "HTTPArgument.content_type", argument.getContentType());
            eltCollection.appendChild(eltEntry);
        }
        eltArguments.appendChild(eltCollection);
        node.appendChild(eltArguments);
    }

    protected void writeTarget(Document document, Element node, T element) {
        JmxProperties.setString(document, node, "HTTPSampler.domain", StringUtils.defaultString(element.getDomain()));
        JmxProperties.setIntOrExpression(document, node, "HTTPSampler.port", element.getPort());
        JmxProperties.setString(document, node, "HTTPSampler.protocol", StringUtils.defaultString(element.getProtocol()));
        JmxProperties.setString(document, node, "HTTPSampler.contentEncoding", StringUtils.defaultString(element.getContentEncoding()));
        JmxProperties.setString(document, node, "HTTPSampler.path", StringUtils.defaultString(element.getPath()));
    }

    protected void writeTimeouts(Document document, Element node, T element) {
        JmxProperties.setString(document, node, "HTTPSampler.connect_timeout", StringUtils.defaultString(element.getConnectTimeout()));
        JmxProperties.setString(document, node, "HTTPSampler.response_timeout", StringUtils.defaultString(element.getResponseTimeout()));
    }
}
