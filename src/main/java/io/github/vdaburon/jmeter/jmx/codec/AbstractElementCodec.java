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
import io.github.vdaburon.jmeter.jmx.model.Argument;
import io.github.vdaburon.jmeter.jmx.model.ElementKind;
import io.github.vdaburon.jmeter.jmx.model.PlanElement;
import org.apache.commons.lang3.StringUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared part of the codecs : the attributes common to all the elements and the comment.
 * <pre>
 * &lt;HTTPSamplerProxy guiclass="HttpTestSampleGui" testclass="HTTPSamplerProxy" testname="GET /ping" enabled="true"&gt;
 *   &lt;stringProp name="TestPlan.comments"&gt;the comment&lt;/stringProp&gt;
 *   ... properties of the kind ...
 * &lt;/HTTPSamplerProxy&gt;
 * </pre>
 * A subclass creates the element with its defaults then reads and writes the properties of the kind.
 * @param <T> the model class
 */
public abstract class AbstractElementCodec<T extends PlanElement> implements ElementCodec<T> {

    public static final String K_COMMENTS = "TestPlan.comments";
    protected static final String K_ARGUMENTS_COLLECTION = "Arguments.arguments";

    private final ElementKind kind;

    protected AbstractElementCodec(ElementKind kind) {
        this.kind = kind;
    }

    @Override
    public ElementKind kind() {
        return kind;
    }

    @Override
    public String discriminator() {
        return kind.getTestClass();
    }

    /**
     * @return a new element holding the default values of the kind
     */
    protected abstract T newElement();

    protected abstract void readProperties(Element node, T element);

    protected abstract void writeProperties(Document document, Element node, T element);

    @Override
    public T decode(Element node) {
        T element = newElement();
        String guiClass = node.getAttribute(JmxProperties.K_ATTR_GUICLASS);
        if (StringUtils.isNotEmpty(guiClass)) {
            element.setGuiClass(guiClass);
        }
        if (node.hasAttribute(JmxProperties.K_ATTR_TESTNAME)) {
            element.setName(node.getAttribute(JmxProperties.K_ATTR_TESTNAME));
        }
        element.setEnabled(!"false".equals(node.getAttribute(JmxProperties.K_ATTR_ENABLED)));
        element.setComment(JmxProperties.getString(node, K_COMMENTS).orElse(null));
        readProperties(node, element);
        return element;
    }

    @Override
    public Element encode(Document document, T element) {
        Element node = document.createElement(kind.getTagName());
        node.setAttribute(JmxProperties.K_ATTR_GUICLASS, StringUtils.defaultIfEmpty(element.getGuiClass(), kind.getGuiClass()));
        node.setAttribute(JmxProperties.K_ATTR_TESTCLASS, kind.getTestClass());
        node.setAttribute(JmxProperties.K_ATTR_TESTNAME, StringUtils.defaultString(element.getName()));
        node.setAttribute(JmxProperties.K_ATTR_ENABLED, String.valueOf(element.isEnabled()));
        JmxProperties.setString(document, node, K_COMMENTS, element.getComment());
        writeProperties(document, node, element);
        return node;
    }

    /**
     * Read the arguments of a User Defined Variables structure
     * <pre>
     * &lt;collectionProp name="Arguments.arguments"&gt;
     *   &lt;elementProp name="BASE_URL" elementType="Argument"&gt;
     *     &lt;stringProp name="Argument.name"&gt;BASE_URL&lt;/stringProp&gt;
     *     &lt;stringProp name="Argument.value"&gt;https://api.example.com&lt;/stringProp&gt;
     *     &lt;stringProp name="Argument.metadata"&gt;=&lt;/stringProp&gt;
     *   &lt;/elementProp&gt;
     * &lt;/collectionProp&gt;
     * </pre>
     * @param container the node holding the collectionProp, null gives an empty list
     */
    protected static List<Argument> readArguments(Element container) {
        List<Argument> listArguments = new ArrayList<>();
        if (container == null) {
            return listArguments;
        }
        Element eltCollection = JmxProperties.findCollectionProp(container, K_ARGUMENTS_COLLECTION);
        if (eltCollection == null) {
            return listArguments;
        }
        for (Element eltEntry : JmxProperties.childElements(eltCollection, JmxProperties.K_ELEMENT_PROP)) {
            String name = JmxProperties.getString(eltEntry, "Argument.name").orElse(eltEntry.getAttribute(JmxProperties.K_ATTR_NAME));
            String value = JmxProperties.getString(eltEntry, "Argument.value").orElse("");
            String metadata = JmxProperties.getString(eltEntry, "Argument.metadata").orElse(Argument.K_DEFAULT_METADATA);
            listArguments.add(new Argument(name, value, metadata));
        }
        return listArguments;
    }

    /**
     * Append the collectionProp <code>Arguments.arguments</code>, empty when there is no argument
     */
    protected static void writeArguments(Document document, Element container, List<Argument> listArguments) {
        Element eltCollection = JmxProperties.createProperty(document, JmxProperties.K_COLLECTION_PROP, K_ARGUMENTS_COLLECTION, null);
        for (Argument argument : listArguments) {
            String name = StringUtils.defaultString(argument.getName());
            Element eltEntry = JmxProperties.createElementProp(document, name, "Argument", null, null, null);
            JmxProperties.setString(document, eltEntry, "Argument.name", name);
            JmxProperties.setString(document, eltEntry, "Argument.value", StringUtils.defaultString(argument.getValue()));
            JmxProperties.setString(document, eltEntry, "Argument.metadata", StringUtils.defaultString(argument.getMetadata(), Argument.K_DEFAULT_METADATA));
            eltCollection.appendChild(eltEntry);
        }
        container.appendChild(eltCollection);
    }
}
