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

package io.github.vdaburon.jmeter.jmx;

import io.github.vdaburon.jmeter.jmx.model.IntOrExpression;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read and write the typed property tags of a jmx element :
 * <pre>
 * &lt;stringProp name="HTTPSampler.domain"&gt;api.example.com&lt;/stringProp&gt;
 * &lt;intProp name="Assertion.test_type"&gt;8&lt;/intProp&gt;
 * &lt;boolProp name="HTTPSampler.follow_redirects"&gt;true&lt;/boolProp&gt;
 * &lt;longProp name="ThreadGroup.start_time"&gt;1700000000000&lt;/longProp&gt;
 * &lt;collectionProp name="Asserion.test_strings"&gt; ... &lt;/collectionProp&gt;
 * &lt;elementProp name="HTTPsampler.Arguments" elementType="Arguments" ...&gt; ... &lt;/elementProp&gt;
 * </pre>
 * Only the direct children of the node are searched.
 * A missing or malformed property never throws, the getters return an empty result and the caller applies its default.
 */
public final class JmxProperties {

    public static final String K_STRING_PROP = "stringProp";
    public static final String K_INT_PROP = "intProp";
    public static final String K_LONG_PROP = "longProp";
    public static final String K_BOOL_PROP = "boolProp";
    public static final String K_COLLECTION_PROP = "collectionProp";
    public static final String K_ELEMENT_PROP = "elementProp";
    public static final String K_OBJ_PROP = "objProp";
    public static final String K_DOUBLE_PROP = "doubleProp";
    public static final String K_HASH_TREE = "hashTree";

    public static final String K_ATTR_NAME = "name";
    public static final String K_ATTR_ELEMENT_TYPE = "elementType";
    public static final String K_ATTR_GUICLASS = "guiclass";
    public static final String K_ATTR_TESTCLASS = "testclass";
    public static final String K_ATTR_TESTNAME = "testname";
    public static final String K_ATTR_ENABLED = "enabled";

    private JmxProperties() {
    }

    /**
     * @param parent the xml element
     * @return the child elements in document order, text and comment nodes are skipped
     */
    public static List<Element> childElements(Element parent) {
        List<Element> listElements = new ArrayList<>();
        NodeList nodeList = parent.getChildNodes();
        for (int i = 0; i < nodeList.getLength(); i++) {
            Node node = nodeList.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                listElements.add((Element) node);
            }
        }
        return listElements;
    }

    /**
     * @param parent the xml element
     * @param tagName the tag of the children to keep
     * @return the child elements with this tag in document order
     */
    public static List<Element> childElements(Element parent, String tagName) {
        List<Element> listElements = new ArrayList<>();
        for (Element child : childElements(parent)) {
            if (tagName.equals(child.getTagName())) {
                listElements.add(child);
            }
        }
        return listElements;
    }

    /**
     * @return the first direct child with this tag and this name attribute, null if none
     */
    public static Element findProperty(Element node, String tagName, String propertyName) {
        for (Element child : childElements(node, tagName)) {
            if (propertyName.equals(child.getAttribute(K_ATTR_NAME))) {
                return child;
            }
        }
        return null;
    }

    public static Optional<String> getString(Element node, String propertyName) {
        Element eltProp = findProperty(node, K_STRING_PROP, propertyName);
        if (eltProp == null) {
            return Optional.empty();
        }
        return Optional.of(eltProp.getTextContent());
    }

    /**
     * Read an intProp, a stringProp with the same name is accepted too (JMeter versions differ)
     * @return the integer, empty if absent or not an integer
     */
    public static Optional<Integer> getInt(Element node, String propertyName) {
        String text = findPropertyText(node, propertyName, K_INT_PROP, K_STRING_PROP);
        if (text == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(text.trim()));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    public static Optional<Long> getLong(Element node, String propertyName) {
        String text = findPropertyText(node, propertyName, K_LONG_PROP, K_STRING_PROP);
        if (text == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(text.trim()));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    /**
     * Read a numeric property that may hold a JMeter expression, e.g. <code>${__P(threads,10)}</code>.
     * The intProp, stringProp or longProp tagged with the name is read, an empty text is absent.
     * @see IntOrExpression#parse(String)
     */
    public static Optional<IntOrExpression> getIntOrExpression(Element node, String propertyName) {
        String text = findPropertyText(node, propertyName, K_INT_PROP, K_STRING_PROP, K_LONG_PROP);
        if (StringUtils.isEmpty(text)) {
            return Optional.empty();
        }
        return Optional.of(IntOrExpression.parse(text));
    }

    /**
     * @return the boolean, false if absent or not "true"/"false"
     */
    public static boolean getBool(Element node, String propertyName) {
        return getBool(node, propertyName, false);
    }

    /**
     * Read a boolProp, a stringProp holding "true" or "false" is accepted too
     * @param defaultValue returned when the property is absent or the text is neither "true" nor "false"
     */
    public static boolean getBool(Element node, String propertyName, boolean defaultValue) {
        String text = findPropertyText(node, propertyName, K_BOOL_PROP, K_STRING_PROP);
        if (text == null) {
            return defaultValue;
        }
        String trimmed = text.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return true;
        }
        if ("false".equalsIgnoreCase(trimmed)) {
            return false;
        }
        return defaultValue;
    }

    /**
     * <pre>
     * &lt;collectionProp name="Asserion.test_strings"&gt;
     *   &lt;stringProp name="49586"&gt;200&lt;/stringProp&gt;
     * &lt;/collectionProp&gt;
     * </pre>
     * @return the values of the stringProp entries in order, an empty list if the collection is absent
     */
    public static List<String> getStringCollection(Element node, String propertyName) {
        List<String> listValues = new ArrayList<>();
        Element eltCollection = findCollectionProp(node, propertyName);
        if (eltCollection == null) {
            return listValues;
        }
        for (Element eltEntry : childElements(eltCollection, K_STRING_PROP)) {
            listValues.add(eltEntry.getTextContent());
        }
        return listValues;
    }

    public static Element findCollectionProp(Element node, String propertyName) {
        return findProperty(node, K_COLLECTION_PROP, propertyName);
    }

    /**
     * Find a nested structure by its property name, e.g. <code>HTTPsampler.Arguments</code>
     */
    public static Element findElementProp(Element node, String propertyName) {
        return findProperty(node, K_ELEMENT_PROP, propertyName);
    }

    /**
     * Find a nested structure by its elementType attribute, e.g. <code>LoopController</code> in a thread group
     */
    public static Element findElementPropByType(Element node, String elementType) {
        for (Element child : childElements(node, K_ELEMENT_PROP)) {
            if (elementType.equals(child.getAttribute(K_ATTR_ELEMENT_TYPE))) {
                return child;
            }
        }
        return null;
    }

    /**
     * <pre>
     * &lt;objProp&gt;
     *   &lt;name&gt;saveConfig&lt;/name&gt;
     *   &lt;value class="SampleSaveConfiguration"&gt; ... &lt;/value&gt;
     * &lt;/objProp&gt;
     * </pre>
     * @return the value element of the objProp with this name, null if none
     */
    public static Element findObjPropValue(Element node, String propertyName) {
        return findNamedValue(node, K_OBJ_PROP, propertyName);
    }

    /**
     * Read a number JMeter writes as a doubleProp, a stringProp with the same name is accepted too
     * <pre>
     * &lt;doubleProp&gt;
     *   &lt;name&gt;throughput&lt;/name&gt;
     *   &lt;value&gt;60.0&lt;/value&gt;
     *   &lt;savedValue&gt;0.0&lt;/savedValue&gt;
     * &lt;/doubleProp&gt;
     * </pre>
     * @return the text of the value, kept as written, empty if absent
     */
    public static Optional<String> getDoubleText(Element node, String propertyName) {
        Element eltValue = findNamedValue(node, K_DOUBLE_PROP, propertyName);
        if (eltValue != null) {
            return Optional.of(eltValue.getTextContent().trim());
        }
        return getString(node, propertyName);
    }

    /**
     * Append a doubleProp when the value is a number, a stringProp otherwise (an expression)
     * @return the property appended or null for a null value
     */
    public static Element setDoubleText(Document document, Element node, String propertyName, String value) {
        if (value == null) {
            return null;
        }
        if (!NumberUtils.isCreatable(value.trim())) {
            return setString(document, node, propertyName, value);
        }
        Element eltProp = document.createElement(K_DOUBLE_PROP);
        eltProp.appendChild(createProperty(document, "name", null, propertyName));
        eltProp.appendChild(createProperty(document, "value", null, value.trim()));
        eltProp.appendChild(createProperty(document, "savedValue", null, "0.0"));
        node.appendChild(eltProp);
        return eltProp;
    }

    /**
     * The objProp and doubleProp tags carry their name in a &lt;name&gt; child instead of an attribute
     * @return the &lt;value&gt; child of the first tag with this name, null if none
     */
    private static Element findNamedValue(Element node, String tagName, String propertyName) {
        for (Element eltProp : childElements(node, tagName)) {
            List<Element> listNames = childElements(eltProp, "name");
            if (!listNames.isEmpty() && propertyName.equals(listNames.get(0).getTextContent().trim())) {
                List<Element> listValues = childElements(eltProp, "value");
                return listValues.isEmpty() ? null : listValues.get(0);
            }
        }
        return null;
    }

    private static String findPropertyText(Element node, String propertyName, String... tagNames) {
        for (String tagName : tagNames) {
            Element eltProp = findProperty(node, tagName, propertyName);
            if (eltProp != null) {
                return eltProp.getTextContent();
            }
        }
        return null;
    }

    /**
     * Create a property tag
     * @param document the document
     * @param propertyTag boolProp, stringProp, intProp, collectionProp ...
     * @param propertyName the name attribute, not set if null
     * @param value the text content, not set if null
     * @return the property element, not appended
     */
    public static Element createProperty(Document document, String propertyTag, String propertyName, String value) {
        Element eltProperty = document.createElement(propertyTag);
        if (propertyName != null) {
            Attr attrName = document.createAttribute(K_ATTR_NAME);
            attrName.setValue(propertyName);
            eltProperty.setAttributeNode(attrName);
        }

        if (value != null) {
            eltProperty.setTextContent(value);
        }
        return eltProperty;
    }

    /**
     * Create a nested structure
     * <pre>
     * &lt;elementProp name="ThreadGroup.main_controller" elementType="LoopController" guiclass="LoopControlPanel" testclass="LoopController" testname="Loop Controller"&gt;
     * </pre>
     * The guiclass, testclass and testname attributes are set only when not null.
     */
    public static Element createElementProp(Document document, String propertyName, String elementType, String guiClass, String testClass, String testName) {
        Element eltElementProp = createProperty(document, K_ELEMENT_PROP, propertyName, null);
        eltElementProp.setAttribute(K_ATTR_ELEMENT_TYPE, elementType);
        if (guiClass != null) {
            eltElementProp.setAttribute(K_ATTR_GUICLASS, guiClass);
        }
        if (testClass != null) {
            eltElementProp.setAttribute(K_ATTR_TESTCLASS, testClass);
        }
        if (testName != null) {
            eltElementProp.setAttribute(K_ATTR_TESTNAME, testName);
        }
        return eltElementProp;
    }

    public static Element createHashTree(Document document) {
        return document.createElement(K_HASH_TREE);
    }

    /**
     * Append a stringProp, nothing is appended for a null value
     * @return the property appended or null
     */
    public static Element setString(Document document, Element node, String propertyName, String value) {
        if (value == null) {
            return null;
        }
        Element eltProp = createProperty(document, K_STRING_PROP, propertyName, value);
        node.appendChild(eltProp);
        return eltProp;
    }

    public static Element setInt(Document document, Element node, String propertyName, Integer value) {
        if (value == null) {
            return null;
        }
        Element eltProp = createProperty(document, K_INT_PROP, propertyName, String.valueOf(value));
        node.appendChild(eltProp);
        return eltProp;
    }

    public static Element setLong(Document document, Element node, String propertyName, Long value) {
        if (value == null) {
            return null;
        }
        Element eltProp = createProperty(document, K_LONG_PROP, propertyName, String.valueOf(value));
        node.appendChild(eltProp);
        return eltProp;
    }

    public static Element setBool(Document document, Element node, String propertyName, boolean value) {
        Element eltProp = createProperty(document, K_BOOL_PROP, propertyName, String.valueOf(value));
        node.appendChild(eltProp);
        return eltProp;
    }

    /**
     * Append the value as a stringProp, JMeter writes the thread group counters this way so an expression fits
     */
    public static Element setIntOrExpression(Document document, Element node, String propertyName, IntOrExpression value) {
        if (value == null) {
            return null;
        }
        return setString(document, node, propertyName, value.toPropertyText());
    }

    /**
     * Append a collectionProp of stringProp, each entry is named with the hashCode of its value as JMeter does.
     * The collection is appended even when empty.
     */
    public static Element setStringCollection(Document document, Element node, String propertyName, List<String> values) {
        Element eltCollection = createProperty(document, K_COLLECTION_PROP, propertyName, null);
        for (String value : values) {
            String entryValue = value != null ? value : "";
            eltCollection.appendChild(createProperty(document, K_STRING_PROP, String.valueOf(entryValue.hashCode()), entryValue));
        }
        node.appendChild(eltCollection);
        return eltCollection;
    }
}
