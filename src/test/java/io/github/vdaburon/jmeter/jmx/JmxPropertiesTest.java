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
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.StringReader;
import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;

public class JmxPropertiesTest {

    private static final String K_NODE = "<Node>"
            + "<stringProp name=\"s\">text</stringProp>"
            + "<stringProp name=\"empty\"></stringProp>"
            + "<intProp name=\"i\">12</intProp>"
            + "<stringProp name=\"iAsString\"> 34 </stringProp>"
            + "<stringProp name=\"notInt\">abc</stringProp>"
            + "<longProp name=\"l\">1234567890123</longProp>"
            + "<boolProp name=\"b\">true</boolProp>"
            + "<stringProp name=\"bAsString\">FALSE</stringProp>"
            + "<boolProp name=\"bBad\">yes</boolProp>"
            + "<stringProp name=\"expr\">${__P(n,1)}</stringProp>"
            + "<collectionProp name=\"c\"><stringProp name=\"1\">a</stringProp><stringProp name=\"2\">b</stringProp></collectionProp>"
            + "<elementProp name=\"ep\" elementType=\"LoopController\"><stringProp name=\"LoopController.loops\">3</stringProp></elementProp>"
            + "<objProp><name>saveConfig</name><value class=\"SampleSaveConfiguration\"><time>true</time></value></objProp>"
            + "</Node>";

    private Element node;

    @Before
    public void setUp() throws Exception {
        Document document = DocumentBuilderFactory.newInstance().newDocumentBuilder().parse(new InputSource(new StringReader(K_NODE)));
        node = document.getDocumentElement();
    }

    @Test
    public void testGetString() {
        Assert.assertEquals(Optional.of("text"), JmxProperties.getString(node, "s"));
        Assert.assertEquals(Optional.of(""), JmxProperties.getString(node, "empty"));
        Assert.assertFalse(JmxProperties.getString(node, "missing").isPresent());
        // the tag must match
        Assert.assertFalse(JmxProperties.getString(node, "i").isPresent());
    }

    @Test
    public void testGetInt() {
        Assert.assertEquals(Optional.of(12), JmxProperties.getInt(node, "i"));
        Assert.assertEquals(Optional.of(34), JmxProperties.getInt(node, "iAsString"));
        Assert.assertFalse(JmxProperties.getInt(node, "notInt").isPresent());
        Assert.assertFalse(JmxProperties.getInt(node, "missing").isPresent());
        Assert.assertEquals(Optional.of(1234567890123L), JmxProperties.getLong(node, "l"));
    }

    @Test
    public void testGetBool() {
        Assert.assertTrue(JmxProperties.getBool(node, "b"));
        Assert.assertFalse(JmxProperties.getBool(node, "bAsString", true));
        Assert.assertTrue(JmxProperties.getBool(node, "bBad", true));
        Assert.assertFalse(JmxProperties.getBool(node, "bBad"));
        Assert.assertTrue(JmxProperties.getBool(node, "missing", true));
    }

    @Test
    public void testGetIntOrExpression() {
        Assert.assertEquals(Optional.of(IntOrExpression.of(12)), JmxProperties.getIntOrExpression(node, "i"));
        Assert.assertEquals(Optional.of(IntOrExpression.ofExpression("${__P(n,1)}")), JmxProperties.getIntOrExpression(node, "expr"));
        Assert.assertFalse(JmxProperties.getIntOrExpression(node, "empty").isPresent());
    }

    @Test
    public void testNestedStructures() {
        Assert.assertEquals(Arrays.asList("a", "b"), JmxProperties.getStringCollection(node, "c"));
        Assert.assertEquals(Collections.emptyList(), JmxProperties.getStringCollection(node, "missing"));

        Element eltLoop = JmxProperties.findElementPropByType(node, "LoopController");
        Assert.assertNotNull(eltLoop);
        Assert.assertSame(eltLoop, JmxProperties.findElementProp(node, "ep"));
        Assert.assertEquals(Optional.of(IntOrExpression.of(3)), JmxProperties.getIntOrExpression(eltLoop, "LoopController.loops"));

        Element eltValue = JmxProperties.findObjPropValue(node, "saveConfig");
        Assert.assertNotNull(eltValue);
        Assert.assertEquals("SampleSaveConfiguration", eltValue.getAttribute("class"));
        Assert.assertNull(JmxProperties.findObjPropValue(node, "other"));
    }

    @Test
    public void testWriters() throws Exception {
        Document document = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
        Element eltNode = document.createElement("Node");

        Assert.assertNull(JmxProperties.setString(document, eltNode, "nothing", null));
        Assert.assertNull(JmxProperties.setIntOrExpression(document, eltNode, "nothing", null));
        JmxProperties.setIntOrExpression(document, eltNode, "loops", IntOrExpression.ofExpression("${LOOP_COUNT}"));
        JmxProperties.setInt(document, eltNode, "type", 8);
        JmxProperties.setBool(document, eltNode, "flag", false);
        Element eltCollection = JmxProperties.setStringCollection(document, eltNode, "strings", Collections.singletonList("200"));

        Assert.assertEquals(4, JmxProperties.childElements(eltNode).size());
        Assert.assertEquals(JmxProperties.K_STRING_PROP, JmxProperties.childElements(eltNode).get(0).getTagName());
        Assert.assertEquals(Optional.of("${LOOP_COUNT}"), JmxProperties.getString(eltNode, "loops"));
        Assert.assertEquals(Optional.of(8), JmxProperties.getInt(eltNode, "type"));
        Assert.assertFalse(JmxProperties.getBool(eltNode, "flag", true));
        Element eltEntry = JmxProperties.childElements(eltCollection).get(0);
        Assert.assertEquals(String.valueOf("200".hashCode()), eltEntry.getAttribute(JmxProperties.K_ATTR_NAME));
    }
}
