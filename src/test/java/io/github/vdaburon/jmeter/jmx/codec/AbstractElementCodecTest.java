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
import io.github.vdaburon.jmeter.jmx.model.HeaderManager;
import io.github.vdaburon.jmeter.jmx.model.IntOrExpression;
import io.github.vdaburon.jmeter.jmx.model.RegexExtractor;
import io.github.vdaburon.jmeter.jmx.model.ResultCollector;
import io.github.vdaburon.jmeter.jmx.model.TestAction;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.StringReader;
import java.util.Optional;

public class AbstractElementCodecTest {

    private Document document;

    @Before
    public void setUp() throws Exception {
        document = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
    }

    private static Element toElement(String xml) throws Exception {
        return DocumentBuilderFactory.newInstance().newDocumentBuilder().parse(new InputSource(new StringReader(xml))).getDocumentElement();
    }

    @Test
    public void testCommonAttributes() throws Exception {
        ResultCollector collector = new ResultCollectorCodec().decode(toElement(
                "<ResultCollector guiclass=\"SummaryReport\" testclass=\"ResultCollector\" testname=\"Summary\" enabled=\"false\">"
                        + "<stringProp name=\"TestPlan.comments\">keep it</stringProp></ResultCollector>"));

        Assert.assertEquals(ResultCollector.K_GUI_SUMMARY_REPORT, collector.getGuiClass());
        Assert.assertEquals("Summary", collector.getName());
        Assert.assertFalse(collector.isEnabled());
        Assert.assertEquals("keep it", collector.getComment());

        Element node = new ResultCollectorCodec().encode(document, collector);
        Assert.assertEquals("ResultCollector", node.getTagName());
        Assert.assertEquals("ResultCollector", node.getAttribute(JmxProperties.K_ATTR_TESTCLASS));
        Assert.assertEquals("SummaryReport", node.getAttribute(JmxProperties.K_ATTR_GUICLASS));
        Assert.assertEquals("false", node.getAttribute(JmxProperties.K_ATTR_ENABLED));
        Assert.assertEquals(Optional.of("keep it"), JmxProperties.getString(node, AbstractElementCodec.K_COMMENTS));
    }

    @Test
    public void testEnabledByDefault() throws Exception {
        TestAction action = new TestActionCodec().decode(toElement("<TestAction testclass=\"TestAction\"/>"));
        Assert.assertTrue(action.isEnabled());
        Assert.assertNull(action.getComment());
        Assert.assertEquals(TestAction.K_ACTION_PAUSE, action.getAction());
        Assert.assertEquals(IntOrExpression.of(0), action.getDuration());
    }

    @Test
    public void testSaveConfigDefaults() throws Exception {
        ResultCollector collector = new ResultCollectorCodec().decode(toElement("<ResultCollector testclass=\"ResultCollector\"/>"));
        Assert.assertEquals(ResultCollector.defaultSaveConfig(), collector.getSaveConfig());
        Assert.assertEquals("false", collector.getSaveConfig().get("responseData"));

        Element node = new ResultCollectorCodec().encode(document, collector);
        Element eltValue = JmxProperties.findObjPropValue(node, ResultCollectorCodec.K_SAVE_CONFIG);
        Assert.assertNotNull(eltValue);
        Assert.assertEquals(collector.getSaveConfig().size(), JmxProperties.childElements(eltValue).size());
        Assert.assertEquals("time", JmxProperties.childElements(eltValue).get(0).getTagName());
    }

    @Test
    public void testEmptyCollectionsWritten() {
        Element eltHeaders = new HeaderManagerCodec().encode(document, new HeaderManager());
        Assert.assertNotNull(JmxProperties.findCollectionProp(eltHeaders, HeaderManagerCodec.K_HEADERS));

        Element eltCookies = new CookieManagerCodec().encode(document, new CookieManager());
        Assert.assertNotNull(JmxProperties.findCollectionProp(eltCookies, "CookieManager.cookies"));
        Assert.assertFalse(JmxProperties.getString(eltCookies, "CookieManager.policy").isPresent());
    }

    @Test
    public void testMatchNumberExpression() throws Exception {
        RegexExtractor extractor = new RegexExtractorCodec().decode(toElement(
                "<RegexExtractor testclass=\"RegexExtractor\">"
                        + "<stringProp name=\"RegexExtractor.match_number\">${INDEX}</stringProp>"
                        + "<stringProp name=\"Sample.scope\">variable</stringProp>"
                        + "<stringProp name=\"Scope.variable\">BODY</stringProp>"
                        + "</RegexExtractor>"));
        Assert.assertEquals(IntOrExpression.ofExpression("${INDEX}"), extractor.getMatchNumber());
        Assert.assertEquals("$1$", extractor.getTemplate());
        Assert.assertEquals("variable", extractor.getScope());
        Assert.assertEquals("BODY", extractor.getScopeVariable());

        Element node = new RegexExtractorCodec().encode(document, extractor);
        Assert.assertEquals(Optional.of("${INDEX}"), JmxProperties.getString(node, "RegexExtractor.match_number"));
    }
}
