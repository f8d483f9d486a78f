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

import io.github.vdaburon.jmeter.jmx.JmxParser;
import io.github.vdaburon.jmeter.jmx.JmxProperties;
import io.github.vdaburon.jmeter.jmx.ParseResult;
import io.github.vdaburon.jmeter.jmx.model.ConstantTimer;
import io.github.vdaburon.jmeter.jmx.model.ElementKind;
import io.github.vdaburon.jmeter.jmx.model.PlanElement;
import org.junit.Assert;
import org.junit.Test;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.StringReader;
import java.util.HashSet;
import java.util.Set;

public class ElementCodecsTest {

    /**
     * A plugin timer read as a Constant Timer, its delay is in another property
     */
    private static class FixedPauseTimerCodec extends ConstantTimerCodec {

        static final String K_TEST_CLASS = "com.example.FixedPauseTimer";

        @Override
        public String discriminator() {
            return K_TEST_CLASS;
        }

        @Override
        protected void readProperties(Element node, ConstantTimer element) {
            element.setDelay(JmxProperties.getString(node, "FixedPause.ms").orElse(element.getDelay()));
        }
    }

    private static final String K_PLUGIN_PLAN = "<jmeterTestPlan><hashTree>"
            + "<TestPlan testclass=\"TestPlan\" testname=\"plugins\"/><hashTree>"
            + "<com.example.FixedPauseTimer testclass=\"com.example.FixedPauseTimer\" testname=\"pause\">"
            + "<stringProp name=\"FixedPause.ms\">1500</stringProp>"
            + "</com.example.FixedPauseTimer><hashTree/>"
            + "</hashTree></hashTree></jmeterTestPlan>";

    @Test
    public void testDefaultsCoverEveryKind() {
        ElementCodecs codecs = ElementCodecs.defaults();
        Set<ElementKind> setKinds = new HashSet<>();
        for (ElementCodec<? extends PlanElement> codec : codecs.getCodecs()) {
            setKinds.add(codec.kind());
            Assert.assertSame(codec, codecs.forDiscriminator(codec.discriminator()));
        }
        Assert.assertEquals(ElementKind.values().length, setKinds.size());
        for (ElementKind kind : ElementKind.values()) {
            Assert.assertEquals(kind, codecs.forKind(kind).kind());
            Assert.assertTrue(codecs.isKnown(kind.getTestClass()));
        }
    }

    @Test
    public void testUnknownDiscriminator() {
        ElementCodecs codecs = ElementCodecs.defaults();
        Assert.assertNull(codecs.forDiscriminator("kg.apc.jmeter.threads.UltimateThreadGroup"));
        Assert.assertFalse(codecs.isKnown("kg.apc.jmeter.threads.UltimateThreadGroup"));
    }

    @Test(expected = IllegalStateException.class)
    public void testMissingKind() {
        new ElementCodecs().forKind(ElementKind.IF_CONTROLLER);
    }

    @Test
    public void testRegisterPluginCodec() throws Exception {
        ParseResult withoutPlugin = new JmxParser().parse(K_PLUGIN_PLAN);
        Assert.assertTrue(withoutPlugin.hasDroppedElements());
        Assert.assertTrue(withoutPlugin.getTestPlan().getTestPlan().getChildren().isEmpty());

        FixedPauseTimerCodec pluginCodec = new FixedPauseTimerCodec();
        ElementCodecs codecs = ElementCodecs.defaults().register(pluginCodec);
        ParseResult withPlugin = new JmxParser(codecs).parse(K_PLUGIN_PLAN);
        Assert.assertTrue(withPlugin.getDiagnostics().isEmpty());
        ConstantTimer timer = (ConstantTimer) withPlugin.getTestPlan().getTestPlan().getChildren().get(0);
        Assert.assertEquals("pause", timer.getName());
        Assert.assertEquals("1500", timer.getDelay());
        // the new codec replaces the writer of the kind
        Assert.assertSame(pluginCodec, codecs.forKind(ElementKind.CONSTANT_TIMER));
    }

    @Test
    public void testHttpDefaultsAcceptsItsGuiClassOnly() throws Exception {
        ElementCodec<? extends PlanElement> codec = ElementCodecs.defaults().forDiscriminator("ConfigTestElement");
        Assert.assertTrue(codec.accepts(tag("<ConfigTestElement guiclass=\"HttpDefaultsGui\" testclass=\"ConfigTestElement\"/>")));
        Assert.assertTrue(codec.accepts(tag("<ConfigTestElement guiclass=\"org.apache.jmeter.protocol.http.config.gui.HttpDefaultsGui\" testclass=\"ConfigTestElement\"/>")));
        Assert.assertTrue(codec.accepts(tag("<ConfigTestElement testclass=\"ConfigTestElement\"/>")));
        Assert.assertFalse(codec.accepts(tag("<ConfigTestElement guiclass=\"JavaConfigGui\" testclass=\"ConfigTestElement\"/>")));
        Assert.assertFalse(codec.accepts(tag("<ConfigTestElement guiclass=\"TCPConfigGui\" testclass=\"ConfigTestElement\"/>")));
        Assert.assertFalse(codec.accepts(tag("<ConfigTestElement guiclass=\"ObsoleteGui\" testclass=\"ConfigTestElement\"/>")));
        // the other codecs take every tag of their testclass
        Assert.assertTrue(ElementCodecs.defaults().forDiscriminator("ConstantTimer").accepts(tag("<ConstantTimer guiclass=\"AnyGui\"/>")));
    }

    private static Element tag(String xml) throws Exception {
        return DocumentBuilderFactory.newInstance().newDocumentBuilder()
                .parse(new InputSource(new StringReader(xml))).getDocumentElement();
    }
}
