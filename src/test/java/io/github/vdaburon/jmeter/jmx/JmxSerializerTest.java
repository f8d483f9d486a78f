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

import io.github.vdaburon.jmeter.jmx.codec.ElementCodecs;
import io.github.vdaburon.jmeter.jmx.codec.TestPlanCodec;
import io.github.vdaburon.jmeter.jmx.model.ElementKind;
import io.github.vdaburon.jmeter.jmx.model.HttpSamplerProxy;
import io.github.vdaburon.jmeter.jmx.model.IntOrExpression;
import io.github.vdaburon.jmeter.jmx.model.JmxTestPlan;
import io.github.vdaburon.jmeter.jmx.model.PlanElement;
import io.github.vdaburon.jmeter.jmx.model.ResponseAssertion;
import io.github.vdaburon.jmeter.jmx.model.ThreadGroup;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.util.Collections;

public class JmxSerializerTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    private final JmxParser parser = new JmxParser();
    private final JmxSerializer serializer = new JmxSerializer();

    @Test
    public void testRoundTripAllKinds() throws Exception {
        JmxTestPlan original = JmxTestFiles.parse("full_plan.jmx").getTestPlan();
        // every kind of the library is in the file
        for (ElementKind kind : ElementKind.values()) {
            boolean found = false;
            for (PlanElement element : original.getAllElements()) {
                found = found || element.getKind() == kind;
            }
            Assert.assertTrue("no " + kind + " in full_plan.jmx", found);
        }

        ParseResult reparsed = parser.parse(serializer.serialize(original));
        Assert.assertTrue(reparsed.getDiagnostics().isEmpty());
        Assert.assertEquals(original, reparsed.getTestPlan());
    }

    @Test
    public void testReserializeIsIdempotent() throws Exception {
        String first = serializer.serialize(JmxTestFiles.parse("full_plan.jmx").getTestPlan());
        String second = serializer.serialize(parser.parse(first).getTestPlan());
        Assert.assertEquals(first, second);
    }

    @Test
    public void testOutputFormat() throws Exception {
        String jmx = serializer.serialize(JmxTestFiles.parse("simple_plan.jmx").getTestPlan());

        Assert.assertTrue(jmx.startsWith(JmxSerializer.K_XML_DECLARATION + "\n<jmeterTestPlan"));
        Assert.assertTrue(jmx.contains("<jmeterTestPlan jmeter=\"5.6.3\" properties=\"5.0\" version=\"1.2\">")
                || jmx.contains("<jmeterTestPlan version=\"1.2\" properties=\"5.0\" jmeter=\"5.6.3\">"));
        Assert.assertTrue(jmx.contains("\n  <hashTree>"));
        Assert.assertTrue(jmx.contains("<stringProp name=\"LoopController.loops\">2</stringProp>"));
        Assert.assertTrue(jmx.contains("<collectionProp name=\"Asserion.test_strings\">"));
        Assert.assertTrue(jmx.contains("<intProp name=\"Assertion.test_type\">8</intProp>"));
    }

    @Test
    public void testThreadGroupSamplerAssertion() throws Exception {
        JmxTestPlan jmxTestPlan = new JmxTestPlan();
        ThreadGroup threadGroup = jmxTestPlan.getTestPlan().addChild(new ThreadGroup());
        threadGroup.setNumThreads(IntOrExpression.of(3));
        threadGroup.setRampTime(IntOrExpression.of(5));
        threadGroup.setLoops(IntOrExpression.of(2));
        HttpSamplerProxy sampler = threadGroup.addChild(new HttpSamplerProxy());
        sampler.setMethod("GET");
        sampler.setDomain("api.example.com");
        sampler.setPath("/ping");
        ResponseAssertion assertion = sampler.addChild(new ResponseAssertion());
        assertion.getTestStrings().add("200");

        JmxTestPlan reparsed = parser.parse(serializer.serialize(jmxTestPlan)).getTestPlan();
        Assert.assertEquals(jmxTestPlan, reparsed);

        ThreadGroup threadGroupRead = (ThreadGroup) reparsed.getTestPlan().getChildren().get(0);
        Assert.assertEquals(3, threadGroupRead.getNumThreads().getInt());
        Assert.assertEquals(5, threadGroupRead.getRampTime().getInt());
        Assert.assertEquals(2, threadGroupRead.getLoops().getInt());
        HttpSamplerProxy samplerRead = (HttpSamplerProxy) threadGroupRead.getChildren().get(0);
        Assert.assertEquals("GET", samplerRead.getMethod());
        Assert.assertEquals("api.example.com", samplerRead.getDomain());
        Assert.assertEquals("/ping", samplerRead.getPath());
        ResponseAssertion assertionRead = (ResponseAssertion) samplerRead.getChildren().get(0);
        Assert.assertEquals(Collections.singletonList("200"), assertionRead.getTestStrings());
    }

    @Test
    public void testExpressionWrittenVerbatim() throws Exception {
        String jmx = serializer.serialize(JmxTestFiles.parse("expressions.jmx").getTestPlan());
        Assert.assertTrue(jmx.contains("<stringProp name=\"LoopController.loops\">${LOOP_COUNT}</stringProp>"));
        Assert.assertTrue(jmx.contains("<stringProp name=\"ThreadGroup.num_threads\">${__P(threads,10)}</stringProp>"));
    }

    @Test
    public void testDefaultStructuresWritten() throws Exception {
        JmxTestPlan jmxTestPlan = new JmxTestPlan();
        ThreadGroup threadGroup = jmxTestPlan.getTestPlan().addChild(new ThreadGroup());
        threadGroup.addChild(new HttpSamplerProxy());

        String jmx = serializer.serialize(jmxTestPlan);
        Assert.assertTrue(jmx.contains("<elementProp elementType=\"Arguments\"")
                || jmx.contains("name=\"HTTPsampler.Arguments\""));
        Assert.assertTrue(jmx.contains("name=\"ThreadGroup.main_controller\""));
        Assert.assertTrue(jmx.contains("<stringProp name=\"LoopController.loops\">1</stringProp>"));
        Assert.assertTrue(jmx.contains("name=\"TestPlan.user_defined_variables\""));
    }

    @Test
    public void testEmptyPlanRoundTrip() throws Exception {
        JmxTestPlan empty = new JmxTestPlan();
        Assert.assertEquals(empty, parser.parse(serializer.serialize(empty)).getTestPlan());
    }

    @Test
    public void testWriteToFile() throws Exception {
        JmxTestPlan jmxTestPlan = JmxTestFiles.parse("simple_plan.jmx").getTestPlan();
        jmxTestPlan.getTestPlan().setComment("écrit en UTF-8");
        File fileOut = new File(temporaryFolder.getRoot(), "out.jmx");

        serializer.writeToFile(jmxTestPlan, fileOut.getAbsolutePath());

        Assert.assertTrue(fileOut.exists());
        Assert.assertEquals(jmxTestPlan, parser.parseFile(fileOut.getAbsolutePath()).getTestPlan());
    }

    @Test(expected = JmxWriteException.class)
    public void testWriteToMissingFolder() throws Exception {
        File fileOut = new File(temporaryFolder.getRoot(), "missing/out.jmx");
        serializer.writeToFile(new JmxTestPlan(), fileOut.getAbsolutePath());
    }

    @Test(expected = IllegalStateException.class)
    public void testKindWithoutCodec() throws Exception {
        ElementCodecs codecs = new ElementCodecs().register(new TestPlanCodec());
        JmxTestPlan jmxTestPlan = new JmxTestPlan();
        jmxTestPlan.getTestPlan().addChild(new ThreadGroup());
        new JmxSerializer(codecs).serialize(jmxTestPlan);
    }
}
