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

import io.github.vdaburon.jmeter.jmx.model.BeanShellAssertion;
import io.github.vdaburon.jmeter.jmx.model.ConstantThroughputTimer;
import io.github.vdaburon.jmeter.jmx.model.ConstantTimer;
import io.github.vdaburon.jmeter.jmx.model.ElementKind;
import io.github.vdaburon.jmeter.jmx.model.HttpDefaults;
import io.github.vdaburon.jmeter.jmx.model.HttpSamplerProxy;
import io.github.vdaburon.jmeter.jmx.model.IntOrExpression;
import io.github.vdaburon.jmeter.jmx.model.JmxTestPlan;
import io.github.vdaburon.jmeter.jmx.model.PlanElement;
import io.github.vdaburon.jmeter.jmx.model.ResponseAssertion;
import io.github.vdaburon.jmeter.jmx.model.TestPlan;
import io.github.vdaburon.jmeter.jmx.model.ThreadGroup;
import org.junit.Assert;
import org.junit.Test;

import java.util.Collections;
import java.util.List;

public class JmxParserTest {

    @Test
    public void testSimplePlan() throws Exception {
        ParseResult result = JmxTestFiles.parse("simple_plan.jmx");
        Assert.assertTrue(result.getDiagnostics().isEmpty());

        JmxTestPlan jmxTestPlan = result.getTestPlan();
        Assert.assertEquals("1.2", jmxTestPlan.getVersion());
        Assert.assertEquals("5.0", jmxTestPlan.getProperties());
        Assert.assertEquals("5.6.3", jmxTestPlan.getJmeterVersion());

        TestPlan testPlan = jmxTestPlan.getTestPlan();
        Assert.assertEquals("Ping plan", testPlan.getName());
        Assert.assertEquals(1, testPlan.getChildren().size());

        ThreadGroup threadGroup = (ThreadGroup) testPlan.getChildren().get(0);
        Assert.assertEquals("Users", threadGroup.getName());
        Assert.assertEquals(IntOrExpression.of(3), threadGroup.getNumThreads());
        Assert.assertEquals(IntOrExpression.of(5), threadGroup.getRampTime());
        Assert.assertEquals(IntOrExpression.of(2), threadGroup.getLoops());
        Assert.assertNull(threadGroup.getDuration());

        HttpSamplerProxy sampler = (HttpSamplerProxy) threadGroup.getChildren().get(0);
        Assert.assertEquals("GET", sampler.getMethod());
        Assert.assertEquals("api.example.com", sampler.getDomain());
        Assert.assertEquals("/ping", sampler.getPath());
        Assert.assertNull(sampler.getPort());
        Assert.assertTrue(sampler.getArguments().isEmpty());

        ResponseAssertion assertion = (ResponseAssertion) sampler.getChildren().get(0);
        Assert.assertEquals(Collections.singletonList("200"), assertion.getTestStrings());
        Assert.assertEquals(ResponseAssertion.K_FIELD_RESPONSE_CODE, assertion.getTestField());
        Assert.assertEquals(ResponseAssertion.K_TYPE_EQUALS, assertion.getTestType());
        Assert.assertTrue(assertion.getChildren().isEmpty());
    }

    @Test
    public void testUnknownElementDroppedWithItsChildren() throws Exception {
        ParseResult result = JmxTestFiles.parse("unknown_element.jmx");

        PlanElement threadGroup = result.getTestPlan().getTestPlan().getChildren().get(0);
        List<PlanElement> listChildren = threadGroup.getChildren();
        Assert.assertEquals(2, listChildren.size());
        Assert.assertEquals("first", listChildren.get(0).getName());
        Assert.assertTrue(listChildren.get(0).getChildren().isEmpty());
        // the second sampler keeps its own hashTree, not the hashTree of the dropped plugin
        Assert.assertEquals("second", listChildren.get(1).getName());
        Assert.assertEquals(1, listChildren.get(1).getChildren().size());
        Assert.assertTrue(listChildren.get(1).getChildren().get(0) instanceof ConstantTimer);
        for (PlanElement element : result.getTestPlan().getAllElements()) {
            Assert.assertNotEquals("assertion of the plugin", element.getName());
        }

        Assert.assertEquals(1, result.getDiagnostics().size());
        Assert.assertTrue(result.hasDroppedElements());
        ParseDiagnostic diagnostic = result.getDiagnostics().get(0);
        Assert.assertEquals(ParseDiagnostic.Kind.UNKNOWN_ELEMENT_DROPPED, diagnostic.getKind());
        Assert.assertEquals("kg.apc.jmeter.samplers.DummySampler", diagnostic.getTestClass());
        Assert.assertEquals("dummy plugin", diagnostic.getTestName());
        Assert.assertEquals("Test Plan/Thread Group", diagnostic.getParentPath());
    }

    @Test
    public void testUnpairedTagsIgnored() throws Exception {
        ParseResult result = JmxTestFiles.parse("unpaired_tags.jmx");

        PlanElement threadGroup = result.getTestPlan().getTestPlan().getChildren().get(0);
        Assert.assertEquals(1, result.getTestPlan().getTestPlan().getChildren().size());
        Assert.assertEquals(1, threadGroup.getChildren().size());
        Assert.assertEquals("paired timer", threadGroup.getChildren().get(0).getName());

        Assert.assertFalse(result.hasDroppedElements());
        List<ParseDiagnostic> listUnpaired = result.getDiagnostics(ParseDiagnostic.Kind.UNPAIRED_ELEMENT);
        Assert.assertEquals(1, listUnpaired.size());
        Assert.assertEquals("lonely timer", listUnpaired.get(0).getTestName());
        Assert.assertEquals(1, result.getDiagnostics(ParseDiagnostic.Kind.UNPAIRED_CONTAINER).size());
    }

    @Test
    public void testOtherConfigTestElementDropped() throws Exception {
        String jmx = "<jmeterTestPlan><hashTree>"
                + "<TestPlan testclass=\"TestPlan\" testname=\"configs\"/><hashTree>"
                + "<ConfigTestElement guiclass=\"HttpDefaultsGui\" testclass=\"ConfigTestElement\" testname=\"http defaults\">"
                + "<stringProp name=\"HTTPSampler.domain\">api.example.com</stringProp>"
                + "</ConfigTestElement><hashTree/>"
                + "<ConfigTestElement guiclass=\"JavaConfigGui\" testclass=\"ConfigTestElement\" testname=\"java defaults\">"
                + "<stringProp name=\"classname\">org.example.MyClient</stringProp>"
                + "</ConfigTestElement><hashTree/>"
                + "<ConstantTimer testclass=\"ConstantTimer\" testname=\"after\"/><hashTree/>"
                + "</hashTree></hashTree></jmeterTestPlan>";
        ParseResult result = new JmxParser().parse(jmx);

        List<PlanElement> listChildren = result.getTestPlan().getTestPlan().getChildren();
        Assert.assertEquals(2, listChildren.size());
        Assert.assertEquals(ElementKind.HTTP_DEFAULTS, listChildren.get(0).getKind());
        Assert.assertEquals("api.example.com", ((HttpDefaults) listChildren.get(0)).getDomain());
        Assert.assertEquals("after", listChildren.get(1).getName());

        List<ParseDiagnostic> listDropped = result.getDiagnostics(ParseDiagnostic.Kind.UNKNOWN_ELEMENT_DROPPED);
        Assert.assertEquals(1, listDropped.size());
        Assert.assertEquals("ConfigTestElement", listDropped.get(0).getTestClass());
        Assert.assertEquals("java defaults", listDropped.get(0).getTestName());

        String written = new JmxSerializer().serialize(result.getTestPlan());
        Assert.assertFalse(written.contains("JavaConfigGui"));
        Assert.assertFalse(written.contains("classname"));
    }

    @Test
    public void testTagsBesideTestPlanReported() throws Exception {
        String jmx = "<jmeterTestPlan><hashTree>"
                + "<TestPlan testclass=\"TestPlan\" testname=\"plan\"/><hashTree>"
                + "<ConstantTimer testclass=\"ConstantTimer\" testname=\"inside\"/><hashTree/>"
                + "</hashTree>"
                + "<Arguments testclass=\"Arguments\" testname=\"outside\"/><hashTree/>"
                + "<hashTree/>"
                + "</hashTree></jmeterTestPlan>";
        ParseResult result = new JmxParser().parse(jmx);

        Assert.assertEquals(1, result.getTestPlan().getTestPlan().getChildren().size());
        Assert.assertEquals("inside", result.getTestPlan().getTestPlan().getChildren().get(0).getName());

        List<ParseDiagnostic> listUnpaired = result.getDiagnostics(ParseDiagnostic.Kind.UNPAIRED_ELEMENT);
        Assert.assertEquals(1, listUnpaired.size());
        Assert.assertEquals("outside", listUnpaired.get(0).getTestName());
        Assert.assertEquals(JmxParser.K_ROOT, listUnpaired.get(0).getParentPath());
        Assert.assertEquals(2, result.getDiagnostics(ParseDiagnostic.Kind.UNPAIRED_CONTAINER).size());
        Assert.assertFalse(result.hasDroppedElements());
    }

    @Test
    public void testBeanShellAssertionAndThroughputTimer() throws Exception {
        String jmx = "<jmeterTestPlan><hashTree>"
                + "<TestPlan testclass=\"TestPlan\" testname=\"plan\"/><hashTree>"
                + "<BeanShellAssertion guiclass=\"BeanShellAssertionGui\" testclass=\"BeanShellAssertion\" testname=\"check body\">"
                + "<stringProp name=\"BeanShellAssertion.query\">Failure = !ResponseData.contains(\"ok\");</stringProp>"
                + "<stringProp name=\"BeanShellAssertion.filename\"></stringProp>"
                + "<stringProp name=\"BeanShellAssertion.parameters\">-v</stringProp>"
                + "<boolProp name=\"BeanShellAssertion.resetInterpreter\">true</boolProp>"
                + "</BeanShellAssertion><hashTree/>"
                + "<ConstantThroughputTimer guiclass=\"TestBeanGUI\" testclass=\"ConstantThroughputTimer\" testname=\"pacing\">"
                + "<intProp name=\"calcMode\">2</intProp>"
                + "<doubleProp><name>throughput</name><value>120.0</value><savedValue>0.0</savedValue></doubleProp>"
                + "</ConstantThroughputTimer><hashTree/>"
                + "<ConstantThroughputTimer testclass=\"ConstantThroughputTimer\" testname=\"by property\">"
                + "<stringProp name=\"throughput\">${__P(tpm,60)}</stringProp>"
                + "</ConstantThroughputTimer><hashTree/>"
                + "</hashTree></hashTree></jmeterTestPlan>";
        ParseResult result = new JmxParser().parse(jmx);
        Assert.assertTrue(result.getDiagnostics().isEmpty());
        List<PlanElement> listChildren = result.getTestPlan().getTestPlan().getChildren();

        BeanShellAssertion assertion = (BeanShellAssertion) listChildren.get(0);
        Assert.assertEquals("Failure = !ResponseData.contains(\"ok\");", assertion.getQuery());
        Assert.assertEquals("", assertion.getFilename());
        Assert.assertEquals("-v", assertion.getParameters());
        Assert.assertTrue(assertion.isResetInterpreter());

        ConstantThroughputTimer pacing = (ConstantThroughputTimer) listChildren.get(1);
        Assert.assertEquals("120.0", pacing.getThroughput());
        Assert.assertEquals(ConstantThroughputTimer.K_CALC_MODE_THREAD_GROUP, pacing.getCalcMode());

        ConstantThroughputTimer byProperty = (ConstantThroughputTimer) listChildren.get(2);
        Assert.assertEquals("${__P(tpm,60)}", byProperty.getThroughput());
        Assert.assertEquals(ConstantThroughputTimer.K_CALC_MODE_THIS_THREAD, byProperty.getCalcMode());

        // a number is written back as JMeter writes it, an expression as a stringProp
        String written = new JmxSerializer().serialize(result.getTestPlan());
        Assert.assertTrue(written.contains("<name>throughput</name>"));
        Assert.assertTrue(written.contains("<value>120.0</value>"));
        Assert.assertTrue(written.contains("<stringProp name=\"throughput\">${__P(tpm,60)}</stringProp>"));
        Assert.assertEquals(result.getTestPlan(), new JmxParser().parse(written).getTestPlan());
    }

    @Test
    public void testExpressionsAndDefaults() throws Exception {
        ParseResult result = JmxTestFiles.parse("expressions.jmx");
        List<PlanElement> listGroups = result.getTestPlan().getTestPlan().getChildren();

        ThreadGroup byProperties = (ThreadGroup) listGroups.get(0);
        Assert.assertEquals(IntOrExpression.ofExpression("${LOOP_COUNT}"), byProperties.getLoops());
        Assert.assertEquals(IntOrExpression.ofExpression("${__P(threads,10)}"), byProperties.getNumThreads());
        Assert.assertEquals("${RAMP}", byProperties.getRampTime().toPropertyText());
        Assert.assertFalse(byProperties.isInfinite());

        // no loop controller in the file : one iteration, not an infinite test
        ThreadGroup noLoopCount = (ThreadGroup) listGroups.get(1);
        Assert.assertEquals(IntOrExpression.of(1), noLoopCount.getLoops());
        Assert.assertFalse(noLoopCount.isInfinite());
        Assert.assertEquals(IntOrExpression.of(1), noLoopCount.getRampTime());
        Assert.assertEquals(ThreadGroup.K_ON_ERROR_CONTINUE, noLoopCount.getOnSampleError());

        ThreadGroup infinite = (ThreadGroup) listGroups.get(2);
        Assert.assertTrue(infinite.isInfinite());
        Assert.assertTrue(infinite.isScheduler());
        Assert.assertEquals(IntOrExpression.of(600), infinite.getDuration());
    }

    @Test
    public void testAttributesWithoutTestname() throws Exception {
        String jmx = "<jmeterTestPlan version=\"1.2\"><hashTree>"
                + "<TestPlan testclass=\"TestPlan\"/><hashTree>"
                + "<ConstantTimer enabled=\"false\"/><hashTree/>"
                + "</hashTree></hashTree></jmeterTestPlan>";
        JmxTestPlan jmxTestPlan = new JmxParser().parse(jmx).getTestPlan();

        Assert.assertEquals(ElementKind.TEST_PLAN.getDefaultName(), jmxTestPlan.getTestPlan().getName());
        Assert.assertEquals(JmxTestPlan.K_DEFAULT_PROPERTIES, jmxTestPlan.getProperties());
        // no testclass, the tag name is the discriminator
        PlanElement timer = jmxTestPlan.getTestPlan().getChildren().get(0);
        Assert.assertEquals(ElementKind.CONSTANT_TIMER, timer.getKind());
        Assert.assertFalse(timer.isEnabled());
        Assert.assertEquals("300", ((ConstantTimer) timer).getDelay());
    }

    @Test
    public void testEmptyPlan() throws Exception {
        ParseResult result = new JmxParser().parse("<jmeterTestPlan version=\"1.2\" properties=\"5.0\" jmeter=\"5.6.3\"><hashTree/></jmeterTestPlan>");
        Assert.assertEquals(new JmxTestPlan(), result.getTestPlan());
        Assert.assertTrue(result.getTestPlan().getTestPlan().getChildren().isEmpty());

        result = new JmxParser().parse("<jmeterTestPlan/>");
        Assert.assertTrue(result.getTestPlan().getTestPlan().getChildren().isEmpty());
    }

    @Test
    public void testByteOrderMark() throws Exception {
        String jmx = "\uFEFF" + JmxTestFiles.content("simple_plan.jmx");
        Assert.assertEquals("Ping plan", new JmxParser().parse(jmx).getTestPlan().getTestPlan().getName());
    }

    @Test(expected = JmxParseException.class)
    public void testNotWellFormed() throws Exception {
        new JmxParser().parse("<jmeterTestPlan><hashTree></jmeterTestPlan>");
    }

    @Test(expected = JmxParseException.class)
    public void testNotAJmeterPlan() throws Exception {
        new JmxParser().parse("<project><hashTree/></project>");
    }

    @Test(expected = JmxParseException.class)
    public void testNoTestPlanElement() throws Exception {
        new JmxParser().parse("<jmeterTestPlan><hashTree><ThreadGroup testclass=\"ThreadGroup\"/><hashTree/></hashTree></jmeterTestPlan>");
    }

    @Test(expected = JmxParseException.class)
    public void testDoctypeRefused() throws Exception {
        new JmxParser().parse("<?xml version=\"1.0\"?><!DOCTYPE jmeterTestPlan [<!ENTITY x \"y\">]><jmeterTestPlan/>");
    }

    @Test(expected = JmxParseException.class)
    public void testMissingFile() throws Exception {
        new JmxParser().parseFile("does_not_exist.jmx");
    }

    @Test
    public void testParseFile() throws Exception {
        ParseResult result = new JmxParser().parseFile(JmxTestFiles.path("simple_plan.jmx"));
        Assert.assertEquals(4, result.getTestPlan().getAllElements().size());
    }
}
