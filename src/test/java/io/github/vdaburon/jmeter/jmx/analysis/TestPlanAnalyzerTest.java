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


package io.github.vdaburon.jmeter.jmx.analysis;

import io.github.vdaburon.jmeter.jmx.JmxTestFiles;
import io.github.vdaburon.jmeter.jmx.analysis.AnalysisResult.Category;
import io.github.vdaburon.jmeter.jmx.analysis.AnalysisResult.Severity;
import io.github.vdaburon.jmeter.jmx.model.ConstantTimer;
import io.github.vdaburon.jmeter.jmx.model.Header;
import io.github.vdaburon.jmeter.jmx.model.HeaderManager;
import io.github.vdaburon.jmeter.jmx.model.HttpDefaults;
import io.github.vdaburon.jmeter.jmx.model.HttpSamplerProxy;
import io.github.vdaburon.jmeter.jmx.model.IntOrExpression;
import io.github.vdaburon.jmeter.jmx.model.JmxTestPlan;
import io.github.vdaburon.jmeter.jmx.model.ResponseAssertion;
import io.github.vdaburon.jmeter.jmx.model.ResultCollector;
import io.github.vdaburon.jmeter.jmx.model.ThreadGroup;
import io.github.vdaburon.jmeter.jmx.model.TransactionController;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

public class TestPlanAnalyzerTest {

    private final TestPlanAnalyzer analyzer = new TestPlanAnalyzer();

    private static List<AnalysisResult> filter(List<AnalysisResult> listResults, Category category, Severity severity) {
        List<AnalysisResult> listFiltered = new ArrayList<>();
        for (AnalysisResult result : listResults) {
            if (result.getCategory() == category && result.getSeverity() == severity) {
                listFiltered.add(result);
            }
        }
        return listFiltered;
    }

    @Test
    public void testCleanPlan() throws Exception {
        JmxTestPlan jmxTestPlan = JmxTestFiles.parse("simple_plan.jmx").getTestPlan();
        Assert.assertTrue(analyzer.analyze(jmxTestPlan).isEmpty());
    }

    @Test
    public void testNoThreadGroup() {
        List<AnalysisResult> listResults = analyzer.analyze(new JmxTestPlan());
        Assert.assertEquals(1, listResults.size());
        Assert.assertEquals(Severity.WARNING, listResults.get(0).getSeverity());
        Assert.assertEquals(Category.BEST_PRACTICE, listResults.get(0).getCategory());
        Assert.assertNull(listResults.get(0).getElement());
    }

    @Test
    public void testThreadGroupRules() {
        JmxTestPlan jmxTestPlan = new JmxTestPlan();
        ThreadGroup rush = jmxTestPlan.getTestPlan().addChild(new ThreadGroup());
        rush.setName("rush");
        rush.setNumThreads(IntOrExpression.of(500));
        rush.setRampTime(IntOrExpression.of(10));
        rush.setLoops(IntOrExpression.of(ThreadGroup.K_INFINITE_LOOPS));

        List<AnalysisResult> listResults = analyzer.analyze(jmxTestPlan);

        List<AnalysisResult> listPerformance = filter(listResults, Category.PERFORMANCE, Severity.WARNING);
        Assert.assertEquals(1, listPerformance.size());
        Assert.assertEquals("rush", listPerformance.get(0).getElement());
        Assert.assertEquals(1, filter(listResults, Category.BEST_PRACTICE, Severity.WARNING).size());
        Assert.assertEquals(1, filter(listResults, Category.MAINTAINABILITY, Severity.INFO).size());
        Assert.assertEquals(3, listResults.size());
    }

    @Test
    public void testExpressionsAndSchedulerAreNotFlagged() {
        JmxTestPlan jmxTestPlan = new JmxTestPlan();
        ThreadGroup threadGroup = jmxTestPlan.getTestPlan().addChild(new ThreadGroup());
        threadGroup.setNumThreads(IntOrExpression.ofExpression("${__P(users,1000)}"));
        threadGroup.setRampTime(IntOrExpression.of(1));
        threadGroup.setContinueForever(true);
        threadGroup.setScheduler(true);
        threadGroup.setDuration(IntOrExpression.of(3600));
        threadGroup.addChild(new ConstantTimer());

        Assert.assertTrue(analyzer.analyze(jmxTestPlan).isEmpty());
    }

    @Test
    public void testSamplerRules() {
        JmxTestPlan jmxTestPlan = new JmxTestPlan();
        ThreadGroup threadGroup = jmxTestPlan.getTestPlan().addChild(new ThreadGroup());
        HttpSamplerProxy sampler = threadGroup.addChild(new HttpSamplerProxy());
        sampler.setName("reset");
        sampler.setPath("/reset?Password=secret");

        List<AnalysisResult> listResults = analyzer.analyze(jmxTestPlan);
        Assert.assertEquals(1, filter(listResults, Category.BEST_PRACTICE, Severity.INFO).size());
        Assert.assertEquals(1, filter(listResults, Category.SECURITY, Severity.WARNING).size());
        List<AnalysisResult> listErrors = filter(listResults, Category.BEST_PRACTICE, Severity.ERROR);
        Assert.assertEquals(1, listErrors.size());
        Assert.assertEquals("reset", listErrors.get(0).getElement());
    }

    @Test
    public void testDefaultsDomainInScope() {
        JmxTestPlan jmxTestPlan = new JmxTestPlan();
        HttpDefaults defaults = jmxTestPlan.getTestPlan().addChild(new HttpDefaults());
        defaults.setDomain("${HOST}");
        ThreadGroup threadGroup = jmxTestPlan.getTestPlan().addChild(new ThreadGroup());
        TransactionController transaction = threadGroup.addChild(new TransactionController());
        HttpSamplerProxy sampler = transaction.addChild(new HttpSamplerProxy());
        sampler.addChild(new ResponseAssertion());

        Assert.assertTrue(filter(analyzer.analyze(jmxTestPlan), Category.BEST_PRACTICE, Severity.ERROR).isEmpty());

        // defaults of another branch are out of scope
        JmxTestPlan otherBranch = new JmxTestPlan();
        ThreadGroup first = otherBranch.getTestPlan().addChild(new ThreadGroup());
        first.addChild(new HttpDefaults()).setDomain("example.com");
        ThreadGroup second = otherBranch.getTestPlan().addChild(new ThreadGroup());
        second.addChild(new HttpSamplerProxy()).addChild(new ResponseAssertion());
        Assert.assertEquals(1, filter(analyzer.analyze(otherBranch), Category.BEST_PRACTICE, Severity.ERROR).size());
    }

    @Test
    public void testHardCodedAuthorization() {
        JmxTestPlan jmxTestPlan = new JmxTestPlan();
        ThreadGroup threadGroup = jmxTestPlan.getTestPlan().addChild(new ThreadGroup());
        HeaderManager hardCoded = threadGroup.addChild(new HeaderManager());
        hardCoded.getHeaders().add(new Header("authorization", "Basic dXNlcjpwYXNz"));
        HeaderManager withVariable = threadGroup.addChild(new HeaderManager());
        withVariable.getHeaders().add(new Header("Authorization", "Bearer ${TOKEN}"));

        List<AnalysisResult> listSecurity = filter(analyzer.analyze(jmxTestPlan), Category.SECURITY, Severity.WARNING);
        Assert.assertEquals(1, listSecurity.size());
    }

    @Test
    public void testStructureRules() {
        JmxTestPlan jmxTestPlan = new JmxTestPlan();
        ThreadGroup threadGroup = jmxTestPlan.getTestPlan().addChild(new ThreadGroup());
        for (int i = 0; i < 6; i++) {
            threadGroup.addChild(new ConstantTimer()).setEnabled(false);
        }
        for (int i = 0; i < 4; i++) {
            jmxTestPlan.getTestPlan().addChild(new ResultCollector());
        }

        List<AnalysisResult> listResults = analyzer.analyze(jmxTestPlan);
        Assert.assertEquals(1, filter(listResults, Category.MAINTAINABILITY, Severity.INFO).size());
        Assert.assertEquals(1, filter(listResults, Category.PERFORMANCE, Severity.WARNING).size());
        Assert.assertEquals(2, listResults.size());
    }

    @Test
    public void testFullPlan() throws Exception {
        JmxTestPlan jmxTestPlan = JmxTestFiles.parse("full_plan.jmx").getTestPlan();
        List<AnalysisResult> listResults = analyzer.analyze(jmxTestPlan);
        // POST cart has no assertion, the Logout group is empty
        Assert.assertEquals(1, filter(listResults, Category.BEST_PRACTICE, Severity.INFO).size());
        Assert.assertEquals(1, filter(listResults, Category.MAINTAINABILITY, Severity.INFO).size());
        Assert.assertTrue(filter(listResults, Category.BEST_PRACTICE, Severity.ERROR).isEmpty());
        Assert.assertTrue(filter(listResults, Category.SECURITY, Severity.WARNING).isEmpty());
    }

    @Test
    public void testExplain() throws Exception {
        String text = analyzer.explain(JmxTestFiles.parse("simple_plan.jmx").getTestPlan());
        Assert.assertTrue(text.startsWith("This JMeter test plan \"Ping plan\" contains 1 thread group(s) with a total of 1 sampler(s)."));
        Assert.assertTrue(text.contains("- Simulates 3 concurrent users"));
        Assert.assertTrue(text.contains("- Executes 2 iteration(s)"));
        Assert.assertTrue(text.contains("  - GET https://api.example.com/ping"));

        Assert.assertTrue(analyzer.explain(new JmxTestPlan()).endsWith("contains no thread groups."));
    }

    @Test
    public void testResultToString() {
        AnalysisResult result = new AnalysisResult(Severity.ERROR, Category.SECURITY, "message", "element", "suggestion");
        Assert.assertEquals("[ERROR][SECURITY] message => suggestion", result.toString());
    }
}
