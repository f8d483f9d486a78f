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

import io.github.vdaburon.jmeter.jmx.analysis.AnalysisResult.Category;
import io.github.vdaburon.jmeter.jmx.analysis.AnalysisResult.Severity;
import io.github.vdaburon.jmeter.jmx.model.ElementKind;
import io.github.vdaburon.jmeter.jmx.model.Header;
import io.github.vdaburon.jmeter.jmx.model.HeaderManager;
import io.github.vdaburon.jmeter.jmx.model.HttpDefaults;
import io.github.vdaburon.jmeter.jmx.model.HttpSamplerProxy;
import io.github.vdaburon.jmeter.jmx.model.JmxTestPlan;
import io.github.vdaburon.jmeter.jmx.model.PlanElement;
import io.github.vdaburon.jmeter.jmx.model.ThreadGroup;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Look for the usual mistakes of a load test plan : thread groups, samplers, credentials and plan structure.
 * The analyzer reads the plan, it never changes it.
 */
public class TestPlanAnalyzer {

    public static final int K_MANY_THREADS = 100;
    public static final int K_MIN_RAMP_UP_SEC = 60;
    public static final int K_MAX_DISABLED_ELEMENTS = 5;
    public static final int K_MAX_LISTENERS = 3;
    public static final String K_AUTHORIZATION_HEADER = "Authorization";
    private static final int K_MAX_REQUESTS_LISTED = 5;

    private static final Logger LOGGER = Logger.getLogger(TestPlanAnalyzer.class.getName());

    /**
     * @param jmxTestPlan the plan to check
     * @return the findings, thread groups first, then samplers, security and structure
     */
    public List<AnalysisResult> analyze(JmxTestPlan jmxTestPlan) {
        List<AnalysisResult> listResults = new ArrayList<>();
        List<PlanElement> listElements = jmxTestPlan.getAllElements();
        // the TestPlan itself is not checked
        listElements.remove(0);

        analyzeThreadGroups(listElements, listResults);
        analyzeSamplers(jmxTestPlan.getTestPlan(), false, listResults);
        analyzeSecurity(listElements, listResults);
        analyzeStructure(listElements, listResults);
        LOGGER.fine("analyze, nb results=" + listResults.size());
        return listResults;
    }

    private void analyzeThreadGroups(List<PlanElement> listElements, List<AnalysisResult> listResults) {
        List<ThreadGroup> listThreadGroups = new ArrayList<>();
        for (PlanElement element : listElements) {
            if (element instanceof ThreadGroup) {
                listThreadGroups.add((ThreadGroup) element);
            }
        }

        if (listThreadGroups.isEmpty()) {
            listResults.add(new AnalysisResult(Severity.WARNING, Category.BEST_PRACTICE, "No thread groups found in test plan", null,
                    "Add at least one thread group to execute samplers"));
        }

        for (ThreadGroup threadGroup : listThreadGroups) {
            // an expression counts as 0, its value is only known at run time
            int threads = threadGroup.getNumThreads().intValueOr(0);
            int rampTime = threadGroup.getRampTime().intValueOr(0);
            if (threads > K_MANY_THREADS && rampTime < K_MIN_RAMP_UP_SEC) {
                listResults.add(new AnalysisResult(Severity.WARNING, Category.PERFORMANCE,
                        "Thread group \"" + threadGroup.getName() + "\" has " + threads + " threads with only " + rampTime + "s ramp-up",
                        threadGroup.getName(), "Consider increasing ramp-up time to avoid overwhelming the target system"));
            }

            boolean hasDuration = threadGroup.isScheduler() && threadGroup.getDuration() != null;
            if (threadGroup.isInfinite() && !hasDuration) {
                listResults.add(new AnalysisResult(Severity.WARNING, Category.BEST_PRACTICE,
                        "Thread group \"" + threadGroup.getName() + "\" has infinite loops without duration limit",
                        threadGroup.getName(), "Set a duration or use finite loop count to prevent runaway tests"));
            }

            if (threadGroup.getChildren().isEmpty()) {
                listResults.add(new AnalysisResult(Severity.INFO, Category.MAINTAINABILITY,
                        "Thread group \"" + threadGroup.getName() + "\" is empty",
                        threadGroup.getName(), "Add samplers or remove unused thread group"));
            }
        }
    }

    /**
     * Walk the tree, an HTTP Request Defaults with a domain applies to its siblings and their subtrees
     */
    private void analyzeSamplers(PlanElement parent, boolean isDefaultDomainInScope, List<AnalysisResult> listResults) {
        boolean isDefaultDomain = isDefaultDomainInScope;
        for (PlanElement child : parent.getChildren()) {
            if (child instanceof HttpDefaults && child.isEnabled() && StringUtils.isNotEmpty(((HttpDefaults) child).getDomain())) {
                isDefaultDomain = true;
            }
        }

        for (PlanElement child : parent.getChildren()) {
            if (child instanceof HttpSamplerProxy) {
                analyzeHttpSampler((HttpSamplerProxy) child, isDefaultDomain, listResults);
            }
            analyzeSamplers(child, isDefaultDomain, listResults);
        }
    }

    private void analyzeHttpSampler(HttpSamplerProxy sampler, boolean isDefaultDomain, List<AnalysisResult> listResults) {
        boolean hasAssertion = false;
        for (PlanElement child : sampler.getChildren()) {
            if (child.getKind().getCategory() == ElementKind.Category.ASSERTION) {
                hasAssertion = true;
                break;
            }
        }
        if (!hasAssertion) {
            listResults.add(new AnalysisResult(Severity.INFO, Category.BEST_PRACTICE,
                    "HTTP Sampler \"" + sampler.getName() + "\" has no assertions",
                    sampler.getName(), "Add response assertions to validate server responses"));
        }

        String path = StringUtils.defaultString(sampler.getPath());
        if (StringUtils.containsIgnoreCase(path, "password") || StringUtils.containsIgnoreCase(path, "token")) {
            listResults.add(new AnalysisResult(Severity.WARNING, Category.SECURITY,
                    "HTTP Sampler \"" + sampler.getName() + "\" may contain credentials in URL",
                    sampler.getName(), "Use variables or property files for sensitive data"));
        }

        if (StringUtils.isEmpty(sampler.getDomain()) && !isDefaultDomain) {
            listResults.add(new AnalysisResult(Severity.ERROR, Category.BEST_PRACTICE,
                    "HTTP Sampler \"" + sampler.getName() + "\" has no domain configured",
                    sampler.getName(), "Configure the server domain or use a variable"));
        }
    }

    private void analyzeSecurity(List<PlanElement> listElements, List<AnalysisResult> listResults) {
        for (PlanElement element : listElements) {
            if (!(element instanceof HeaderManager)) {
                continue;
            }
            for (Header header : ((HeaderManager) element).getHeaders()) {
                if (K_AUTHORIZATION_HEADER.equalsIgnoreCase(header.getName()) && !StringUtils.contains(header.getValue(), "${")) {
                    listResults.add(new AnalysisResult(Severity.WARNING, Category.SECURITY,
                            "Header manager \"" + element.getName() + "\" has a hard coded Authorization header",
                            element.getName(), "Use variables for Authorization headers and API keys"));
                }
            }
        }
    }

    private void analyzeStructure(List<PlanElement> listElements, List<AnalysisResult> listResults) {
        int nbDisabled = 0;
        int nbListeners = 0;
        for (PlanElement element : listElements) {
            if (!element.isEnabled()) {
                nbDisabled++;
            }
            if (element.getKind() == ElementKind.RESULT_COLLECTOR) {
                nbListeners++;
            }
        }

        if (nbDisabled > K_MAX_DISABLED_ELEMENTS) {
            listResults.add(new AnalysisResult(Severity.INFO, Category.MAINTAINABILITY,
                    "Test plan has " + nbDisabled + " disabled elements", null,
                    "Consider removing unused elements to improve maintainability"));
        }
        if (nbListeners > K_MAX_LISTENERS) {
            listResults.add(new AnalysisResult(Severity.WARNING, Category.PERFORMANCE,
                    "Test plan has " + nbListeners + " listeners", null,
                    "Disable listeners during load tests to reduce overhead"));
        }
    }

    /**
     * @param jmxTestPlan the plan
     * @return a text that tells the thread groups, their load and their requests
     */
    public String explain(JmxTestPlan jmxTestPlan) {
        StringBuilder sb = new StringBuilder();
        sb.append("This JMeter test plan \"").append(jmxTestPlan.getTestPlan().getName()).append("\" ");

        List<ThreadGroup> listThreadGroups = new ArrayList<>();
        List<PlanElement> listSamplers = new ArrayList<>();
        for (PlanElement element : jmxTestPlan.getAllElements()) {
            if (element instanceof ThreadGroup) {
                listThreadGroups.add((ThreadGroup) element);
            } else if (element.getKind().getCategory() == ElementKind.Category.SAMPLER && element.getKind() != ElementKind.TEST_ACTION) {
                listSamplers.add(element);
            }
        }
        if (listThreadGroups.isEmpty()) {
            return sb.append("is empty and contains no thread groups.").toString();
        }
        sb.append("contains ").append(listThreadGroups.size()).append(" thread group(s) with a total of ")
                .append(listSamplers.size()).append(" sampler(s).\n\n");

        for (ThreadGroup threadGroup : listThreadGroups) {
            List<PlanElement> listGroupSamplers = new ArrayList<>();
            collectSamplers(threadGroup, listGroupSamplers);

            sb.append("Thread Group \"").append(threadGroup.getName()).append("\":\n");
            sb.append("- Simulates ").append(threadGroup.getNumThreads()).append(" concurrent users\n");
            sb.append("- Ramps up over ").append(threadGroup.getRampTime()).append(" seconds\n");
            sb.append("- Executes ").append(threadGroup.isInfinite() ? "infinite" : threadGroup.getLoops().toString()).append(" iteration(s)\n");
            sb.append("- Contains ").append(listGroupSamplers.size()).append(" request(s)\n\n");

            if (!listGroupSamplers.isEmpty() && listGroupSamplers.size() <= K_MAX_REQUESTS_LISTED) {
                sb.append("Requests:\n");
                for (PlanElement sampler : listGroupSamplers) {
                    if (sampler instanceof HttpSamplerProxy) {
                        HttpSamplerProxy httpSampler = (HttpSamplerProxy) sampler;
                        sb.append("  - ").append(httpSampler.getMethod()).append(" ").append(httpSampler.getProtocol()).append("://")
                                .append(httpSampler.getDomain()).append(httpSampler.getPath()).append("\n");
                    } else {
                        sb.append("  - ").append(sampler.getName()).append("\n");
                    }
                }
                sb.append("\n");
            }
        }
        return sb.toString().trim();
    }

    private static void collectSamplers(PlanElement parent, List<PlanElement> listSamplers) {
        for (PlanElement child : parent.getChildren()) {
            if (child.getKind().getCategory() == ElementKind.Category.SAMPLER && child.getKind() != ElementKind.TEST_ACTION) {
                listSamplers.add(child);
            }
            collectSamplers(child, listSamplers);
        }
    }
}
