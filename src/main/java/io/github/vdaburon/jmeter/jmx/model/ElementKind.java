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

package io.github.vdaburon.jmeter.jmx.model;

/**
 * The kinds of test element this library knows how to read and write.
 * Each kind carries the xml tag, the testclass and guiclass attributes and the label JMeter gives a new element.
 */
public enum ElementKind {

    TEST_PLAN("TestPlan", "TestPlan", "TestPlanGui", "Test Plan", Category.PLAN),

    THREAD_GROUP("ThreadGroup", "ThreadGroup", "ThreadGroupGui", "Thread Group", Category.THREAD_GROUP),
    SETUP_THREAD_GROUP("SetupThreadGroup", "SetupThreadGroup", "SetupThreadGroupGui", "setUp Thread Group", Category.THREAD_GROUP),
    POST_THREAD_GROUP("PostThreadGroup", "PostThreadGroup", "PostThreadGroupGui", "tearDown Thread Group", Category.THREAD_GROUP),

    HTTP_SAMPLER("HTTPSamplerProxy", "HTTPSamplerProxy", "HttpTestSampleGui", "HTTP Request", Category.SAMPLER),
    JSR223_SAMPLER("JSR223Sampler", "JSR223Sampler", "TestBeanGUI", "JSR223 Sampler", Category.SAMPLER),

    HTTP_DEFAULTS("ConfigTestElement", "ConfigTestElement", "HttpDefaultsGui", "HTTP Request Defaults", Category.CONFIG),
    HEADER_MANAGER("HeaderManager", "HeaderManager", "HeaderPanel", "HTTP Header Manager", Category.CONFIG),
    ARGUMENTS("Arguments", "Arguments", "ArgumentsPanel", "User Defined Variables", Category.CONFIG),
    COOKIE_MANAGER("CookieManager", "CookieManager", "CookiePanel", "HTTP Cookie Manager", Category.CONFIG),
    CACHE_MANAGER("CacheManager", "CacheManager", "CacheManagerGui", "HTTP Cache Manager", Category.CONFIG),
    CSV_DATA_SET("CSVDataSet", "CSVDataSet", "TestBeanGUI", "CSV Data Set Config", Category.CONFIG),

    JSR223_PRE_PROCESSOR("JSR223PreProcessor", "JSR223PreProcessor", "TestBeanGUI", "JSR223 PreProcessor", Category.PRE_PROCESSOR),

    REGEX_EXTRACTOR("RegexExtractor", "RegexExtractor", "RegexExtractorGui", "Regular Expression Extractor", Category.POST_PROCESSOR),
    JSON_EXTRACTOR("JSONPostProcessor", "JSONPostProcessor", "JSONPostProcessorGui", "JSON Extractor", Category.POST_PROCESSOR),
    BOUNDARY_EXTRACTOR("BoundaryExtractor", "BoundaryExtractor", "BoundaryExtractorGui", "Boundary Extractor", Category.POST_PROCESSOR),
    JSR223_POST_PROCESSOR("JSR223PostProcessor", "JSR223PostProcessor", "TestBeanGUI", "JSR223 PostProcessor", Category.POST_PROCESSOR),

    RESPONSE_ASSERTION("ResponseAssertion", "ResponseAssertion", "AssertionGui", "Response Assertion", Category.ASSERTION),
    DURATION_ASSERTION("DurationAssertion", "DurationAssertion", "DurationAssertionGui", "Duration Assertion", Category.ASSERTION),
    JSON_ASSERTION("JSONPathAssertion", "JSONPathAssertion", "JSONPathAssertionGui", "JSON Assertion", Category.ASSERTION),
    BEANSHELL_ASSERTION("BeanShellAssertion", "BeanShellAssertion", "BeanShellAssertionGui", "BeanShell Assertion", Category.ASSERTION),

    LOOP_CONTROLLER("LoopController", "LoopController", "LoopControlPanel", "Loop Controller", Category.CONTROLLER),
    IF_CONTROLLER("IfController", "IfController", "IfControllerPanel", "If Controller", Category.CONTROLLER),
    WHILE_CONTROLLER("WhileController", "WhileController", "WhileControllerGui", "While Controller", Category.CONTROLLER),
    TRANSACTION_CONTROLLER("TransactionController", "TransactionController", "TransactionControllerGui", "Transaction Controller", Category.CONTROLLER),

    TEST_ACTION("TestAction", "TestAction", "TestActionGui", "Flow Control Action", Category.SAMPLER),

    CONSTANT_TIMER("ConstantTimer", "ConstantTimer", "ConstantTimerGui", "Constant Timer", Category.TIMER),
    UNIFORM_RANDOM_TIMER("UniformRandomTimer", "UniformRandomTimer", "UniformRandomTimerGui", "Uniform Random Timer", Category.TIMER),
    CONSTANT_THROUGHPUT_TIMER("ConstantThroughputTimer", "ConstantThroughputTimer", "TestBeanGUI", "Constant Throughput Timer", Category.TIMER),

    RESULT_COLLECTOR("ResultCollector", "ResultCollector", "ViewResultsFullVisualizer", "View Results Tree", Category.LISTENER);

    /**
     * Coarse grouping of the kinds, the groups JMeter shows in its "Add" menu
     */
    public enum Category {
        PLAN, THREAD_GROUP, SAMPLER, CONTROLLER, CONFIG, PRE_PROCESSOR, POST_PROCESSOR, ASSERTION, TIMER, LISTENER
    }

    private final String tagName;
    private final String testClass;
    private final String guiClass;
    private final String defaultName;
    private final Category category;

    ElementKind(String tagName, String testClass, String guiClass, String defaultName, Category category) {
        this.tagName = tagName;
        this.testClass = testClass;
        this.guiClass = guiClass;
        this.defaultName = defaultName;
        this.category = category;
    }

    public String getTagName() {
        return tagName;
    }

    public String getTestClass() {
        return testClass;
    }

    public String getGuiClass() {
        return guiClass;
    }

    public String getDefaultName() {
        return defaultName;
    }

    public Category getCategory() {
        return category;
    }

    public boolean isThreadGroup() {
        return category == Category.THREAD_GROUP;
    }
}
