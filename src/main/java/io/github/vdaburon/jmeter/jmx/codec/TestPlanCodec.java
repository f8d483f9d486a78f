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
import io.github.vdaburon.jmeter.jmx.model.ElementKind;
import io.github.vdaburon.jmeter.jmx.model.TestPlan;
import org.apache.commons.lang3.StringUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * <pre>
 * &lt;TestPlan guiclass="TestPlanGui" testclass="TestPlan" testname="Test Plan" enabled="true"&gt;
 *   &lt;boolProp name="TestPlan.functional_mode"&gt;false&lt;/boolProp&gt;
 *   &lt;boolProp name="TestPlan.tearDown_on_shutdown"&gt;false&lt;/boolProp&gt;
 *   &lt;boolProp name="TestPlan.serialize_threadgroups"&gt;false&lt;/boolProp&gt;
 *   &lt;elementProp name="TestPlan.user_defined_variables" elementType="Arguments" guiclass="ArgumentsPanel" testclass="Arguments" testname="User Defined Variables"&gt;
 *     &lt;collectionProp name="Arguments.arguments"/&gt;
 *   &lt;/elementProp&gt;
 *   &lt;stringProp name="TestPlan.user_define_classpath"&gt;&lt;/stringProp&gt;
 * &lt;/TestPlan&gt;
 * </pre>
 */
public class TestPlanCodec extends AbstractElementCodec<TestPlan> {

    public static final String K_USER_DEFINED_VARIABLES = "TestPlan.user_defined_variables";

    public TestPlanCodec() {
        super(ElementKind.TEST_PLAN);
    }

    @Override
    protected TestPlan newElement() {
        return new TestPlan();
    }

    @Override
    protected void readProperties(Element node, TestPlan element) {
        element.setFunctionalMode(JmxProperties.getBool(node, "TestPlan.functional_mode", element.isFunctionalMode()));
        element.setTearDownOnShutdown(JmxProperties.getBool(node, "TestPlan.tearDown_on_shutdown", element.isTearDownOnShutdown()));
        element.setSerializeThreadGroups(JmxProperties.getBool(node, "TestPlan.serialize_threadgroups", element.isSerializeThreadGroups()));
        element.setUserDefineClasspath(JmxProperties.getString(node, "TestPlan.user_define_classpath").orElse(element.getUserDefineClasspath()));

        Element eltVariables = JmxProperties.findElementProp(node, K_USER_DEFINED_VARIABLES);
        if (eltVariables == null) {
            eltVariables = JmxProperties.findElementPropByType(node, "Arguments");
        }
        element.getUserDefinedVariables().addAll(readArguments(eltVariables));
    }

    @Override
    protected void writeProperties(Document document, Element node, TestPlan element) {
        JmxProperties.setBool(document, node, "TestPlan.functional_mode", element.isFunctionalMode());
        JmxProperties.setBool(document, node, "TestPlan.tearDown_on_shutdown", element.isTearDownOnShutdown());
        JmxProperties.setBool(document, node, "TestPlan.serialize_threadgroups", element.isSerializeThreadGroups());

        Element eltVariables = JmxProperties.createElementProp(document, K_USER_DEFINED_VARIABLES, "Arguments", "ArgumentsPanel", "Arguments", "User Defined Variables");
        writeArguments(document, eltVariables, element.getUserDefinedVariables());
        node.appendChild(eltVariables);

        JmxProperties.setString(document, node, "TestPlan.user_define_classpath", StringUtils.defaultString(element.getUserDefineClasspath()));
    }
}
