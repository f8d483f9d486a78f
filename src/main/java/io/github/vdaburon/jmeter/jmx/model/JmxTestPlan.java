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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A whole jmx file : the attributes of the <code>jmeterTestPlan</code> root tag and the test plan tree.
 * <pre>
 * &lt;jmeterTestPlan version="1.2" properties="5.0" jmeter="5.6.3"&gt;
 *   &lt;hashTree&gt;
 *     &lt;TestPlan .../&gt;
 *     &lt;hashTree&gt; top level elements &lt;/hashTree&gt;
 *   &lt;/hashTree&gt;
 * &lt;/jmeterTestPlan&gt;
 * </pre>
 */
public class JmxTestPlan {

    public static final String K_DEFAULT_VERSION = "1.2";
    public static final String K_DEFAULT_PROPERTIES = "5.0";
    public static final String K_DEFAULT_JMETER_VERSION = "5.6.3";

    private String version = K_DEFAULT_VERSION;
    private String properties = K_DEFAULT_PROPERTIES;
    private String jmeterVersion = K_DEFAULT_JMETER_VERSION;
    private TestPlan testPlan;

    public JmxTestPlan() {
        this(new TestPlan());
    }

    public JmxTestPlan(TestPlan testPlan) {
        this.testPlan = Objects.requireNonNull(testPlan, "testPlan");
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getProperties() {
        return properties;
    }

    public void setProperties(String properties) {
        this.properties = properties;
    }

    public String getJmeterVersion() {
        return jmeterVersion;
    }

    public void setJmeterVersion(String jmeterVersion) {
        this.jmeterVersion = jmeterVersion;
    }

    public TestPlan getTestPlan() {
        return testPlan;
    }

    public void setTestPlan(TestPlan testPlan) {
        this.testPlan = Objects.requireNonNull(testPlan, "testPlan");
    }

    /**
     * @return all the elements of the tree, depth first, the test plan first
     */
    public List<PlanElement> getAllElements() {
        List<PlanElement> listElements = new ArrayList<>();
        collect(testPlan, listElements);
        return listElements;
    }

    private static void collect(PlanElement element, List<PlanElement> listElements) {
        listElements.add(element);
        for (PlanElement child : element.getChildren()) {
            collect(child, listElements);
        }
    }

    /**
     * The names an executor uses to select the thread groups to run (e.g. -JthreadGroupNames=...)
     * @return the names of the top level thread groups, in plan order
     */
    public List<String> getThreadGroupNames() {
        List<String> listNames = new ArrayList<>();
        for (PlanElement element : testPlan.getChildren()) {
            if (element.getKind().isThreadGroup()) {
                listNames.add(element.getName());
            }
        }
        return listNames;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        JmxTestPlan that = (JmxTestPlan) o;
        return Objects.equals(version, that.version)
                && Objects.equals(properties, that.properties)
                && Objects.equals(jmeterVersion, that.jmeterVersion)
                && testPlan.equals(that.testPlan);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, properties, jmeterVersion, testPlan);
    }
}
