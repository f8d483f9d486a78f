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
import io.github.vdaburon.jmeter.jmx.model.BoundaryExtractor;
import io.github.vdaburon.jmeter.jmx.model.CacheManager;
import io.github.vdaburon.jmeter.jmx.model.ConstantThroughputTimer;
import io.github.vdaburon.jmeter.jmx.model.ConstantTimer;
import io.github.vdaburon.jmeter.jmx.model.CookieManager;
import io.github.vdaburon.jmeter.jmx.model.CsvDataSet;
import io.github.vdaburon.jmeter.jmx.model.DurationAssertion;
import io.github.vdaburon.jmeter.jmx.model.ElementKind;
import io.github.vdaburon.jmeter.jmx.model.HeaderManager;
import io.github.vdaburon.jmeter.jmx.model.HttpDefaults;
import io.github.vdaburon.jmeter.jmx.model.HttpSamplerProxy;
import io.github.vdaburon.jmeter.jmx.model.IfController;
import io.github.vdaburon.jmeter.jmx.model.JmxTestPlan;
import io.github.vdaburon.jmeter.jmx.model.JsonAssertion;
import io.github.vdaburon.jmeter.jmx.model.JsonExtractor;
import io.github.vdaburon.jmeter.jmx.model.Jsr223Element;
import io.github.vdaburon.jmeter.jmx.model.LoopController;
import io.github.vdaburon.jmeter.jmx.model.PlanElement;
import io.github.vdaburon.jmeter.jmx.model.RegexExtractor;
import io.github.vdaburon.jmeter.jmx.model.ResponseAssertion;
import io.github.vdaburon.jmeter.jmx.model.ResultCollector;
import io.github.vdaburon.jmeter.jmx.model.TestAction;
import io.github.vdaburon.jmeter.jmx.model.TestPlan;
import io.github.vdaburon.jmeter.jmx.model.ThreadGroup;
import io.github.vdaburon.jmeter.jmx.model.TransactionController;
import io.github.vdaburon.jmeter.jmx.model.UniformRandomTimer;
import io.github.vdaburon.jmeter.jmx.model.UserDefinedVariables;
import io.github.vdaburon.jmeter.jmx.model.WhileController;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Edit a loaded plan through the element ids : find, enable/disable, remove, add and reorder.
 * The ids are not saved in the file, they are valid until the next parse.
 */
public class TestPlanEditor {

    private static final Logger LOGGER = Logger.getLogger(TestPlanEditor.class.getName());

    private final JmxTestPlan jmxTestPlan;

    public TestPlanEditor(JmxTestPlan jmxTestPlan) {
        this.jmxTestPlan = Objects.requireNonNull(jmxTestPlan, "jmxTestPlan");
    }

    public JmxTestPlan getJmxTestPlan() {
        return jmxTestPlan;
    }

    /**
     * Create an element of this kind with the default values, the values used when a property is absent from a file
     * @param kind the kind
     * @return a new element with a fresh id and no child
     */
    public static PlanElement createElement(ElementKind kind) {
        switch (kind) {
            case TEST_PLAN:
                return new TestPlan();
            case THREAD_GROUP:
            case SETUP_THREAD_GROUP:
            case POST_THREAD_GROUP:
                return new ThreadGroup(kind);
            case HTTP_SAMPLER:
                return new HttpSamplerProxy();
            case JSR223_SAMPLER:
            case JSR223_PRE_PROCESSOR:
            case JSR223_POST_PROCESSOR:
                return new Jsr223Element(kind);
            case HTTP_DEFAULTS:
                return new HttpDefaults();
            case HEADER_MANAGER:
                return new HeaderManager();
            case ARGUMENTS:
                return new UserDefinedVariables();
            case COOKIE_MANAGER:
                return new CookieManager();
            case CACHE_MANAGER:
                return new CacheManager();
            case CSV_DATA_SET:
                return new CsvDataSet();
            case REGEX_EXTRACTOR:
                return new RegexExtractor();
            case JSON_EXTRACTOR:
                return new JsonExtractor();
            case BOUNDARY_EXTRACTOR:
                return new BoundaryExtractor();
            case RESPONSE_ASSERTION:
                return new ResponseAssertion();
            case DURATION_ASSERTION:
                return new DurationAssertion();
            case JSON_ASSERTION:
                return new JsonAssertion();
            case BEANSHELL_ASSERTION:
                return new BeanShellAssertion();
            case LOOP_CONTROLLER:
                return new LoopController();
            case IF_CONTROLLER:
                return new IfController();
            case WHILE_CONTROLLER:
                return new WhileController();
            case TRANSACTION_CONTROLLER:
                return new TransactionController();
            case TEST_ACTION:
                return new TestAction();
            case CONSTANT_TIMER:
                return new ConstantTimer();
            case UNIFORM_RANDOM_TIMER:
                return new UniformRandomTimer();
            case CONSTANT_THROUGHPUT_TIMER:
                return new ConstantThroughputTimer();
            case RESULT_COLLECTOR:
                return new ResultCollector();
            default:
                throw new IllegalArgumentException("No element class for the kind " + kind);
        }
    }

    /**
     * @param id the element id
     * @return the element with this id (the TestPlan included), null if none
     */
    public PlanElement findById(String id) {
        for (PlanElement element : jmxTestPlan.getAllElements()) {
            if (element.getId().equals(id)) {
                return element;
            }
        }
        return null;
    }

    /**
     * @param id the element id
     * @return the parent of the element, null for the TestPlan or an unknown id
     */
    public PlanElement findParent(String id) {
        for (PlanElement element : jmxTestPlan.getAllElements()) {
            for (PlanElement child : element.getChildren()) {
                if (child.getId().equals(id)) {
                    return element;
                }
            }
        }
        return null;
    }

    /**
     * Switch enabled/disabled, the children are kept
     * @return the new enabled state
     * @throws IllegalArgumentException if the id is unknown
     */
    public boolean toggleEnabled(String id) {
        PlanElement element = getExisting(id);
        element.setEnabled(!element.isEnabled());
        LOGGER.fine("toggleEnabled " + element + ", enabled=" + element.isEnabled());
        return element.isEnabled();
    }

    /**
     * Remove the element and its subtree
     * @return the element removed, null if the id is unknown
     * @throws IllegalArgumentException for the TestPlan, the root can't be removed
     */
    public PlanElement removeById(String id) {
        if (jmxTestPlan.getTestPlan().getId().equals(id)) {
            throw new IllegalArgumentException("The TestPlan can't be removed");
        }
        PlanElement parent = findParent(id);
        if (parent == null) {
            return null;
        }
        // by index, equals compares the content and two siblings may be equal
        PlanElement element = parent.getChildren().remove(indexInParent(parent, id));
        LOGGER.fine("removeById " + element + " from " + parent);
        return element;
    }

    /**
     * Append an element at the end of the children of the parent
     * @throws IllegalArgumentException if the parent id is unknown or the element is already in the plan
     */
    public <T extends PlanElement> T addChild(String parentId, T element) {
        PlanElement parent = getExisting(parentId);
        return insertChild(parentId, parent.getChildren().size(), element);
    }

    /**
     * Insert an element in the children of the parent
     * @param index the position, 0 for the first child, the size of the children list for the last
     * @throws IllegalArgumentException if the parent id is unknown or the element is already in the plan
     * @throws IndexOutOfBoundsException if the index is not a position of the children list
     */
    public <T extends PlanElement> T insertChild(String parentId, int index, T element) {
        Objects.requireNonNull(element, "element");
        PlanElement parent = getExisting(parentId);
        if (findById(element.getId()) != null) {
            throw new IllegalArgumentException("The element " + element + " is already in the plan, an element has one parent only");
        }
        parent.getChildren().add(index, element);
        LOGGER.fine("insertChild " + element + " in " + parent + " at " + index);
        return element;
    }

    /**
     * Swap the element with its previous sibling
     * @return false if the element is the first child or has no parent
     */
    public boolean moveUp(String id) {
        return move(id, -1);
    }

    /**
     * Swap the element with its next sibling
     * @return false if the element is the last child or has no parent
     */
    public boolean moveDown(String id) {
        return move(id, 1);
    }

    private boolean move(String id, int offset) {
        PlanElement parent = findParent(id);
        if (parent == null) {
            return false;
        }
        List<PlanElement> listChildren = parent.getChildren();
        int index = indexInParent(parent, id);
        int newIndex = index + offset;
        if (newIndex < 0 || newIndex >= listChildren.size()) {
            return false;
        }
        PlanElement element = listChildren.remove(index);
        listChildren.add(newIndex, element);
        return true;
    }

    private PlanElement getExisting(String id) {
        PlanElement element = findById(id);
        if (element == null) {
            throw new IllegalArgumentException("No element with the id " + id);
        }
        return element;
    }

    private static int indexInParent(PlanElement parent, String id) {
        List<PlanElement> listChildren = parent.getChildren();
        for (int i = 0; i < listChildren.size(); i++) {
            if (listChildren.get(i).getId().equals(id)) {
                return i;
            }
        }
        return -1;
    }
}
