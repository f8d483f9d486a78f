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

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;

public class PlanElementTest {

    @Test
    public void testIdsAreUnique() {
        HttpSamplerProxy first = new HttpSamplerProxy();
        HttpSamplerProxy second = new HttpSamplerProxy();
        Assert.assertNotEquals(first.getId(), second.getId());
    }

    @Test
    public void testEqualsIgnoresId() {
        ThreadGroup first = new ThreadGroup();
        first.addChild(new ConstantTimer());
        ThreadGroup second = new ThreadGroup();
        second.addChild(new ConstantTimer());
        Assert.assertEquals(first, second);
        Assert.assertEquals(first.hashCode(), second.hashCode());

        second.getChildren().get(0).setEnabled(false);
        Assert.assertNotEquals(first, second);
    }

    @Test
    public void testThreadGroupDefaults() {
        ThreadGroup threadGroup = new ThreadGroup();
        Assert.assertEquals(IntOrExpression.of(1), threadGroup.getLoops());
        Assert.assertFalse(threadGroup.isInfinite());
        Assert.assertEquals("Thread Group", threadGroup.getName());
        Assert.assertTrue(threadGroup.isEnabled());
    }

    @Test
    public void testInfiniteLoops() {
        ThreadGroup threadGroup = new ThreadGroup();
        threadGroup.setLoops(IntOrExpression.of(ThreadGroup.K_INFINITE_LOOPS));
        Assert.assertTrue(threadGroup.isInfinite());

        threadGroup.setLoops(IntOrExpression.ofExpression("${LOOPS}"));
        Assert.assertFalse(threadGroup.isInfinite());
        threadGroup.setContinueForever(true);
        Assert.assertTrue(threadGroup.isInfinite());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testThreadGroupOfOtherKind() {
        new ThreadGroup(ElementKind.LOOP_CONTROLLER);
    }

    @Test
    public void testBodyData() {
        HttpSamplerProxy sampler = new HttpSamplerProxy();
        Assert.assertNull(sampler.getBodyData());
        sampler.setBodyData("{\"a\":1}");
        Assert.assertTrue(sampler.isPostBodyRaw());
        Assert.assertEquals("{\"a\":1}", sampler.getBodyData());
        Assert.assertEquals(1, sampler.getArguments().size());
    }

    @Test
    public void testThreadGroupNames() {
        JmxTestPlan jmxTestPlan = new JmxTestPlan();
        ThreadGroup users = jmxTestPlan.getTestPlan().addChild(new ThreadGroup());
        users.setName("users");
        jmxTestPlan.getTestPlan().addChild(new ResultCollector());
        ThreadGroup setUp = jmxTestPlan.getTestPlan().addChild(new ThreadGroup(ElementKind.SETUP_THREAD_GROUP));
        setUp.setName("setup");
        // nested thread group names are not listed
        users.addChild(new LoopController()).setName("not a group");

        Assert.assertEquals(Arrays.asList("users", "setup"), jmxTestPlan.getThreadGroupNames());
        Assert.assertEquals(5, jmxTestPlan.getAllElements().size());
    }
}
