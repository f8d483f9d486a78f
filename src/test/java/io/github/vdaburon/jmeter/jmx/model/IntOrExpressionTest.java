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

public class IntOrExpressionTest {

    @Test
    public void testParseInteger() {
        IntOrExpression value = IntOrExpression.parse("42");
        Assert.assertTrue(value.isInt());
        Assert.assertEquals(42, value.getInt());
        Assert.assertEquals("42", value.toPropertyText());
    }

    @Test
    public void testParseNegativeAndPadded() {
        Assert.assertEquals(IntOrExpression.of(-1), IntOrExpression.parse("-1"));
        Assert.assertEquals(IntOrExpression.of(7), IntOrExpression.parse(" 7 "));
    }

    @Test
    public void testVariableIsNeverCoerced() {
        IntOrExpression value = IntOrExpression.parse("${LOOP_COUNT}");
        Assert.assertTrue(value.isExpression());
        Assert.assertEquals("${LOOP_COUNT}", value.getExpression());
        Assert.assertEquals("${LOOP_COUNT}", value.toPropertyText());
        Assert.assertEquals(5, value.intValueOr(5));
    }

    @Test
    public void testFunctionCallKeptVerbatim() {
        IntOrExpression value = IntOrExpression.parse("${__P(threads,10)}");
        Assert.assertEquals(IntOrExpression.ofExpression("${__P(threads,10)}"), value);
    }

    @Test
    public void testNotANumberIsAnExpression() {
        IntOrExpression value = IntOrExpression.parse("12abc");
        Assert.assertFalse(value.isInt());
        Assert.assertEquals("12abc", value.toPropertyText());
    }

    @Test(expected = IllegalStateException.class)
    public void testGetIntOfExpression() {
        IntOrExpression.ofExpression("${N}").getInt();
    }

    @Test
    public void testIntAndSameTextExpressionDiffer() {
        Assert.assertNotEquals(IntOrExpression.of(3), IntOrExpression.ofExpression("3"));
    }
}
