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

import java.util.Objects;

/**
 * A numeric field that JMeter also accepts as an expression, e.g. number of threads <code>${NB_USERS}</code>
 * or <code>${__P(loops,1)}</code>.
 * The value is either an integer or the expression text kept verbatim, the executor resolves the expression.
 */
public final class IntOrExpression {

    private static final String K_VARIABLE_MARKER = "${";

    private final Integer intValue;
    private final String expression;

    private IntOrExpression(Integer intValue, String expression) {
        this.intValue = intValue;
        this.expression = expression;
    }

    public static IntOrExpression of(int value) {
        return new IntOrExpression(value, null);
    }

    public static IntOrExpression ofExpression(String expression) {
        Objects.requireNonNull(expression, "expression");
        return new IntOrExpression(null, expression);
    }

    /**
     * Classify a property text.
     * A text containing <code>${</code> is an expression, never coerced to a number.
     * Otherwise the text is an integer if it parses as one, else it is kept verbatim as an expression.
     * @param text the property text, not null
     * @return the value
     */
    public static IntOrExpression parse(String text) {
        Objects.requireNonNull(text, "text");
        if (text.contains(K_VARIABLE_MARKER)) {
            return ofExpression(text);
        }
        try {
            return of(Integer.parseInt(text.trim()));
        } catch (NumberFormatException ex) {
            return ofExpression(text);
        }
    }

    public boolean isInt() {
        return intValue != null;
    }

    public boolean isExpression() {
        return expression != null;
    }

    /**
     * @return the integer value
     * @throws IllegalStateException if this value is an expression
     */
    public int getInt() {
        if (intValue == null) {
            throw new IllegalStateException("Not an integer value : " + expression);
        }
        return intValue;
    }

    /**
     * @return the expression text, null if this value is an integer
     */
    public String getExpression() {
        return expression;
    }

    /**
     * @param fallback returned when the value is an expression
     * @return the integer value or the fallback
     */
    public int intValueOr(int fallback) {
        return intValue != null ? intValue : fallback;
    }

    /**
     * @return the text to write in the property tag
     */
    public String toPropertyText() {
        return intValue != null ? String.valueOf(intValue) : expression;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        IntOrExpression that = (IntOrExpression) o;
        return Objects.equals(intValue, that.intValue) && Objects.equals(expression, that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(intValue, expression);
    }

    @Override
    public String toString() {
        return toPropertyText();
    }
}
