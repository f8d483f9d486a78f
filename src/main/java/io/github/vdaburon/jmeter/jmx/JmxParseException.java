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

/**
 * The content is not a JMeter test plan : not well formed xml, a root other than jmeterTestPlan or no TestPlan element
 */
public class JmxParseException extends Exception {

    private static final long serialVersionUID = 1L;

    public JmxParseException(String message) {
        super(message);
    }

    public JmxParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
