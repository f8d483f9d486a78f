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
import io.github.vdaburon.jmeter.jmx.model.TransactionController;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * <pre>
 * &lt;TransactionController guiclass="TransactionControllerGui" testclass="TransactionController" testname="SC01_P01_HOME" enabled="true"&gt;
 *   &lt;boolProp name="TransactionController.parent"&gt;false&lt;/boolProp&gt;
 *   &lt;boolProp name="TransactionController.includeTimers"&gt;false&lt;/boolProp&gt;
 * &lt;/TransactionController&gt;
 * </pre>
 */
public class TransactionControllerCodec extends AbstractElementCodec<TransactionController> {

    public TransactionControllerCodec() {
        super(ElementKind.TRANSACTION_CONTROLLER);
    }

    @Override
    protected TransactionController newElement() {
        return new TransactionController();
    }

    @Override
    protected void readProperties(Element node, TransactionController element) {
        element.setParent(JmxProperties.getBool(node, "TransactionController.parent", element.isParent()));
        element.setIncludeTimers(JmxProperties.getBool(node, "TransactionController.includeTimers", element.isIncludeTimers()));
    }

    @Override
    protected void writeProperties(Document document, Element node, TransactionController element) {
        JmxProperties.setBool(document, node, "TransactionController.parent", element.isParent());
        JmxProperties.setBool(document, node, "TransactionController.includeTimers", element.isIncludeTimers());
    }
}
