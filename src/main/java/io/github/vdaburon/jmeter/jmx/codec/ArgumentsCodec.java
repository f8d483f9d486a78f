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

import io.github.vdaburon.jmeter.jmx.model.ElementKind;
import io.github.vdaburon.jmeter.jmx.model.UserDefinedVariables;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * User Defined Variables config element, the collectionProp Arguments.arguments is a direct child of the tag
 */
public class ArgumentsCodec extends AbstractElementCodec<UserDefinedVariables> {

    public ArgumentsCodec() {
        super(ElementKind.ARGUMENTS);
    }

    @Override
    protected UserDefinedVariables newElement() {
        return new UserDefinedVariables();
    }

    @Override
    protected void readProperties(Element node, UserDefinedVariables element) {
        element.getVariables().addAll(readArguments(node));
    }

    @Override
    protected void writeProperties(Document document, Element node, UserDefinedVariables element) {
        writeArguments(document, node, element.getVariables());
    }
}
