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
import io.github.vdaburon.jmeter.jmx.model.PlanElement;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Convert one kind of test element between its jmx tag and its model class.
 * A codec handles the element's own attributes and properties only, the children and the <code>hashTree</code>
 * that follows the tag are the parser's and the serializer's job.
 * @param <T> the model class of the kind
 */
public interface ElementCodec<T extends PlanElement> {

    ElementKind kind();

    /**
     * @return the testclass attribute value this codec decodes
     */
    String discriminator();

    /**
     * Some testclasses are shared by several JMeter elements (ConfigTestElement is the HTTP, Java and TCP defaults),
     * a codec tells here if the tag is the element it knows, usually from the guiclass.
     * @param node the element tag, its discriminator is this codec's one
     * @return true when this codec decodes the tag, false to handle it as an unknown element
     */
    default boolean accepts(Element node) {
        return true;
    }

    /**
     * @param node the element tag
     * @return a new element with a fresh id, absent properties keep the default values of the kind
     */
    T decode(Element node);

    /**
     * @param document the document that owns the created node
     * @param element the element to write
     * @return the element tag, not appended to the document
     */
    Element encode(Document document, T element);
}
