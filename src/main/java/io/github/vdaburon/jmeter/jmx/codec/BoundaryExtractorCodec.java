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
import io.github.vdaburon.jmeter.jmx.model.BoundaryExtractor;
import io.github.vdaburon.jmeter.jmx.model.ElementKind;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

public class BoundaryExtractorCodec extends AbstractElementCodec<BoundaryExtractor> {

    public BoundaryExtractorCodec() {
        super(ElementKind.BOUNDARY_EXTRACTOR);
    }

    @Override
    protected BoundaryExtractor newElement() {
        return new BoundaryExtractor();
    }

    @Override
    protected void readProperties(Element node, BoundaryExtractor element) {
        element.setUseHeaders(JmxProperties.getString(node, "BoundaryExtractor.useHeaders").orElse(element.getUseHeaders()));
        element.setRefName(JmxProperties.getString(node, "BoundaryExtractor.refname").orElse(element.getRefName()));
        element.setLeftBoundary(JmxProperties.getString(node, "BoundaryExtractor.lboundary").orElse(element.getLeftBoundary()));
        element.setRightBoundary(JmxProperties.getString(node, "BoundaryExtractor.rboundary").orElse(element.getRightBoundary()));
        element.setDefaultValue(JmxProperties.getString(node, "BoundaryExtractor.default").orElse(element.getDefaultValue()));
        element.setDefaultEmptyValue(JmxProperties.getBool(node, "BoundaryExtractor.default_empty_value", element.isDefaultEmptyValue()));
        JmxProperties.getIntOrExpression(node, "BoundaryExtractor.match_number").ifPresent(element::setMatchNumber);
    }

    @Override
    protected void writeProperties(Document document, Element node, BoundaryExtractor element) {
        JmxProperties.setString(document, node, "BoundaryExtractor.useHeaders", element.getUseHeaders());
        JmxProperties.setString(document, node, "BoundaryExtractor.refname", element.getRefName());
        JmxProperties.setString(document, node, "BoundaryExtractor.lboundary", element.getLeftBoundary());
        JmxProperties.setString(document, node, "BoundaryExtractor.rboundary", element.getRightBoundary());
        JmxProperties.setString(document, node, "BoundaryExtractor.default", element.getDefaultValue());
        JmxProperties.setBool(document, node, "BoundaryExtractor.default_empty_value", element.isDefaultEmptyValue());
        JmxProperties.setIntOrExpression(document, node, "BoundaryExtractor.match_number", element.getMatchNumber());
    }
}
