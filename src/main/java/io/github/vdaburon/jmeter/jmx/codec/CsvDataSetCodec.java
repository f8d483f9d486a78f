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
import io.github.vdaburon.jmeter.jmx.model.CsvDataSet;
import io.github.vdaburon.jmeter.jmx.model.ElementKind;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * CSV Data Set Config, a test bean : the property names have no prefix
 */
public class CsvDataSetCodec extends AbstractElementCodec<CsvDataSet> {

    public CsvDataSetCodec() {
        super(ElementKind.CSV_DATA_SET);
    }

    @Override
    protected CsvDataSet newElement() {
        return new CsvDataSet();
    }

    @Override
    protected void readProperties(Element node, CsvDataSet element) {
        element.setDelimiter(JmxProperties.getString(node, "delimiter").orElse(element.getDelimiter()));
        element.setFileEncoding(JmxProperties.getString(node, "fileEncoding").orElse(element.getFileEncoding()));
        element.setFilename(JmxProperties.getString(node, "filename").orElse(element.getFilename()));
        element.setIgnoreFirstLine(JmxProperties.getBool(node, "ignoreFirstLine", element.isIgnoreFirstLine()));
        element.setQuotedData(JmxProperties.getBool(node, "quotedData", element.isQuotedData()));
        element.setRecycle(JmxProperties.getBool(node, "recycle", element.isRecycle()));
        element.setShareMode(JmxProperties.getString(node, "shareMode").orElse(element.getShareMode()));
        element.setStopThread(JmxProperties.getBool(node, "stopThread", element.isStopThread()));
        element.setVariableNames(JmxProperties.getString(node, "variableNames").orElse(element.getVariableNames()));
    }

    @Override
    protected void writeProperties(Document document, Element node, CsvDataSet element) {
        // alphabetical order, the order of the test bean properties in a JMeter file
        JmxProperties.setString(document, node, "delimiter", element.getDelimiter());
        JmxProperties.setString(document, node, "fileEncoding", element.getFileEncoding());
        JmxProperties.setString(document, node, "filename", element.getFilename());
        JmxProperties.setBool(document, node, "ignoreFirstLine", element.isIgnoreFirstLine());
        JmxProperties.setBool(document, node, "quotedData", element.isQuotedData());
        JmxProperties.setBool(document, node, "recycle", element.isRecycle());
        JmxProperties.setString(document, node, "shareMode", element.getShareMode());
        JmxProperties.setBool(document, node, "stopThread", element.isStopThread());
        JmxProperties.setString(document, node, "variableNames", element.getVariableNames());
    }
}
