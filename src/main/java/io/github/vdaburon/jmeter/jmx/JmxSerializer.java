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

import io.github.vdaburon.jmeter.jmx.codec.ElementCodec;
import io.github.vdaburon.jmeter.jmx.codec.ElementCodecs;
import io.github.vdaburon.jmeter.jmx.model.JmxTestPlan;
import io.github.vdaburon.jmeter.jmx.model.PlanElement;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.BufferedWriter;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Write a {@link JmxTestPlan} in the jmx format : each element tag is followed by the hashTree of its children.
 * The whole plan is written on each call, the output is UTF-8 with an indentation of 2 spaces.
 * The same plan always gives the same text, so parse then serialize of a serialized plan gives it back unchanged.
 */
public class JmxSerializer {

    public static final String K_XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";

    private static final Logger LOGGER = Logger.getLogger(JmxSerializer.class.getName());

    private final ElementCodecs codecs;

    public JmxSerializer() {
        this(ElementCodecs.defaults());
    }

    public JmxSerializer(ElementCodecs codecs) {
        this.codecs = codecs;
    }

    /**
     * @param jmxTestPlan the plan to write
     * @return the jmx content
     * @throws JmxWriteException if the document can't be created or transformed
     * @throws IllegalStateException if an element of the plan has no codec
     */
    public String serialize(JmxTestPlan jmxTestPlan) throws JmxWriteException {
        Document document = toDocument(jmxTestPlan);
        StringWriter writer = new StringWriter();
        try {
            Transformer transformer = createTransformer();
            transformer.transform(new DOMSource(document), new StreamResult(writer));
        } catch (TransformerException e) {
            throw new JmxWriteException("Can't transform the plan to xml : " + e.getMessage(), e);
        }
        // the declaration is written apart, the transformer does not put it on its own line
        return K_XML_DECLARATION + "\n" + writer.toString();
    }

    /**
     * Save the plan in a jmx file, the file is overwritten
     * @param jmxTestPlan the plan to write
     * @param jmxFileOut the file to create
     * @throws JmxWriteException if the xml can't be created or the file can't be written
     */
    public void writeToFile(JmxTestPlan jmxTestPlan, String jmxFileOut) throws JmxWriteException {
        LOGGER.fine("writeToFile, param jmxFileOut=<" + jmxFileOut + ">");
        String content = serialize(jmxTestPlan);
        try (Writer out = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(jmxFileOut), StandardCharsets.UTF_8))) {
            out.write(content);
        } catch (IOException e) {
            throw new JmxWriteException("Can't write the file " + jmxFileOut, e);
        }
    }

    /**
     * Build the DOM of the plan
     * <pre>
     * &lt;jmeterTestPlan version="1.2" properties="5.0" jmeter="5.6.3"&gt;
     *   &lt;hashTree&gt;
     *     &lt;TestPlan ...&gt;
     *     &lt;hashTree&gt;  top level elements &lt;/hashTree&gt;
     *   &lt;/hashTree&gt;
     * &lt;/jmeterTestPlan&gt;
     * </pre>
     */
    public Document toDocument(JmxTestPlan jmxTestPlan) throws JmxWriteException {
        Document document;
        try {
            DocumentBuilderFactory documentFactory = DocumentBuilderFactory.newInstance();
            DocumentBuilder documentBuilder = documentFactory.newDocumentBuilder();
            document = documentBuilder.newDocument();
        } catch (ParserConfigurationException e) {
            throw new JmxWriteException("Can't create a xml document", e);
        }

        Element root = document.createElement(JmxParser.K_ROOT);
        root.setAttribute(JmxParser.K_ATTR_VERSION, jmxTestPlan.getVersion());
        root.setAttribute(JmxParser.K_ATTR_PROPERTIES, jmxTestPlan.getProperties());
        root.setAttribute(JmxParser.K_ATTR_JMETER, jmxTestPlan.getJmeterVersion());
        document.appendChild(root);

        Element eltRootHashTree = JmxProperties.createHashTree(document);
        root.appendChild(eltRootHashTree);
        flatten(document, eltRootHashTree, Collections.<PlanElement>singletonList(jmxTestPlan.getTestPlan()));
        return document;
    }

    private void flatten(Document document, Element container, List<PlanElement> listElements) {
        for (PlanElement element : listElements) {
            ElementCodec<PlanElement> codec = codecs.forKind(element.getKind());
            container.appendChild(codec.encode(document, element));
            Element eltHashTree = JmxProperties.createHashTree(document);
            container.appendChild(eltHashTree);
            flatten(document, eltHashTree, element.getChildren());
        }
    }

    private static Transformer createTransformer() throws TransformerException {
        TransformerFactory transformerFactory = TransformerFactory.newInstance();
        Transformer transformer = transformerFactory.newTransformer();
        transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
        transformer.setOutputProperty(OutputKeys.INDENT, "yes");
        transformer.setOutputProperty(OutputKeys.ENCODING, StandardCharsets.UTF_8.name());
        transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
        return transformer;
    }
}
