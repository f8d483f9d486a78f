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
import io.github.vdaburon.jmeter.jmx.model.ElementKind;
import io.github.vdaburon.jmeter.jmx.model.JmxTestPlan;
import io.github.vdaburon.jmeter.jmx.model.PlanElement;
import io.github.vdaburon.jmeter.jmx.model.TestPlan;
import org.apache.commons.lang3.StringUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Read a jmx file into a {@link JmxTestPlan}.
 * <pre>
 * &lt;jmeterTestPlan version="1.2" properties="5.0" jmeter="5.6.3"&gt;
 *   &lt;hashTree&gt;
 *     &lt;TestPlan ...&gt; ... &lt;/TestPlan&gt;
 *     &lt;hashTree&gt;                      children of the TestPlan
 *       &lt;ThreadGroup ...&gt; ... &lt;/ThreadGroup&gt;
 *       &lt;hashTree&gt;                    children of the ThreadGroup
 *         &lt;HTTPSamplerProxy ...&gt; ... &lt;/HTTPSamplerProxy&gt;
 *         &lt;hashTree/&gt;
 *       &lt;/hashTree&gt;
 *     &lt;/hashTree&gt;
 *   &lt;/hashTree&gt;
 * &lt;/jmeterTestPlan&gt;
 * </pre>
 * In a hashTree the element tags and the hashTree tags are counted separately, the i-th element owns the i-th hashTree.
 * An element of unknown kind is dropped with its hashTree, extra tags without their pair are ignored.
 * Both cases are reported in the {@link ParseResult} diagnostics, the parse does not fail.
 * <p>
 * A parser holds no state between calls.
 */
public class JmxParser {

    public static final String K_ROOT = "jmeterTestPlan";
    public static final String K_ATTR_VERSION = "version";
    public static final String K_ATTR_PROPERTIES = "properties";
    public static final String K_ATTR_JMETER = "jmeter";
    private static final String K_PATH_SEPARATOR = "/";
    private static final String K_BOM = "\uFEFF";

    private static final Logger LOGGER = Logger.getLogger(JmxParser.class.getName());

    private final ElementCodecs codecs;

    public JmxParser() {
        this(ElementCodecs.defaults());
    }

    public JmxParser(ElementCodecs codecs) {
        this.codecs = codecs;
    }

    /**
     * @param jmxFileIn the jmx file to read, UTF-8
     * @return the plan and the diagnostics
     * @throws JmxParseException if the file can't be read or is not a JMeter test plan
     */
    public ParseResult parseFile(String jmxFileIn) throws JmxParseException {
        LOGGER.fine("parseFile, param jmxFileIn=<" + jmxFileIn + ">");
        String content;
        try {
            content = new String(Files.readAllBytes(Paths.get(jmxFileIn)), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new JmxParseException("Can't read the file " + jmxFileIn, e);
        }
        return parse(content);
    }

    /**
     * @param jmxContent the content of a jmx file
     * @return the plan and the diagnostics
     * @throws JmxParseException if the content is not well formed xml or not a JMeter test plan
     */
    public ParseResult parse(String jmxContent) throws JmxParseException {
        Document document = parseDocument(StringUtils.removeStart(jmxContent, K_BOM));
        Element root = document.getDocumentElement();
        if (!K_ROOT.equals(root.getTagName())) {
            throw new JmxParseException("Not a JMeter test plan, the root element is " + root.getTagName() + " not " + K_ROOT);
        }

        List<ParseDiagnostic> listDiagnostics = new ArrayList<>();
        JmxTestPlan jmxTestPlan = readRoot(root, listDiagnostics);
        if (root.hasAttribute(K_ATTR_VERSION)) {
            jmxTestPlan.setVersion(root.getAttribute(K_ATTR_VERSION));
        }
        if (root.hasAttribute(K_ATTR_PROPERTIES)) {
            jmxTestPlan.setProperties(root.getAttribute(K_ATTR_PROPERTIES));
        }
        if (root.hasAttribute(K_ATTR_JMETER)) {
            jmxTestPlan.setJmeterVersion(root.getAttribute(K_ATTR_JMETER));
        }

        LOGGER.fine("parse end, nb elements=" + jmxTestPlan.getAllElements().size() + ", nb diagnostics=" + listDiagnostics.size());
        return new ParseResult(jmxTestPlan, listDiagnostics);
    }

    private Document parseDocument(String jmxContent) throws JmxParseException {
        try {
            DocumentBuilderFactory documentFactory = DocumentBuilderFactory.newInstance();
            documentFactory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            documentFactory.setExpandEntityReferences(false);
            DocumentBuilder documentBuilder = documentFactory.newDocumentBuilder();
            documentBuilder.setErrorHandler(new ErrorHandler() {
                @Override
                public void warning(SAXParseException exception) {
                    LOGGER.fine("xml warning line " + exception.getLineNumber() + " : " + exception.getMessage());
                }

                @Override
                public void error(SAXParseException exception) throws SAXException {
                    throw exception;
                }

                @Override
                public void fatalError(SAXParseException exception) throws SAXException {
                    throw exception;
                }
            });
            return documentBuilder.parse(new InputSource(new StringReader(jmxContent)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new JmxParseException("Not a well formed jmx content : " + e.getMessage(), e);
        }
    }

    private JmxTestPlan readRoot(Element root, List<ParseDiagnostic> listDiagnostics) throws JmxParseException {
        List<Element> listRootContainers = JmxProperties.childElements(root, JmxProperties.K_HASH_TREE);
        if (listRootContainers.isEmpty()) {
            LOGGER.fine("no hashTree under " + K_ROOT + ", empty plan");
            return new JmxTestPlan();
        }

        Element rootContainer = listRootContainers.get(0);
        List<Element> listElementTags = elementTags(rootContainer);
        List<Element> listContainerTags = JmxProperties.childElements(rootContainer, JmxProperties.K_HASH_TREE);
        if (listElementTags.isEmpty()) {
            LOGGER.fine("empty root hashTree, empty plan");
            return new JmxTestPlan();
        }

        String testPlanDiscriminator = ElementKind.TEST_PLAN.getTestClass();
        int testPlanIndex = -1;
        for (int i = 0; i < listElementTags.size() && testPlanIndex < 0; i++) {
            if (testPlanDiscriminator.equals(discriminatorOf(listElementTags.get(i)))) {
                testPlanIndex = i;
            }
        }
        if (testPlanIndex < 0) {
            throw new JmxParseException("Not a JMeter test plan, no " + testPlanDiscriminator + " element under " + K_ROOT);
        }
        ElementCodec<? extends PlanElement> codec = codecs.forDiscriminator(testPlanDiscriminator);
        if (codec == null) {
            throw new JmxParseException("No codec registered for " + testPlanDiscriminator);
        }

        Element testPlanTag = listElementTags.get(testPlanIndex);
        TestPlan testPlan = (TestPlan) codec.decode(testPlanTag);
        if (testPlanIndex < listContainerTags.size()) {
            testPlan.getChildren().addAll(reconstruct(listContainerTags.get(testPlanIndex), testPlan.getName(), listDiagnostics));
        } else {
            listDiagnostics.add(new ParseDiagnostic(ParseDiagnostic.Kind.UNPAIRED_ELEMENT, testPlanTag.getTagName(), testPlanDiscriminator,
                    testPlan.getName(), K_ROOT));
        }

        // the root hashTree holds the TestPlan pair only, anything beside it is ignored
        for (int i = 0; i < listElementTags.size(); i++) {
            if (i == testPlanIndex) {
                continue;
            }
            Element eltTag = listElementTags.get(i);
            LOGGER.fine("element " + eltTag.getTagName() + " beside the " + testPlanDiscriminator + " ignored under " + K_ROOT);
            listDiagnostics.add(new ParseDiagnostic(ParseDiagnostic.Kind.UNPAIRED_ELEMENT, eltTag.getTagName(), discriminatorOf(eltTag),
                    eltTag.getAttribute(JmxProperties.K_ATTR_TESTNAME), K_ROOT));
        }
        for (int i = 0; i < listContainerTags.size(); i++) {
            if (i == testPlanIndex) {
                continue;
            }
            LOGGER.fine("hashTree beside the " + testPlanDiscriminator + " pair ignored under " + K_ROOT);
            listDiagnostics.add(new ParseDiagnostic(ParseDiagnostic.Kind.UNPAIRED_CONTAINER, JmxProperties.K_HASH_TREE, null, null, K_ROOT));
        }
        return new JmxTestPlan(testPlan);
    }

    /**
     * Rebuild the children list of a hashTree
     * @param container the hashTree
     * @param parentPath the names of the ancestors, for the diagnostics
     * @param listDiagnostics receives what is not kept
     * @return the elements, in document order, each with its own children
     */
    protected List<PlanElement> reconstruct(Element container, String parentPath, List<ParseDiagnostic> listDiagnostics) {
        List<PlanElement> listChildren = new ArrayList<>();
        List<Element> listElementTags = elementTags(container);
        List<Element> listContainerTags = JmxProperties.childElements(container, JmxProperties.K_HASH_TREE);
        int nbPairs = Math.min(listElementTags.size(), listContainerTags.size());

        for (int i = 0; i < nbPairs; i++) {
            Element eltTag = listElementTags.get(i);
            String discriminator = discriminatorOf(eltTag);
            ElementCodec<? extends PlanElement> codec = codecs.forDiscriminator(discriminator);
            if (codec == null || !codec.accepts(eltTag)) {
                // the element and its hashTree are skipped together, the next pairs keep their index
                String testName = eltTag.getAttribute(JmxProperties.K_ATTR_TESTNAME);
                LOGGER.fine("unknown element " + discriminator + " testname=" + testName + " dropped under " + parentPath);
                listDiagnostics.add(new ParseDiagnostic(ParseDiagnostic.Kind.UNKNOWN_ELEMENT_DROPPED, eltTag.getTagName(), discriminator, testName, parentPath));
                continue;
            }
            PlanElement element = codec.decode(eltTag);
            element.getChildren().addAll(reconstruct(listContainerTags.get(i), parentPath + K_PATH_SEPARATOR + element.getName(), listDiagnostics));
            listChildren.add(element);
        }

        for (int i = nbPairs; i < listElementTags.size(); i++) {
            Element eltTag = listElementTags.get(i);
            LOGGER.fine("element " + eltTag.getTagName() + " without hashTree ignored under " + parentPath);
            listDiagnostics.add(new ParseDiagnostic(ParseDiagnostic.Kind.UNPAIRED_ELEMENT, eltTag.getTagName(), discriminatorOf(eltTag),
                    eltTag.getAttribute(JmxProperties.K_ATTR_TESTNAME), parentPath));
        }
        for (int i = nbPairs; i < listContainerTags.size(); i++) {
            LOGGER.fine("hashTree without element ignored under " + parentPath);
            listDiagnostics.add(new ParseDiagnostic(ParseDiagnostic.Kind.UNPAIRED_CONTAINER, JmxProperties.K_HASH_TREE, null, null, parentPath));
        }
        return listChildren;
    }

    private static List<Element> elementTags(Element container) {
        List<Element> listElementTags = new ArrayList<>();
        for (Element child : JmxProperties.childElements(container)) {
            if (!JmxProperties.K_HASH_TREE.equals(child.getTagName())) {
                listElementTags.add(child);
            }
        }
        return listElementTags;
    }

    /**
     * @return the testclass attribute, the tag name when the tag has no testclass
     */
    static String discriminatorOf(Element eltTag) {
        String testClass = eltTag.getAttribute(JmxProperties.K_ATTR_TESTCLASS);
        return StringUtils.isNotEmpty(testClass) ? testClass : eltTag.getTagName();
    }
}
