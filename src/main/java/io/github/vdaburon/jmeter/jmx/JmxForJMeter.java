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

import io.github.vdaburon.jmeter.jmx.analysis.AnalysisResult;
import io.github.vdaburon.jmeter.jmx.analysis.TestPlanAnalyzer;
import io.github.vdaburon.jmeter.jmx.model.JmxTestPlan;
import io.github.vdaburon.jmeter.jmx.model.PlanElement;

import org.apache.commons.lang3.StringUtils;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.MissingOptionException;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.util.List;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * The main class to read a JMeter script, show its tree, analyze it and write it again normalised
 */
public class JmxForJMeter {

    public static final String APPLICATION_VERSION = "1.0";

    // CLI OPTIONS
    public static final String K_JMETER_FILE_IN_OPT = "jmx_in";
    public static final String K_JMETER_FILE_OUT_OPT = "jmx_out";
    public static final String K_PRINT_TREE_OPT = "print_tree";
    public static final String K_ANALYZE_OPT = "analyze";

    private static final Logger LOGGER = Logger.getLogger(JmxForJMeter.class.getName());

    public static void main(String[] args) {
        long lStart = System.currentTimeMillis();
        LOGGER.info("Start main");

        Options options = createOptions();
        Properties parseProperties = null;

        try {
            parseProperties = parseOption(options, args);
        } catch (ParseException ex) {
            helpUsage(options);
            LOGGER.info("main end (exit 1) ERROR");
            System.exit(1);
        }

        if (parseProperties.containsKey("help")) {
            helpUsage(options);
            LOGGER.info("End main OK exit(0)");
            System.exit(0);
        }

        int exitCode = execute(parseProperties);

        long lDurationMs = System.currentTimeMillis() - lStart;
        LOGGER.info("Duration ms : " + lDurationMs);
        LOGGER.info("End main " + (exitCode == 0 ? "OK" : "ERROR") + " exit(" + exitCode + ")");
        System.exit(exitCode);
    }

    /**
     * Run the command with the parameters already parsed
     * @param parseProperties the option values, the keys are the option names
     * @return the exit code, 0 OK, 1 error
     */
    public static int execute(Properties parseProperties) {
        String jmxIn = "";
        String jmxOut = "";
        boolean isPrintTree = true;
        boolean isAnalyze = false;

        String sTmp = parseProperties.getProperty(K_JMETER_FILE_IN_OPT);
        if (sTmp != null) {
            jmxIn = sTmp;
        }

        sTmp = parseProperties.getProperty(K_JMETER_FILE_OUT_OPT);
        if (sTmp != null) {
            jmxOut = sTmp;
        }

        sTmp = parseProperties.getProperty(K_PRINT_TREE_OPT);
        if (sTmp != null) {
            isPrintTree = Boolean.parseBoolean(sTmp);
        }

        sTmp = parseProperties.getProperty(K_ANALYZE_OPT);
        if (sTmp != null) {
            isAnalyze = Boolean.parseBoolean(sTmp);
        }

        LOGGER.info("************* PARAMETERS ***************");
        LOGGER.info(K_JMETER_FILE_IN_OPT + ", jmxIn=" + jmxIn);
        LOGGER.info(K_JMETER_FILE_OUT_OPT + ", jmxOut=" + jmxOut);
        LOGGER.info(K_PRINT_TREE_OPT + ", isPrintTree=" + isPrintTree);
        LOGGER.info(K_ANALYZE_OPT + ", isAnalyze=" + isAnalyze);
        LOGGER.info("***************************************");

        if (jmxIn.isEmpty()) {
            LOGGER.severe("Parameter " + K_JMETER_FILE_IN_OPT + " is mandatory");
            return 1;
        }

        try {
            processJmx(jmxIn, jmxOut, isPrintTree, isAnalyze);
            return 0;
        } catch (JmxParseException | JmxWriteException | IllegalStateException e) {
            LOGGER.severe(e.toString());
            return 1;
        }
    }

    /**
     * Read the jmx file, log the diagnostics then the tree and the analysis if asked, write the normalised plan if an output file is given
     */
    public static JmxTestPlan processJmx(String jmxIn, String jmxOut, boolean isPrintTree, boolean isAnalyze) throws JmxParseException, JmxWriteException {
        LOGGER.info("Version=" + APPLICATION_VERSION);
        LOGGER.info("************ Start of JMX file reading **");
        ParseResult parseResult = new JmxParser().parseFile(jmxIn);
        JmxTestPlan jmxTestPlan = parseResult.getTestPlan();
        LOGGER.info("************ End of JMX file reading, nb elements=" + jmxTestPlan.getAllElements().size() + " **");

        for (ParseDiagnostic diagnostic : parseResult.getDiagnostics()) {
            LOGGER.warning(diagnostic.getMessage());
        }

        if (isPrintTree) {
            LOGGER.info("Test plan tree :\n" + treeToString(jmxTestPlan));
        }

        if (isAnalyze) {
            TestPlanAnalyzer analyzer = new TestPlanAnalyzer();
            LOGGER.info(analyzer.explain(jmxTestPlan));
            List<AnalysisResult> listResults = analyzer.analyze(jmxTestPlan);
            LOGGER.info("Analysis, nb results=" + listResults.size());
            for (AnalysisResult result : listResults) {
                LOGGER.info(result.toString());
            }
        }

        if (!jmxOut.isEmpty()) {
            LOGGER.info("************ Start of JMX file creation **");
            new JmxSerializer().writeToFile(jmxTestPlan, jmxOut);
            LOGGER.info("************ End of JMX file creation, file=" + jmxOut + " **");
        }
        return jmxTestPlan;
    }

    /**
     * @return one line per element, indented by depth, disabled elements marked
     */
    public static String treeToString(JmxTestPlan jmxTestPlan) {
        StringBuilder sb = new StringBuilder();
        appendTree(jmxTestPlan.getTestPlan(), 0, sb);
        return sb.toString();
    }

    private static void appendTree(PlanElement element, int depth, StringBuilder sb) {
        sb.append(StringUtils.repeat("  ", depth))
                .append(element.getName())
                .append(" [").append(element.getKind().getTestClass()).append("]");
        if (!element.isEnabled()) {
            sb.append(" (disabled)");
        }
        sb.append("\n");
        for (PlanElement child : element.getChildren()) {
            appendTree(child, depth + 1, sb);
        }
    }

    private static Options createOptions() {
        Options options = new Options();

        Option helpOpt = Option.builder("help").hasArg(false).desc("Help and show parameters").build();
        options.addOption(helpOpt);

        Option jmeterFileInOpt = Option.builder(K_JMETER_FILE_IN_OPT).argName(K_JMETER_FILE_IN_OPT).hasArg(true)
                .required(true).desc("JMeter file to read (e.g : script.jmx)").build();
        options.addOption(jmeterFileInOpt);

        Option jmeterFileOutOpt = Option.builder(K_JMETER_FILE_OUT_OPT).argName(K_JMETER_FILE_OUT_OPT).hasArg(true)
                .required(false).desc("Optional, JMeter file to write with the plan read (e.g : script_out.jmx)").build();
        options.addOption(jmeterFileOutOpt);

        Option printTreeOpt = Option.builder(K_PRINT_TREE_OPT).argName(K_PRINT_TREE_OPT).hasArg(true)
                .required(false).desc("Optional boolean, show the tree of the test plan (default true)").build();
        options.addOption(printTreeOpt);

        Option analyzeOpt = Option.builder(K_ANALYZE_OPT).argName(K_ANALYZE_OPT).hasArg(true)
                .required(false).desc("Optional boolean, analyze the test plan and show the findings (default false)").build();
        options.addOption(analyzeOpt);

        return options;
    }

    private static Properties parseOption(Options optionsP, String[] args)
            throws ParseException, MissingOptionException {
        Properties properties = new Properties();

        // help alone, the required options are not checked
        for (String arg : args) {
            if ("-help".equals(arg)) {
                properties.setProperty("help", "help value");
                return properties;
            }
        }

        CommandLineParser parser = new DefaultParser();
        // parse the command line arguments
        CommandLine line = parser.parse(optionsP, args);

        if (line.hasOption(K_JMETER_FILE_IN_OPT)) {
            properties.setProperty(K_JMETER_FILE_IN_OPT, line.getOptionValue(K_JMETER_FILE_IN_OPT));
        }

        if (line.hasOption(K_JMETER_FILE_OUT_OPT)) {
            properties.setProperty(K_JMETER_FILE_OUT_OPT, line.getOptionValue(K_JMETER_FILE_OUT_OPT));
        }

        if (line.hasOption(K_PRINT_TREE_OPT)) {
            properties.setProperty(K_PRINT_TREE_OPT, line.getOptionValue(K_PRINT_TREE_OPT));
        }

        if (line.hasOption(K_ANALYZE_OPT)) {
            properties.setProperty(K_ANALYZE_OPT, line.getOptionValue(K_ANALYZE_OPT));
        }

        return properties;
    }

    /**
     * Help to command line parameters
     * @param options the command line options declared
     */
    private static void helpUsage(Options options) {
        HelpFormatter formatter = new HelpFormatter();
        String footer = "E.g : java -jar jmx-tree-transcoder-<version>.jar -" + K_JMETER_FILE_IN_OPT + " script.jmx -" + K_JMETER_FILE_OUT_OPT + " script_out.jmx -"
                + K_PRINT_TREE_OPT + " true -" + K_ANALYZE_OPT + " true \n";

        formatter.printHelp(120, JmxForJMeter.class.getName(),
                JmxForJMeter.class.getName(), options, footer, true);
    }
}
