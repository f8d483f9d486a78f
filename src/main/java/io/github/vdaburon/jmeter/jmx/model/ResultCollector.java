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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A listener (View Results Tree, Summary Report, Aggregate Report ...), all share the ResultCollector testclass,
 * the guiclass tells the visualizer.
 */
public class ResultCollector extends PlanElement {

    public static final String K_GUI_VIEW_RESULTS_TREE = "ViewResultsFullVisualizer";
    public static final String K_GUI_SUMMARY_REPORT = "SummaryReport";
    public static final String K_GUI_AGGREGATE_REPORT = "StatVisualizer";

    private boolean errorLogging;
    private String filename = "";
    private final Map<String, String> saveConfig = defaultSaveConfig();

    public ResultCollector() {
        super(ElementKind.RESULT_COLLECTOR);
    }

    /**
     * @return the fields JMeter saves for each sample, in the order of the file
     */
    public static Map<String, String> defaultSaveConfig() {
        Map<String, String> config = new LinkedHashMap<>();
        config.put("time", "true");
        config.put("latency", "true");
        config.put("timestamp", "true");
        config.put("success", "true");
        config.put("label", "true");
        config.put("code", "true");
        config.put("message", "true");
        config.put("threadName", "true");
        config.put("dataType", "true");
        config.put("encoding", "false");
        config.put("assertions", "true");
        config.put("subresults", "true");
        config.put("responseData", "false");
        config.put("samplerData", "false");
        config.put("xml", "false");
        config.put("fieldNames", "true");
        config.put("responseHeaders", "false");
        config.put("requestHeaders", "false");
        config.put("responseDataOnError", "false");
        config.put("saveAssertionResultsFailureMessage", "true");
        config.put("assertionsResultsToSave", "0");
        config.put("bytes", "true");
        config.put("sentBytes", "true");
        config.put("url", "true");
        config.put("threadCounts", "true");
        config.put("idleTime", "true");
        config.put("connectTime", "true");
        return config;
    }

    /**
     * @return true to log the errors only
     */
    public boolean isErrorLogging() {
        return errorLogging;
    }

    public void setErrorLogging(boolean errorLogging) {
        this.errorLogging = errorLogging;
    }

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    /**
     * @return the live map of the sample save configuration
     */
    public Map<String, String> getSaveConfig() {
        return saveConfig;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        ResultCollector that = (ResultCollector) o;
        return errorLogging == that.errorLogging
                && Objects.equals(filename, that.filename)
                && saveConfig.equals(that.saveConfig);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), errorLogging, filename, saveConfig);
    }
}
