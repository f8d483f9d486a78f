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

import java.util.Objects;

/**
 * CSV Data Set Config
 */
public class CsvDataSet extends PlanElement {

    public static final String K_SHARE_MODE_ALL = "shareMode.all";
    public static final String K_SHARE_MODE_GROUP = "shareMode.group";
    public static final String K_SHARE_MODE_THREAD = "shareMode.thread";

    private String filename = "";
    private String fileEncoding = "UTF-8";
    private String variableNames = "";
    private boolean ignoreFirstLine;
    private String delimiter = ",";
    private boolean quotedData;
    private boolean recycle = true;
    private boolean stopThread;
    private String shareMode = K_SHARE_MODE_ALL;

    public CsvDataSet() {
        super(ElementKind.CSV_DATA_SET);
    }

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    public String getFileEncoding() {
        return fileEncoding;
    }

    public void setFileEncoding(String fileEncoding) {
        this.fileEncoding = fileEncoding;
    }

    /**
     * @return the variable names separated by the delimiter, empty to read them from the first line
     */
    public String getVariableNames() {
        return variableNames;
    }

    public void setVariableNames(String variableNames) {
        this.variableNames = variableNames;
    }

    public boolean isIgnoreFirstLine() {
        return ignoreFirstLine;
    }

    public void setIgnoreFirstLine(boolean ignoreFirstLine) {
        this.ignoreFirstLine = ignoreFirstLine;
    }

    public String getDelimiter() {
        return delimiter;
    }

    public void setDelimiter(String delimiter) {
        this.delimiter = delimiter;
    }

    public boolean isQuotedData() {
        return quotedData;
    }

    public void setQuotedData(boolean quotedData) {
        this.quotedData = quotedData;
    }

    public boolean isRecycle() {
        return recycle;
    }

    public void setRecycle(boolean recycle) {
        this.recycle = recycle;
    }

    public boolean isStopThread() {
        return stopThread;
    }

    public void setStopThread(boolean stopThread) {
        this.stopThread = stopThread;
    }

    public String getShareMode() {
        return shareMode;
    }

    public void setShareMode(String shareMode) {
        this.shareMode = shareMode;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        CsvDataSet that = (CsvDataSet) o;
        return ignoreFirstLine == that.ignoreFirstLine
                && quotedData == that.quotedData
                && recycle == that.recycle
                && stopThread == that.stopThread
                && Objects.equals(filename, that.filename)
                && Objects.equals(fileEncoding, that.fileEncoding)
                && Objects.equals(variableNames, that.variableNames)
                && Objects.equals(delimiter, that.delimiter)
                && Objects.equals(shareMode, that.shareMode);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), filename, fileEncoding, variableNames, ignoreFirstLine, delimiter, quotedData, recycle, stopThread, shareMode);
    }
}
