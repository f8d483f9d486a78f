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

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A JSR223 Sampler, PreProcessor or PostProcessor, they share the same script properties.
 */
public class Jsr223Element extends PlanElement {

    private static final Set<ElementKind> K_JSR223_KINDS = EnumSet.of(ElementKind.JSR223_SAMPLER, ElementKind.JSR223_PRE_PROCESSOR, ElementKind.JSR223_POST_PROCESSOR);

    private String scriptLanguage = "groovy";
    private String parameters = "";
    private String filename = "";
    private String cacheKey = "true";
    private String script = "";

    public Jsr223Element(ElementKind kind) {
        super(kind);
        if (!K_JSR223_KINDS.contains(kind)) {
            throw new IllegalArgumentException("Not a JSR223 kind : " + kind);
        }
    }

    public String getScriptLanguage() {
        return scriptLanguage;
    }

    public void setScriptLanguage(String scriptLanguage) {
        this.scriptLanguage = scriptLanguage;
    }

    public String getParameters() {
        return parameters;
    }

    public void setParameters(String parameters) {
        this.parameters = parameters;
    }

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    /**
     * @return "true" to cache the compiled script
     */
    public String getCacheKey() {
        return cacheKey;
    }

    public void setCacheKey(String cacheKey) {
        this.cacheKey = cacheKey;
    }

    public String getScript() {
        return script;
    }

    public void setScript(String script) {
        this.script = script;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        Jsr223Element that = (Jsr223Element) o;
        return Objects.equals(scriptLanguage, that.scriptLanguage)
                && Objects.equals(parameters, that.parameters)
                && Objects.equals(filename, that.filename)
                && Objects.equals(cacheKey, that.cacheKey)
                && Objects.equals(script, that.script);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), scriptLanguage, parameters, filename, cacheKey, script);
    }
}
