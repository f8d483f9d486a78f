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
 * A parameter of a HTTP request, or the raw body when the sampler sends a body (postBodyRaw)
 */
public class HttpArgument extends Argument {

    private boolean alwaysEncode;
    private boolean useEquals = true;
    private String contentType;

    public HttpArgument(String name, String value) {
        super(name, value);
    }

    public HttpArgument(String name, String value, String metadata, boolean alwaysEncode) {
        super(name, value, metadata);
        this.alwaysEncode = alwaysEncode;
    }

    public boolean isAlwaysEncode() {
        return alwaysEncode;
    }

    public void setAlwaysEncode(boolean alwaysEncode) {
        this.alwaysEncode = alwaysEncode;
    }

    public boolean isUseEquals() {
        return useEquals;
    }

    public void setUseEquals(boolean useEquals) {
        this.useEquals = useEquals;
    }

    /**
     * @return the content type of the parameter, null when not set
     */
    public String getContentType() {
        return contentType;
    }

    public void setContentType(String contentType) {
        this.contentType = contentType;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        HttpArgument that = (HttpArgument) o;
        return alwaysEncode == that.alwaysEncode && useEquals == that.useEquals && Objects.equals(contentType, that.contentType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), alwaysEncode, useEquals, contentType);
    }
}
