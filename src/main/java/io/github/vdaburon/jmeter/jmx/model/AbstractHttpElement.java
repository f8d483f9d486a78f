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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The server and path settings shared by the HTTP Request sampler and the HTTP Request Defaults config element.
 */
public abstract class AbstractHttpElement extends PlanElement {

    private String domain = "";
    private IntOrExpression port;
    private String protocol = "";
    private String contentEncoding = "";
    private String path = "";
    private String connectTimeout = "";
    private String responseTimeout = "";
    private final List<HttpArgument> arguments = new ArrayList<>();

    protected AbstractHttpElement(ElementKind kind) {
        super(kind);
    }

    public String getDomain() {
        return domain;
    }

    public void setDomain(String domain) {
        this.domain = domain;
    }

    /**
     * @return the port, null when the scheme default port is used
     */
    public IntOrExpression getPort() {
        return port;
    }

    public void setPort(IntOrExpression port) {
        this.port = port;
    }

    public String getProtocol() {
        return protocol;
    }

    public void setProtocol(String protocol) {
        this.protocol = protocol;
    }

    public String getContentEncoding() {
        return contentEncoding;
    }

    public void setContentEncoding(String contentEncoding) {
        this.contentEncoding = contentEncoding;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(String connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public String getResponseTimeout() {
        return responseTimeout;
    }

    public void setResponseTimeout(String responseTimeout) {
        this.responseTimeout = responseTimeout;
    }

    /**
     * @return the live list of the parameters (or of the single raw body argument)
     */
    public List<HttpArgument> getArguments() {
        return arguments;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        AbstractHttpElement that = (AbstractHttpElement) o;
        return Objects.equals(domain, that.domain)
                && Objects.equals(port, that.port)
                && Objects.equals(protocol, that.protocol)
                && Objects.equals(contentEncoding, that.contentEncoding)
                && Objects.equals(path, that.path)
                && Objects.equals(connectTimeout, that.connectTimeout)
                && Objects.equals(responseTimeout, that.responseTimeout)
                && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), domain, port, protocol, contentEncoding, path, connectTimeout, responseTimeout, arguments);
    }
}
