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
 * The HTTP Request sampler (HTTPSamplerProxy)
 */
public class HttpSamplerProxy extends AbstractHttpElement {

    private String method = "GET";
    private boolean followRedirects = true;
    private boolean autoRedirects;
    private boolean useKeepAlive = true;
    private boolean doMultipartPost;
    private boolean postBodyRaw;
    private String embeddedUrlRe;
    private String implementation;

    public HttpSamplerProxy() {
        super(ElementKind.HTTP_SAMPLER);
        setProtocol("https");
        setPath("/");
    }

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        this.method = method;
    }

    public boolean isFollowRedirects() {
        return followRedirects;
    }

    public void setFollowRedirects(boolean followRedirects) {
        this.followRedirects = followRedirects;
    }

    public boolean isAutoRedirects() {
        return autoRedirects;
    }

    public void setAutoRedirects(boolean autoRedirects) {
        this.autoRedirects = autoRedirects;
    }

    public boolean isUseKeepAlive() {
        return useKeepAlive;
    }

    public void setUseKeepAlive(boolean useKeepAlive) {
        this.useKeepAlive = useKeepAlive;
    }

    public boolean isDoMultipartPost() {
        return doMultipartPost;
    }

    public void setDoMultipartPost(boolean doMultipartPost) {
        this.doMultipartPost = doMultipartPost;
    }

    public boolean isPostBodyRaw() {
        return postBodyRaw;
    }

    public void setPostBodyRaw(boolean postBodyRaw) {
        this.postBodyRaw = postBodyRaw;
    }

    /**
     * @return the raw body, null if the sampler sends parameters instead of a body
     */
    public String getBodyData() {
        if (!postBodyRaw || getArguments().isEmpty()) {
            return null;
        }
        return getArguments().get(0).getValue();
    }

    /**
     * Replace the parameters by a raw body, like the "Body Data" tab of the gui
     * @param body the body to send
     */
    public void setBodyData(String body) {
        getArguments().clear();
        HttpArgument bodyArgument = new HttpArgument("", body, Argument.K_DEFAULT_METADATA, false);
        getArguments().add(bodyArgument);
        postBodyRaw = true;
    }

    /**
     * @return the regular expression of the embedded resources url to download, null when not set
     */
    public String getEmbeddedUrlRe() {
        return embeddedUrlRe;
    }

    public void setEmbeddedUrlRe(String embeddedUrlRe) {
        this.embeddedUrlRe = embeddedUrlRe;
    }

    /**
     * @return the http client implementation (HttpClient4, Java), null for the JMeter default
     */
    public String getImplementation() {
        return implementation;
    }

    public void setImplementation(String implementation) {
        this.implementation = implementation;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        HttpSamplerProxy that = (HttpSamplerProxy) o;
        return followRedirects == that.followRedirects
                && autoRedirects == that.autoRedirects
                && useKeepAlive == that.useKeepAlive
                && doMultipartPost == that.doMultipartPost
                && postBodyRaw == that.postBodyRaw
                && Objects.equals(method, that.method)
                && Objects.equals(embeddedUrlRe, that.embeddedUrlRe)
                && Objects.equals(implementation, that.implementation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), method, followRedirects, autoRedirects, useKeepAlive, doMultipartPost, postBodyRaw,
                embeddedUrlRe, implementation);
    }
}
