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
import io.github.vdaburon.jmeter.jmx.model.ElementKind;
import io.github.vdaburon.jmeter.jmx.model.HttpSamplerProxy;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * HTTP Request
 * <pre>
 * &lt;HTTPSamplerProxy guiclass="HttpTestSampleGui" testclass="HTTPSamplerProxy" testname="GET /ping" enabled="true"&gt;
 *   &lt;boolProp name="HTTPSampler.postBodyRaw"&gt;false&lt;/boolProp&gt;
 *   &lt;elementProp name="HTTPsampler.Arguments" ...&gt; ... &lt;/elementProp&gt;
 *   &lt;stringProp name="HTTPSampler.domain"&gt;api.example.com&lt;/stringProp&gt;
 *   ...
 *   &lt;stringProp name="HTTPSampler.method"&gt;GET&lt;/stringProp&gt;
 *   &lt;boolProp name="HTTPSampler.follow_redirects"&gt;true&lt;/boolProp&gt;
 *   &lt;boolProp name="HTTPSampler.auto_redirects"&gt;false&lt;/boolProp&gt;
 *   &lt;boolProp name="HTTPSampler.use_keepalive"&gt;true&lt;/boolProp&gt;
 *   &lt;boolProp name="HTTPSampler.DO_MULTIPART_POST"&gt;false&lt;/boolProp&gt;
 *   &lt;stringProp name="HTTPSampler.connect_timeout"&gt;&lt;/stringProp&gt;
 *   &lt;stringProp name="HTTPSampler.response_timeout"&gt;&lt;/stringProp&gt;
 * &lt;/HTTPSamplerProxy&gt;
 * </pre>
 * With postBodyRaw the body is the value of the single argument without name.
 */
public class HttpSamplerCodec extends AbstractHttpCodec<HttpSamplerProxy> {

    public HttpSamplerCodec() {
        super(ElementKind.HTTP_SAMPLER);
    }

    @Override
    protected HttpSamplerProxy newElement() {
        return new HttpSamplerProxy();
    }

    @Override
    protected void readProperties(Element node, HttpSamplerProxy element) {
        super.readProperties(node, element);
        element.setPostBodyRaw(JmxProperties.getBool(node, "HTTPSampler.postBodyRaw", element.isPostBodyRaw()));
        element.setMethod(JmxProperties.getString(node, "HTTPSampler.method").orElse(element.getMethod()));
        element.setFollowRedirects(JmxProperties.getBool(node, "HTTPSampler.follow_redirects", element.isFollowRedirects()));
        element.setAutoRedirects(JmxProperties.getBool(node, "HTTPSampler.auto_redirects", element.isAutoRedirects()));
        element.setUseKeepAlive(JmxProperties.getBool(node, "HTTPSampler.use_keepalive", element.isUseKeepAlive()));
        element.setDoMultipartPost(JmxProperties.getBool(node, "HTTPSampler.DO_MULTIPART_POST", element.isDoMultipartPost()));
        element.setEmbeddedUrlRe(JmxProperties.getString(node, "HTTPSampler.embedded_url_re").orElse(null));
        element.setImplementation(JmxProperties.getString(node, "HTTPSampler.implementation").orElse(null));
    }

    @Override
    protected void writeProperties(Document document, Element node, HttpSamplerProxy element) {
        JmxProperties.setBool(document, node, "HTTPSampler.postBodyRaw", element.isPostBodyRaw());
        writeHttpArguments(document, node, element);
        writeTarget(document, node, element);
        JmxProperties.setString(document, node, "HTTPSampler.method", element.getMethod());
        JmxProperties.setBool(document, node, "HTTPSampler.follow_redirects", element.isFollowRedirects());
        JmxProperties.setBool(document, node, "HTTPSampler.auto_redirects", element.isAutoRedirects());
        JmxProperties.setBool(document, node, "HTTPSampler.use_keepalive", element.isUseKeepAlive());
        JmxProperties.setBool(document, node, "HTTPSampler.DO_MULTIPART_POST", element.isDoMultipartPost());
        JmxProperties.setString(document, node, "HTTPSampler.embedded_url_re", element.getEmbeddedUrlRe());
        JmxProperties.setString(document, node, "HTTPSampler.implementation", element.getImplementation());
        writeTimeouts(document, node, element);
    }
}
