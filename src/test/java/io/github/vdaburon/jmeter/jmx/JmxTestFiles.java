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

import java.io.IOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * Access to the jmx files under src/test/resources/jmx
 */
public final class JmxTestFiles {

    private JmxTestFiles() {
    }

    public static String path(String fileName) {
        URL url = JmxTestFiles.class.getResource("/jmx/" + fileName);
        if (url == null) {
            throw new IllegalArgumentException("No test file " + fileName);
        }
        try {
            return Paths.get(url.toURI()).toString();
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Bad test file url " + url, e);
        }
    }

    public static String content(String fileName) throws IOException {
        return new String(Files.readAllBytes(Paths.get(path(fileName))), StandardCharsets.UTF_8);
    }

    public static ParseResult parse(String fileName) throws IOException, JmxParseException {
        return new JmxParser().parse(content(fileName));
    }
}
