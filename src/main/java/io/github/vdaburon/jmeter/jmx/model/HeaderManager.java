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

public class HeaderManager extends PlanElement {

    private final List<Header> headers = new ArrayList<>();

    public HeaderManager() {
        super(ElementKind.HEADER_MANAGER);
    }

    /**
     * @return the live list of headers
     */
    public List<Header> getHeaders() {
        return headers;
    }

    /**
     * @param headerName the header name, case insensitive
     * @return the value of the first header with this name, null if none
     */
    public String getHeaderValue(String headerName) {
        for (Header header : headers) {
            if (header.getName() != null && header.getName().equalsIgnoreCase(headerName)) {
                return header.getValue();
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        return headers.equals(((HeaderManager) o).headers);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + headers.hashCode();
    }
}
