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
 * A node of the test plan tree : a sampler, a controller, an assertion ...
 * <p>
 * In the jmx file the children of an element are not nested in the element tag, they are in the
 * <code>hashTree</code> that follows the element tag. In memory the element simply owns its children list,
 * in execution order. An element must be the child of one parent only.
 * <p>
 * The constructor of each subclass sets the default values of the kind, the same values are used when a
 * property is absent from the file.
 * <p>
 * equals and hashCode compare the content of the tree (kind, attributes, fields and children), never the id.
 */
public abstract class PlanElement {

    private final String id;
    private final ElementKind kind;
    private String guiClass;
    private String name;
    private boolean enabled = true;
    private String comment;
    private final List<PlanElement> children = new ArrayList<>();

    protected PlanElement(ElementKind kind) {
        this.id = ElementIds.next();
        this.kind = kind;
        this.guiClass = kind.getGuiClass();
        this.name = kind.getDefaultName();
    }

    /**
     * @return the in memory identity, unique for the running process, not saved in the file
     */
    public String getId() {
        return id;
    }

    public ElementKind getKind() {
        return kind;
    }

    public String getGuiClass() {
        return guiClass;
    }

    public void setGuiClass(String guiClass) {
        this.guiClass = guiClass;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
     * @return false if the element and its subtree are kept in the plan but not executed
     */
    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getComment() {
        return comment;
    }

    public void setComment(String comment) {
        this.comment = comment;
    }

    /**
     * @return the live list of children, modifications change the tree
     */
    public List<PlanElement> getChildren() {
        return children;
    }

    /**
     * Append a child at the end of the children list
     * @param child the element to add, it must not be a child of another element
     * @param <T> the type of the child
     * @return the child added
     */
    public <T extends PlanElement> T addChild(T child) {
        Objects.requireNonNull(child, "child");
        children.add(child);
        return child;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PlanElement that = (PlanElement) o;
        return kind == that.kind
                && enabled == that.enabled
                && Objects.equals(guiClass, that.guiClass)
                && Objects.equals(name, that.name)
                && Objects.equals(comment, that.comment)
                && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, guiClass, name, enabled, comment, children);
    }

    @Override
    public String toString() {
        return kind.getTestClass() + "[" + name + (enabled ? "" : ", disabled") + "]";
    }
}
