package com.bankjob.ledger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A node of an OFX document: either a leaf carrying text or an aggregate carrying child elements.
 * Entities describe themselves as trees of these; the writer only deals with serialization.
 */
public final class OfxElement {
    private final String name;
    private final String text;
    private final List<OfxElement> children;

    private OfxElement(String name, String text, List<OfxElement> children) {
        this.name = Objects.requireNonNull(name, "name");
        this.text = text;
        this.children = children;
    }

    /** A leaf element; {@code null} text is written as an empty element. */
    public static OfxElement leaf(String name, String text) {
        return new OfxElement(name, text == null ? "" : text, List.of());
    }

    public static Builder aggregate(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public String getText() {
        return text;
    }

    public List<OfxElement> getChildren() {
        return children;
    }

    public boolean isLeaf() {
        return text != null;
    }

    /** First direct child named {@code childName}, or {@code null}. */
    public OfxElement child(String childName) {
        for (OfxElement child : children) {
            if (child.name.equals(childName)) {
                return child;
            }
        }
        return null;
    }

    /** Text of the first direct child named {@code childName}, or {@code null}. */
    public String childText(String childName) {
        OfxElement child = child(childName);
        return child == null ? null : child.text;
    }

    public List<String> childNames() {
        List<String> names = new ArrayList<>(children.size());
        for (OfxElement child : children) {
            names.add(child.name);
        }
        return names;
    }

    public static final class Builder {
        private final String name;
        private final List<OfxElement> children = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder leaf(String childName, String childText) {
            children.add(OfxElement.leaf(childName, childText));
            return this;
        }

        /** Adds a leaf only when {@code childText} is not null. */
        public Builder optionalLeaf(String childName, String childText) {
            if (childText != null) {
                children.add(OfxElement.leaf(childName, childText));
            }
            return this;
        }

        public Builder child(OfxElement child) {
            if (child != null) {
                children.add(child);
            }
            return this;
        }

        public OfxElement build() {
            return new OfxElement(name, null, List.copyOf(children));
        }
    }
}
