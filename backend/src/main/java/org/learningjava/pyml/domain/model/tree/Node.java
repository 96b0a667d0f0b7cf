package org.learningjava.pyml.domain.model.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Element of the block tree. A node owns its children; the role is set once
 * by the classifier and the node is read-only afterwards.
 */
public class Node {

    private final String key;
    private final String value;
    private final int sourceLineNumber;
    private final boolean comment;
    private final List<Node> children = new ArrayList<>();
    private Role role = Role.UNCLASSIFIED;

    public Node(String key, String value, int sourceLineNumber) {
        this(key, value, sourceLineNumber, false);
    }

    private Node(String key, String value, int sourceLineNumber, boolean comment) {
        this.key = key;
        this.value = value;
        this.sourceLineNumber = sourceLineNumber;
        this.comment = comment;
    }

    public static Node comment(String text, int sourceLineNumber) {
        return new Node(null, text, sourceLineNumber, true);
    }

    public String key() {
        return key;
    }

    public String value() {
        return value;
    }

    public int sourceLineNumber() {
        return sourceLineNumber;
    }

    public Role role() {
        return role;
    }

    public List<Node> children() {
        return Collections.unmodifiableList(children);
    }

    public boolean isComment() {
        return comment;
    }

    public boolean hasKey() {
        return key != null;
    }

    public boolean hasValue() {
        return value != null && !value.isEmpty();
    }

    /** Whether any child is a statement or entry rather than a kept comment. */
    public boolean hasBody() {
        return children.stream().anyMatch(c -> !c.isComment());
    }

    public void addChild(Node child) {
        children.add(child);
    }

    public void assignRole(Role role) {
        if (this.role != Role.UNCLASSIFIED) {
            throw new IllegalStateException("Node at line " + sourceLineNumber + " already classified as " + this.role);
        }
        this.role = role;
    }

    @Override
    public String toString() {
        return role + "[" + sourceLineNumber + "] " + (key != null ? key + ": " : "") + (value != null ? value : "");
    }
}
