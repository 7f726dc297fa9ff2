package com.xmlserdes.xml;

import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;

/**
 * Location of a node within an XML tree, rendered as a simple xpath
 * such as {@code /building/rooms/room[2]/@type}.
 * Immutable; every step method returns a new path.
 */
@EqualsAndHashCode
public final class NodePath {
    private static final NodePath EMPTY = new NodePath(List.of());

    private final List<String> steps;

    private NodePath(List<String> steps) {
        this.steps = steps;
    }

    public static NodePath empty() {
        return EMPTY;
    }

    public static NodePath of(String rootTag) {
        return EMPTY.child(rootTag);
    }

    public NodePath child(String tag) {
        List<String> next = new ArrayList<>(steps.size() + 1);
        next.addAll(steps);
        next.add(tag);
        return new NodePath(List.copyOf(next));
    }

    /**
     * Step into the {@code index}-th (0-based) repeated child; rendered 1-based as xpath does.
     */
    public NodePath indexed(String tag, int index) {
        return child(tag + "[" + (index + 1) + "]");
    }

    public NodePath attribute(String name) {
        return child("@" + name);
    }

    public List<String> getSteps() {
        return steps;
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    @Override
    public String toString() {
        return "/" + String.join("/", steps);
    }
}
