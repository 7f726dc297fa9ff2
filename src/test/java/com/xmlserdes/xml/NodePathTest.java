package com.xmlserdes.xml;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for NodePath rendering.
 */
class NodePathTest {

    @Test
    void testIndexedStepsAreOneBased() {
        NodePath path = NodePath.of("building").child("rooms").indexed("room", 1).attribute("type");

        assertThat(path).hasToString("/building/rooms/room[2]/@type");
        assertThat(path.getSteps()).containsExactly("building", "rooms", "room[2]", "@type");
    }

    @Test
    void testStepsDoNotModifyParent() {
        NodePath root = NodePath.of("a");
        root.child("b");

        assertThat(root).hasToString("/a");
        assertThat(root).isEqualTo(NodePath.of("a"));
    }

    @Test
    void testEmptyPath() {
        assertThat(NodePath.empty().isEmpty()).isTrue();
        assertThat(NodePath.empty()).hasToString("/");
    }
}
