package com.xmlserdes.type;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * Homogeneous list: one grouping element holding one child per item, each child tagged
 * with the contained tag.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class ListDescriptor extends TypeDescriptor {

    private final TypeDescriptor contained;
    /**
     * Item tag, or {@code null} until the list is attached to a field.
     */
    private final String containedTag;

    private ListDescriptor(TypeDescriptor contained, String containedTag) {
        this.contained = Objects.requireNonNull(contained, "contained");
        this.containedTag = containedTag;
    }

    /**
     * List whose item tag is filled in later from the grouping tag.
     */
    public static ListDescriptor of(TypeDescriptor contained) {
        return new ListDescriptor(contained, null);
    }

    public static ListDescriptor of(TypeDescriptor contained, String containedTag) {
        return new ListDescriptor(contained, Objects.requireNonNull(containedTag, "containedTag"));
    }

    public boolean hasContainedTag() {
        return containedTag != null;
    }

    public ListDescriptor withContainedTag(String tag) {
        return new ListDescriptor(contained, tag);
    }

    @Override
    public Class<?> getValueType() {
        return List.class;
    }

    @Override
    public <R, C> R accept(TypeDescriptorVisitor<R, C> visitor, C context) {
        return visitor.visitList(this, context);
    }

    @Override
    public String toString() {
        return "List(" + contained + (containedTag == null ? "" : ", <" + containedTag + ">") + ")";
    }
}
