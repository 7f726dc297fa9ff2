package com.xmlserdes.type;

import com.xmlserdes.binding.XmlBinding;

import java.util.Objects;

/**
 * A nested object converted through its own class binding.
 */
public final class InstanceDescriptor extends TypeDescriptor {

    private final XmlBinding<?> binding;

    private InstanceDescriptor(XmlBinding<?> binding) {
        this.binding = binding;
    }

    public static InstanceDescriptor of(XmlBinding<?> binding) {
        return new InstanceDescriptor(Objects.requireNonNull(binding, "binding"));
    }

    public XmlBinding<?> getBinding() {
        return binding;
    }

    @Override
    public Class<?> getValueType() {
        return binding.getType();
    }

    @Override
    public <R, C> R accept(TypeDescriptorVisitor<R, C> visitor, C context) {
        return visitor.visitInstance(this, context);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof InstanceDescriptor other && binding == other.binding;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(binding);
    }

    @Override
    public String toString() {
        return "Instance(" + binding.getType().getSimpleName() + ")";
    }
}
