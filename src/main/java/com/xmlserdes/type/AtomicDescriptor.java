package com.xmlserdes.type;

import com.xmlserdes.error.TextParseException;
import com.xmlserdes.error.ValueTypeException;
import com.xmlserdes.xml.NodePath;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A scalar stored as element text or attribute value.
 *
 * @param <T> the Java value type
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class AtomicDescriptor<T> extends TypeDescriptor {

    private final ScalarCodec<T> codec;

    private AtomicDescriptor(ScalarCodec<T> codec) {
        this.codec = codec;
    }

    public static <T> AtomicDescriptor<T> of(ScalarCodec<T> codec) {
        return new AtomicDescriptor<>(codec);
    }

    @Override
    public Class<T> getValueType() {
        return codec.getValueType();
    }

    @Override
    public boolean isAtomic() {
        return true;
    }

    @Override
    public <R, C> R accept(TypeDescriptorVisitor<R, C> visitor, C context) {
        return visitor.visitAtomic(this, context);
    }

    /**
     * @throws ValueTypeException if the value is not of the codec's Java type or is rejected by its formatter
     */
    public String format(Object value, NodePath path) {
        if (!codec.getValueType().isInstance(value)) {
            throw new ValueTypeException("expected " + codec.getName() + " but got "
                    + (value == null ? "null" : value.getClass().getSimpleName() + " " + value), path);
        }
        try {
            return codec.format(codec.getValueType().cast(value));
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new ValueTypeException(reason(e), path);
        }
    }

    /**
     * @param trim strip surrounding whitespace first, unless the codec keeps text verbatim
     * @throws TextParseException if the codec rejects the text
     */
    public T parse(String text, NodePath path, boolean trim) {
        String source = text == null ? "" : text;
        if (trim && codec.isTrimmable()) {
            source = source.strip();
        }
        try {
            return codec.parse(source);
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new TextParseException(source, codec.getName(), reason(e), path);
        }
    }

    private static String reason(RuntimeException e) {
        if (e.getMessage() == null) {
            return e.getClass().getSimpleName();
        }
        return e.getMessage();
    }

    @Override
    public String toString() {
        return "Atomic(" + codec.getName() + ")";
    }
}
