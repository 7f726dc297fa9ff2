package com.xmlserdes.type;

import com.xmlserdes.vector.DType;
import com.xmlserdes.vector.NumericVector;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * A {@link NumericVector} held in a single element.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class NumericVectorDescriptor extends TypeDescriptor {

    private final DType dtype;
    private final VectorEncoding encoding;

    private NumericVectorDescriptor(DType dtype, VectorEncoding encoding) {
        this.dtype = Objects.requireNonNull(dtype, "dtype");
        this.encoding = Objects.requireNonNull(encoding, "encoding");
    }

    public static NumericVectorDescriptor of(DType dtype) {
        return new NumericVectorDescriptor(dtype, VectorEncoding.TEXT);
    }

    public static NumericVectorDescriptor of(DType dtype, VectorEncoding encoding) {
        return new NumericVectorDescriptor(dtype, encoding);
    }

    @Override
    public Class<?> getValueType() {
        return NumericVector.class;
    }

    @Override
    public <R, C> R accept(TypeDescriptorVisitor<R, C> visitor, C context) {
        return visitor.visitNumericVector(this, context);
    }

    @Override
    public String toString() {
        return "NumericVector(" + dtype.getCode() + ", " + encoding + ")";
    }
}
