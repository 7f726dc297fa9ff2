package com.xmlserdes.type;

/**
 * Dispatch over the closed set of type descriptors.
 *
 * @param <R> result type
 * @param <C> per-call context passed through unchanged
 */
public interface TypeDescriptorVisitor<R, C> {
    R visitAtomic(AtomicDescriptor<?> atomic, C context);

    R visitList(ListDescriptor list, C context);

    R visitInstance(InstanceDescriptor instance, C context);

    R visitNumericVector(NumericVectorDescriptor vector, C context);

    R visitRecordVector(RecordVectorDescriptor vector, C context);
}
