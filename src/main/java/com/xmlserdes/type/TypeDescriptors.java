package com.xmlserdes.type;

import com.xmlserdes.binding.XmlBinding;
import com.xmlserdes.binding.XmlBindings;
import com.xmlserdes.error.ConfigurationException;
import com.xmlserdes.vector.DType;
import com.xmlserdes.vector.NumericVector;
import com.xmlserdes.vector.RecordType;
import com.xmlserdes.vector.RecordVector;
import lombok.experimental.UtilityClass;
import org.jdom2.Verifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Resolves terse type specifications into {@link TypeDescriptor}s.
 * <p>
 * Accepted forms:
 * <ul>
 *   <li>a {@link TypeDescriptor}, returned as is</li>
 *   <li>a scalar class ({@code int.class}, {@code String.class}, {@code BigDecimal.class}, an enum, ...)</li>
 *   <li>a {@link DType} or a dtype code such as {@code "u2"} or {@code "float64"}</li>
 *   <li>a {@link ScalarCodec}</li>
 *   <li>{@code List.of(NumericVector.class, dtype[, encoding])}</li>
 *   <li>{@code List.of(RecordVector.class, recordType[, tag[, encoding]])}</li>
 *   <li>{@code List.of(x)} and {@code List.of(x, "item-tag")} for a list of {@code x}</li>
 *   <li>a class with an {@link XmlBinding}</li>
 * </ul>
 */
@UtilityClass
public class TypeDescriptors {
    private static final Logger log = LoggerFactory.getLogger(TypeDescriptors.class);

    /**
     * @throws ConfigurationException if the specification does not name a known type
     */
    public static TypeDescriptor fromTerse(Object spec) {
        TypeDescriptor descriptor = resolve(spec);
        log.debug("Resolved type {} -> {}", spec, descriptor);
        return descriptor;
    }

    private static TypeDescriptor resolve(Object spec) {
        if (spec == null) {
            throw new ConfigurationException("type specification must not be null");
        }
        if (spec instanceof TypeDescriptor descriptor) {
            return descriptor;
        }
        if (spec instanceof ScalarCodec<?> codec) {
            return AtomicDescriptor.of(codec);
        }
        if (spec instanceof DType dtype) {
            return AtomicDescriptor.of(ScalarCodecs.forDType(dtype));
        }
        if (spec instanceof String code) {
            return AtomicDescriptor.of(ScalarCodecs.forDType(dtypeFromCode(code)));
        }
        if (spec instanceof Class<?> type) {
            return fromClass(type);
        }
        if (spec instanceof List<?> list) {
            return fromList(list);
        }
        throw new ConfigurationException("unrecognised type specification: " + spec);
    }

    private static TypeDescriptor fromClass(Class<?> type) {
        Optional<ScalarCodec<?>> codec = ScalarCodecs.forClass(type);
        if (codec.isPresent()) {
            return AtomicDescriptor.of(codec.get());
        }
        if (type == NumericVector.class || type == RecordVector.class) {
            throw new ConfigurationException(type.getSimpleName() + " needs its element type: List.of("
                    + type.getSimpleName() + ".class, ...)");
        }
        return XmlBindings.find(type)
                .map(InstanceDescriptor::of)
                .orElseThrow(() -> new ConfigurationException("class " + type.getName() + " has no XML binding"));
    }

    private static TypeDescriptor fromList(List<?> list) {
        if (list.isEmpty() || list.size() > 4) {
            throw new ConfigurationException("list type specification must have 1 to 4 entries but got " + list);
        }
        Object head = list.get(0);
        if (head == NumericVector.class) {
            return numericVector(list);
        }
        if (head == RecordVector.class) {
            return recordVector(list);
        }
        if (list.size() > 2) {
            throw new ConfigurationException("list type specification must be List.of(type) or List.of(type, tag) but got " + list);
        }
        TypeDescriptor contained = resolve(head);
        if (list.size() == 2) {
            return ListDescriptor.of(contained, tagArgument(list.get(1), list));
        }
        if (contained instanceof InstanceDescriptor instance) {
            return ListDescriptor.of(contained, instance.getBinding().getDefaultTag());
        }
        return ListDescriptor.of(contained);
    }

    private static NumericVectorDescriptor numericVector(List<?> list) {
        if (list.size() < 2 || list.size() > 3) {
            throw new ConfigurationException("numeric vector specification must be List.of(NumericVector.class, dtype[, encoding]) but got " + list);
        }
        DType dtype = dtypeArgument(list.get(1));
        VectorEncoding encoding = list.size() == 3 ? encodingArgument(list.get(2), list) : VectorEncoding.TEXT;
        return NumericVectorDescriptor.of(dtype, encoding);
    }

    private static RecordVectorDescriptor recordVector(List<?> list) {
        if (list.size() < 2 || !(list.get(1) instanceof RecordType recordType)) {
            throw new ConfigurationException("record vector specification must be List.of(RecordVector.class, recordType[, tag[, encoding]]) but got " + list);
        }
        String tag = list.size() >= 3 ? tagArgument(list.get(2), list) : null;
        VectorEncoding encoding = list.size() == 4 ? encodingArgument(list.get(3), list) : VectorEncoding.TEXT;
        return RecordVectorDescriptor.of(recordType, tag, encoding);
    }

    private static DType dtypeArgument(Object value) {
        if (value instanceof DType dtype) {
            return dtype;
        }
        if (value instanceof String code) {
            return dtypeFromCode(code);
        }
        throw new ConfigurationException("expected a dtype but got " + value);
    }

    private static DType dtypeFromCode(String code) {
        try {
            return DType.fromCode(code);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    private static String tagArgument(Object value, List<?> spec) {
        if (!(value instanceof String tag)) {
            throw new ConfigurationException("expected an item tag in " + spec + " but got " + value);
        }
        checkTag(tag);
        return tag;
    }

    private static VectorEncoding encodingArgument(Object value, List<?> spec) {
        if (!(value instanceof VectorEncoding encoding)) {
            throw new ConfigurationException("expected a VectorEncoding in " + spec + " but got " + value);
        }
        return encoding;
    }

    /**
     * @throws ConfigurationException if {@code tag} is not a legal XML element name
     */
    public static void checkTag(String tag) {
        String problem = tag == null ? "tag must not be null" : Verifier.checkElementName(tag);
        if (problem != null) {
            throw new ConfigurationException("illegal tag \"" + tag + "\": " + problem);
        }
    }

    public static AtomicDescriptor<?> atomic(Class<?> type) {
        return ScalarCodecs.forClass(type)
                .map(AtomicDescriptor::of)
                .orElseThrow(() -> new ConfigurationException(type.getName() + " is not a scalar type"));
    }

    public static ListDescriptor listOf(Object contained) {
        return (ListDescriptor) fromList(List.of(contained));
    }

    public static ListDescriptor listOf(Object contained, String itemTag) {
        return (ListDescriptor) fromList(List.of(contained, itemTag));
    }

    public static InstanceDescriptor instance(Class<?> type) {
        return InstanceDescriptor.of(XmlBindings.get(type));
    }

    public static NumericVectorDescriptor vector(DType dtype) {
        return NumericVectorDescriptor.of(dtype);
    }

    public static NumericVectorDescriptor vector(DType dtype, VectorEncoding encoding) {
        return NumericVectorDescriptor.of(dtype, encoding);
    }

    public static RecordVectorDescriptor records(RecordType type, String itemTag) {
        checkTag(itemTag);
        return RecordVectorDescriptor.of(type, itemTag);
    }

    public static RecordVectorDescriptor records(RecordType type, String itemTag, VectorEncoding encoding) {
        checkTag(itemTag);
        return RecordVectorDescriptor.of(type, itemTag, encoding);
    }
}
