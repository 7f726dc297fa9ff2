package com.xmlserdes.binding;

import com.xmlserdes.convert.XmlDecoder;
import com.xmlserdes.convert.XmlEncoder;
import com.xmlserdes.error.ConfigurationException;
import com.xmlserdes.error.XmlSerDesException;
import com.xmlserdes.schema.ElementDescriptor;
import com.xmlserdes.schema.FieldAccessor;
import com.xmlserdes.schema.FieldSpec;
import com.xmlserdes.schema.FieldValues;
import com.xmlserdes.schema.SerDesDescriptor;
import com.xmlserdes.schema.TagNames;
import com.xmlserdes.type.InstanceDescriptor;
import com.xmlserdes.type.ScalarCodec;
import com.xmlserdes.type.ScalarCodecs;
import com.xmlserdes.type.TypeDescriptors;
import com.xmlserdes.xml.NodePath;
import org.jdom2.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * XML mapping of one class: its descriptor table, how to read its fields and how to build
 * it back from decoded values.
 * <p>
 * Bindings are created once, normally in a static field of the bound class, and registered
 * in {@link XmlBindings} on creation. Fields are read through the getters given here and
 * objects are built by the factory, so nothing is looked up by name at conversion time:
 * <pre>
 * record Furniture(String type, String name, List&lt;Double&gt; dimensions) {
 *     static final XmlBinding&lt;Furniture&gt; XML = XmlBinding.builder(Furniture.class)
 *             .defaultTag("furniture")
 *             .field("@type", String.class, Furniture::type)
 *             .field("name", String.class, Furniture::name)
 *             .field(FieldSpec.of("dimensions", List.of(Double.class)), Furniture::dimensions)
 *             .factory(v -&gt; new Furniture(v.get("type", String.class), v.get("name", String.class),
 *                     v.getList("dimensions", Double.class)))
 *             .build();
 * }
 * </pre>
 *
 * @param <T> the bound class
 */
public final class XmlBinding<T> {

    private final Class<T> type;
    private final String defaultTag;
    private final SerDesDescriptor descriptor;
    private final FieldAccessor accessor;
    private final Function<FieldValues, ? extends T> factory;

    private XmlBinding(Class<T> type, String defaultTag, SerDesDescriptor descriptor,
                       FieldAccessor accessor, Function<FieldValues, ? extends T> factory) {
        this.type = type;
        this.defaultTag = defaultTag;
        this.descriptor = descriptor;
        this.accessor = accessor;
        this.factory = factory;
    }

    public static <T> Builder<T> builder(Class<T> type) {
        return new Builder<>(type);
    }

    private static String tagOrDerived(Class<?> type, String defaultTag) {
        String tag = defaultTag != null ? defaultTag : TagNames.fromClassName(type.getSimpleName());
        TypeDescriptors.checkTag(tag);
        return tag;
    }

    private static <T> XmlBinding<T> register(XmlBinding<T> binding) {
        XmlBindings.register(binding);
        return binding;
    }

    public Class<T> getType() {
        return type;
    }

    public String getDefaultTag() {
        return defaultTag;
    }

    public SerDesDescriptor getDescriptor() {
        return descriptor;
    }

    public FieldAccessor getAccessor() {
        return accessor;
    }

    /**
     * Whether this binding can build objects, i.e. was given a factory.
     */
    public boolean isDeserializable() {
        return factory != null;
    }

    /**
     * Type descriptor for fields holding this class.
     */
    public InstanceDescriptor asType() {
        return InstanceDescriptor.of(this);
    }

    public Element toXml(T obj) {
        return toXml(obj, defaultTag);
    }

    public Element toXml(T obj, String tag) {
        return XmlEncoder.defaults().encode(asType(), obj, tag);
    }

    public T fromXml(Element element) {
        return fromXml(element, defaultTag);
    }

    /**
     * @param expectedTag tag the element must carry, or {@code null} to accept any
     */
    public T fromXml(Element element, String expectedTag) {
        return type.cast(XmlDecoder.defaults().decode(asType(), element, expectedTag));
    }

    /**
     * Build an object from decoded values. Failures other than {@link XmlSerDesException}
     * are wrapped with the location of the element being decoded.
     *
     * @throws ConfigurationException if this binding has no factory
     */
    public T instantiate(FieldValues values, NodePath path) {
        if (factory == null) {
            throw new ConfigurationException("binding for " + type.getName() + " is serialize-only");
        }
        try {
            return factory.apply(values);
        } catch (XmlSerDesException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new XmlSerDesException("could not construct " + type.getSimpleName() + ": " + e.getMessage(), path, e);
        }
    }

    @Override
    public String toString() {
        return "XmlBinding(" + type.getSimpleName() + ", <" + defaultTag + ">)";
    }

    /**
     * Binding for an ordinary class: explicit getters and an optional factory.
     */
    public static final class Builder<T> {
        private final Class<T> type;
        private final List<FieldSpec> specs = new ArrayList<>();
        private final Map<String, Function<? super T, ?>> getters = new LinkedHashMap<>();
        private final Map<String, Class<?>> valueTypes = new LinkedHashMap<>();
        private String defaultTag;
        private Function<FieldValues, ? extends T> factory;

        private Builder(Class<T> type) {
            this.type = type;
        }

        /**
         * Without a default tag one is derived from the class name ({@code FurnitureItem -> furniture-item}).
         */
        public Builder<T> defaultTag(String tag) {
            this.defaultTag = tag;
            return this;
        }

        /**
         * @param getter reads the field's value from an instance
         */
        public Builder<T> field(FieldSpec spec, Function<? super T, ?> getter) {
            specs.add(spec);
            getters.put(fieldName(spec), getter);
            return this;
        }

        /**
         * Field whose getter returns {@code valueType}. {@link #build()} checks that the field's
         * XML type converts values of that class.
         */
        public <V> Builder<T> field(FieldSpec spec, Class<V> valueType, Function<? super T, ? extends V> getter) {
            field(spec, getter);
            valueTypes.put(fieldName(spec), valueType);
            return this;
        }

        /**
         * Field of a scalar, enum or bound class, named by that class.
         */
        public <V> Builder<T> field(String tag, Class<V> valueType, Function<? super T, ? extends V> getter) {
            return field(FieldSpec.of(tag, valueType), valueType, getter);
        }

        /**
         * Without a factory the binding is serialize-only.
         */
        public Builder<T> factory(Function<FieldValues, ? extends T> factory) {
            this.factory = factory;
            return this;
        }

        /**
         * Resolve the schema and register the binding.
         *
         * @throws ConfigurationException if the schema is malformed
         */
        public XmlBinding<T> build() {
            SerDesDescriptor descriptor = SerDesDescriptor.of(specs);
            checkValueTypes(descriptor);
            return register(new XmlBinding<>(type, tagOrDerived(type, defaultTag), descriptor,
                    FieldAccessor.ofGetters(type, getters), factory));
        }

        private void checkValueTypes(SerDesDescriptor descriptor) {
            List<String> errors = new ArrayList<>();
            for (ElementDescriptor field : descriptor.getDescriptors()) {
                Class<?> declared = valueTypes.get(field.getFieldName());
                if (declared == null) {
                    continue;
                }
                Class<?> boxed = boxed(declared);
                Class<?> converted = field.getType().getValueType();
                if (!converted.isAssignableFrom(boxed) && !boxed.isAssignableFrom(converted)) {
                    errors.add("field \"" + field.getFieldName() + "\" of " + type.getSimpleName() + " is read as "
                            + boxed.getSimpleName() + " but its XML type converts " + converted.getSimpleName());
                }
            }
            if (!errors.isEmpty()) {
                throw new ConfigurationException(errors);
            }
        }

        private static Class<?> boxed(Class<?> type) {
            if (!type.isPrimitive()) {
                return type;
            }
            return ScalarCodecs.forClass(type).<Class<?>>map(ScalarCodec::getValueType).orElse(type);
        }

        private static String fieldName(FieldSpec spec) {
            return spec.getFieldName() != null ? spec.getFieldName() : TagNames.toFieldName(plainTag(spec));
        }

        private static String plainTag(FieldSpec spec) {
            String tag = spec.getTag() == null ? "" : spec.getTag();
            return spec.isAttribute() ? tag.substring(TagNames.ATTRIBUTE_MARKER.length()) : tag;
        }
    }
}
