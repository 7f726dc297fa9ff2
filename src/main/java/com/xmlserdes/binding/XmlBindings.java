package com.xmlserdes.binding;

import com.xmlserdes.error.ConfigurationException;
import com.xmlserdes.error.XmlSerDesException;
import lombok.experimental.UtilityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide registry of bindings keyed by class.
 * <p>
 * Looking up a class that has not registered yet initializes it first, so a binding held in
 * a static field is found even if the class has not been touched before.
 */
@UtilityClass
public class XmlBindings {
    private static final Logger log = LoggerFactory.getLogger(XmlBindings.class);

    private static final Map<Class<?>, XmlBinding<?>> BINDINGS = new ConcurrentHashMap<>();

    static void register(XmlBinding<?> binding) {
        XmlBinding<?> previous = BINDINGS.put(binding.getType(), binding);
        if (previous != null) {
            log.warn("Replaced XML binding for {}", binding.getType().getName());
        } else {
            log.debug("Registered {}", binding);
        }
    }

    public static Optional<XmlBinding<?>> find(Class<?> type) {
        XmlBinding<?> binding = BINDINGS.get(type);
        if (binding == null) {
            initialize(type);
            binding = BINDINGS.get(type);
        }
        return Optional.ofNullable(binding);
    }

    /**
     * @throws ConfigurationException if the class has no binding
     */
    public static XmlBinding<?> get(Class<?> type) {
        return find(type).orElseThrow(() -> new ConfigurationException("class " + type.getName() + " has no XML binding"));
    }

    public static boolean contains(Class<?> type) {
        return BINDINGS.containsKey(type);
    }

    private static void initialize(Class<?> type) {
        if (type.isPrimitive() || type.isArray()) {
            return;
        }
        try {
            Class.forName(type.getName(), true, type.getClassLoader());
        } catch (ClassNotFoundException e) {
            throw new ConfigurationException("cannot load " + type.getName(), e);
        } catch (ExceptionInInitializerError e) {
            if (e.getCause() instanceof XmlSerDesException cause) {
                throw cause;
            }
            throw new ConfigurationException("initializing " + type.getName() + " failed", e);
        }
    }
}
