package com.keepsake.serde;

import com.keepsake.registry.TypeRegistry;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * String encoding of primitives that have no native representation in the
 * binary formats, in the form {@code <kind>:<payload>}.
 *
 * <ul>
 *   <li>{@code null} as {@code NoneType:None}</li>
 *   <li>paths as {@code Path:<absolute path>}</li>
 *   <li>enums as {@code Enum:<class>#<constant>}</li>
 *   <li>any other registered primitive as {@code <class name>:<toString()>}, decoded
 *       through the class's {@code valueOf(String)}, {@code parse(CharSequence)},
 *       {@code fromString(String)} or {@code String} constructor</li>
 *   <li>strings that would read as an encoded form as {@code str:<string>}</li>
 * </ul>
 */
public class PrimitiveCodec {
    public static final String NONE = "NoneType:None";

    private static final String NONE_KIND = "NoneType";
    private static final String PATH_KIND = "Path";
    private static final String ENUM_KIND = "Enum";
    private static final String STRING_KIND = "str";

    private static final Pattern ENCODED = Pattern.compile("^([A-Za-z_$][\\w.$]*):(.*)$", Pattern.DOTALL);

    private final TypeRegistry registry;

    /**
     * Create a codec resolving custom kinds against a registry.
     *
     * @param registry Registry whose primitive types may be decoded
     */
    public PrimitiveCodec(TypeRegistry registry) {
        this.registry = registry;
    }

    /**
     * Check whether a value has a native representation in attributes.
     *
     * @param value Primitive value
     * @return True for strings, booleans and fixed-width Java numbers
     */
    public static boolean isNative(Object value) {
        return value instanceof String || value instanceof Boolean ||
               value instanceof Integer || value instanceof Long ||
               value instanceof Short || value instanceof Byte ||
               value instanceof Float || value instanceof Double;
    }

    /**
     * Encode a non-native primitive.
     *
     * @param value Primitive value, may be null
     * @return Encoded form
     */
    public String encode(Object value) {
        if (value == null) {
            return NONE;
        }
        if (value instanceof Path) {
            return PATH_KIND + ":" + ((Path) value).toAbsolutePath();
        }
        if (value instanceof Enum<?>) {
            Enum<?> constant = (Enum<?>) value;
            return ENUM_KIND + ":" + constant.getDeclaringClass().getName() + "#" + constant.name();
        }
        return value.getClass().getName() + ":" + value;
    }

    /**
     * Encode any primitive for storage as an attribute: native values pass
     * through, strings are escaped where needed, everything else is encoded.
     *
     * @param value Primitive value, may be null
     * @return Native value or encoded string
     */
    public Object encodeAttribute(Object value) {
        if (value instanceof String) {
            String text = (String) value;
            return ENCODED.matcher(text).matches() ? STRING_KIND + ":" + text : text;
        }
        if (isNative(value)) {
            return value;
        }
        return encode(value);
    }

    /**
     * Decode an attribute written by {@link #encodeAttribute(Object)}.
     *
     * @param stored Stored attribute value
     * @return Original primitive
     */
    public Object decodeAttribute(Object stored) {
        if (stored instanceof String) {
            return decode((String) stored);
        }
        return stored;
    }

    /**
     * Decode an encoded form. Strings that are not encoded forms are returned unchanged.
     *
     * @param text Encoded text
     * @return Decoded primitive
     * @throws SerializationException If the kind is not a registered primitive type
     */
    public Object decode(String text) {
        Matcher matcher = ENCODED.matcher(text);
        if (!matcher.matches()) {
            return text;
        }
        String kind = matcher.group(1);
        String payload = matcher.group(2);
        switch (kind) {
            case STRING_KIND:
                return payload;
            case NONE_KIND:
                return null;
            case PATH_KIND:
                return Path.of(payload);
            case ENUM_KIND:
                return decodeEnum(payload);
            default:
                return decodeRegistered(kind, payload);
        }
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private Object decodeEnum(String payload) {
        int hash = payload.lastIndexOf('#');
        if (hash < 0) {
            throw new SerializationException("Malformed enum encoding: " + payload);
        }
        Class<?> type = loadPrimitiveType(payload.substring(0, hash));
        if (!type.isEnum()) {
            throw new SerializationException(type.getName() + " is not an enum");
        }
        return Enum.valueOf((Class<Enum>) type, payload.substring(hash + 1));
    }

    private Object decodeRegistered(String kind, String payload) {
        Class<?> type = loadPrimitiveType(kind);
        if (type == Character.class) {
            if (payload.length() != 1) {
                throw new SerializationException("Malformed character encoding: " + payload);
            }
            return payload.charAt(0);
        }
        try {
            for (String factory : new String[] {"valueOf", "parse", "fromString"}) {
                Method method = findFactory(type, factory);
                if (method != null) {
                    return method.invoke(null, payload);
                }
            }
            Constructor<?> constructor = type.getConstructor(String.class);
            return constructor.newInstance(payload);
        } catch (NoSuchMethodException e) {
            throw new SerializationException(
                "Primitive type " + type.getName() + " has no String factory to decode '" + payload + "'", e);
        } catch (InvocationTargetException e) {
            throw new SerializationException(
                "Failed to decode '" + payload + "' as " + type.getName(), e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new SerializationException("Failed to decode '" + payload + "' as " + type.getName(), e);
        }
    }

    private static Method findFactory(Class<?> type, String name) {
        for (Method method : type.getMethods()) {
            if (method.getName().equals(name) &&
                Modifier.isStatic(method.getModifiers()) &&
                method.getParameterCount() == 1 &&
                method.getParameterTypes()[0].isAssignableFrom(String.class) &&
                type.isAssignableFrom(method.getReturnType())) {
                return method;
            }
        }
        return null;
    }

    private Class<?> loadPrimitiveType(String name) {
        Class<?> type;
        try {
            type = Class.forName(name, false, classLoader());
        } catch (ClassNotFoundException e) {
            throw new TypeResolutionException(name);
        }
        if (!registry.isPrimitive(type)) {
            throw new SerializationException("Type " + name + " is not a registered primitive type");
        }
        return type;
    }

    private static ClassLoader classLoader() {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        return loader != null ? loader : PrimitiveCodec.class.getClassLoader();
    }
}
