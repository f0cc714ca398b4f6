package com.keepsake.serde;

import com.keepsake.array.ArrayData;
import com.keepsake.array.DType;
import com.keepsake.array.NumericArray;
import com.keepsake.registry.TypeRegistry;
import org.msgpack.core.ExtensionTypeHeader;
import org.msgpack.core.MessageBufferPacker;
import org.msgpack.core.MessageFormat;
import org.msgpack.core.MessagePackException;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessagePacker;
import org.msgpack.core.MessageUnpacker;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * MessagePack encoding of nested structures.
 *
 * <p>Strings, booleans, {@code Integer}, {@code Float}, {@code Double}, byte
 * arrays, lists and maps use the native MessagePack formats. Types MessagePack
 * would otherwise widen or lose are written as extension values so that they
 * decode to the same Java type: {@code Long}, {@code Short}, {@code Byte},
 * {@code BigInteger}, {@code BigDecimal}, {@code Character}, numeric arrays, and
 * other primitives in their {@link PrimitiveCodec} string form. Sets are written
 * as a single-entry map keyed {@value #SET_KEY}.
 */
public class MsgPackSerializer implements Serializer<Object> {
    static final byte EXT_LONG = 1;
    static final byte EXT_SHORT = 2;
    static final byte EXT_BYTE = 3;
    static final byte EXT_BIG_INTEGER = 4;
    static final byte EXT_BIG_DECIMAL = 5;
    static final byte EXT_CHARACTER = 6;
    static final byte EXT_ENCODED_PRIMITIVE = 7;
    static final byte EXT_NUMERIC_ARRAY = 8;

    /**
     * Key of the single-entry map a set is written as.
     */
    public static final String SET_KEY = "__set__";

    private final TypeRegistry registry;
    private final PrimitiveCodec primitives;

    /**
     * Create a serializer decoding primitives against the global registry.
     */
    public MsgPackSerializer() {
        this(TypeRegistry.global());
    }

    /**
     * Create a serializer decoding primitives against a registry.
     *
     * @param registry Registry of primitive types
     */
    public MsgPackSerializer(TypeRegistry registry) {
        this.registry = registry;
        this.primitives = new PrimitiveCodec(registry);
    }

    @Override
    public byte[] serialize(Object obj) {
        try (MessageBufferPacker packer = MessagePack.newDefaultBufferPacker()) {
            pack(obj, packer);
            return packer.toByteArray();
        } catch (IOException | MessagePackException e) {
            throw new SerializationException("Failed to serialize structure", e);
        }
    }

    @Override
    public Object deserialize(byte[] data) {
        try (MessageUnpacker unpacker = MessagePack.newDefaultUnpacker(data)) {
            return unpack(unpacker);
        } catch (IOException | MessagePackException e) {
            throw new SerializationException("Failed to deserialize structure", e);
        }
    }

    /**
     * Pack a structure node.
     *
     * @param obj Node to pack
     * @param packer MessagePack packer
     * @throws IOException If packing fails
     */
    private void pack(Object obj, MessagePacker packer) throws IOException {
        if (obj == null) {
            packer.packNil();
        } else if (obj instanceof String) {
            packer.packString((String) obj);
        } else if (obj instanceof Boolean) {
            packer.packBoolean((Boolean) obj);
        } else if (obj instanceof Integer) {
            packer.packInt((Integer) obj);
        } else if (obj instanceof Double) {
            packer.packDouble((Double) obj);
        } else if (obj instanceof Float) {
            packer.packFloat((Float) obj);
        } else if (obj instanceof Long) {
            packExtension(packer, EXT_LONG, ByteBuffer.allocate(8).putLong((Long) obj).array());
        } else if (obj instanceof Short) {
            packExtension(packer, EXT_SHORT, ByteBuffer.allocate(2).putShort((Short) obj).array());
        } else if (obj instanceof Byte) {
            packExtension(packer, EXT_BYTE, new byte[] {(Byte) obj});
        } else if (obj instanceof BigInteger) {
            packExtension(packer, EXT_BIG_INTEGER, ((BigInteger) obj).toByteArray());
        } else if (obj instanceof BigDecimal) {
            packExtension(packer, EXT_BIG_DECIMAL, obj.toString().getBytes(StandardCharsets.UTF_8));
        } else if (obj instanceof Character) {
            packExtension(packer, EXT_CHARACTER, ByteBuffer.allocate(2).putChar((Character) obj).array());
        } else if (obj instanceof byte[]) {
            packer.packBinaryHeader(((byte[]) obj).length);
            packer.writePayload((byte[]) obj);
        } else if (obj instanceof ArrayData) {
            packExtension(packer, EXT_NUMERIC_ARRAY, encodeArray(((ArrayData) obj).read()));
        } else if (obj instanceof Set) {
            packer.packMapHeader(1);
            packer.packString(SET_KEY);
            packCollection((Set<?>) obj, packer);
        } else if (obj instanceof Collection) {
            packCollection((Collection<?>) obj, packer);
        } else if (obj instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) obj;
            packer.packMapHeader(map.size());
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (SET_KEY.equals(entry.getKey())) {
                    throw new SerializationException("Map key '" + SET_KEY + "' is reserved for encoded sets");
                }
                pack(entry.getKey(), packer);
                pack(entry.getValue(), packer);
            }
        } else if (registry.isPrimitive(obj.getClass())) {
            packExtension(packer, EXT_ENCODED_PRIMITIVE,
                primitives.encode(obj).getBytes(StandardCharsets.UTF_8));
        } else {
            throw new UnsupportedTypeException(obj.getClass(),
                "Cannot encode " + obj.getClass().getName() + " in a nested structure; serialize it first");
        }
    }

    private void packCollection(Collection<?> items, MessagePacker packer) throws IOException {
        packer.packArrayHeader(items.size());
        for (Object item : items) {
            pack(item, packer);
        }
    }

    private static void packExtension(MessagePacker packer, byte type, byte[] payload) throws IOException {
        packer.packExtensionTypeHeader(type, payload.length);
        packer.writePayload(payload);
    }

    /**
     * Unpack one structure node.
     *
     * @param unpacker MessagePack unpacker
     * @return Decoded node
     * @throws IOException If unpacking fails
     */
    private Object unpack(MessageUnpacker unpacker) throws IOException {
        if (!unpacker.hasNext()) {
            throw new SerializationException("Unexpected end of data");
        }
        MessageFormat format = unpacker.getNextFormat();
        switch (format.getValueType()) {
            case NIL:
                unpacker.unpackNil();
                return null;
            case BOOLEAN:
                return unpacker.unpackBoolean();
            case INTEGER: {
                // longs are written as extensions, so plain integers narrow back to int when they fit
                if (format == MessageFormat.UINT64) {
                    BigInteger big = unpacker.unpackBigInteger();
                    return big.bitLength() < 64 ? (Object) big.longValue() : big;
                }
                long value = unpacker.unpackLong();
                return value == (int) value ? (Object) (int) value : (Object) value;
            }
            case FLOAT:
                if (format == MessageFormat.FLOAT32) {
                    return unpacker.unpackFloat();
                }
                return unpacker.unpackDouble();
            case STRING:
                return unpacker.unpackString();
            case BINARY: {
                byte[] binary = new byte[unpacker.unpackBinaryHeader()];
                unpacker.readPayload(binary);
                return binary;
            }
            case ARRAY: {
                int size = unpacker.unpackArrayHeader();
                List<Object> list = new ArrayList<>(size);
                for (int i = 0; i < size; i++) {
                    list.add(unpack(unpacker));
                }
                return list;
            }
            case MAP:
                return unpackMap(unpacker);
            case EXTENSION:
                return unpackExtension(unpacker);
            default:
                throw new SerializationException("Unsupported MessagePack format: " + format);
        }
    }

    private Object unpackMap(MessageUnpacker unpacker) throws IOException {
        int size = unpacker.unpackMapHeader();
        Map<Object, Object> map = new LinkedHashMap<>(Math.max(size * 2, 4));
        for (int i = 0; i < size; i++) {
            Object key = unpack(unpacker);
            Object value = unpack(unpacker);
            if (size == 1 && SET_KEY.equals(key) && value instanceof List) {
                return new LinkedHashSet<>((List<?>) value);
            }
            map.put(key, value);
        }
        return map;
    }

    private Object unpackExtension(MessageUnpacker unpacker) throws IOException {
        ExtensionTypeHeader header = unpacker.unpackExtensionTypeHeader();
        byte[] payload = unpacker.readPayload(header.getLength());
        switch (header.getType()) {
            case EXT_LONG:
                return ByteBuffer.wrap(payload).getLong();
            case EXT_SHORT:
                return ByteBuffer.wrap(payload).getShort();
            case EXT_BYTE:
                return payload[0];
            case EXT_BIG_INTEGER:
                return new BigInteger(payload);
            case EXT_BIG_DECIMAL:
                return new BigDecimal(new String(payload, StandardCharsets.UTF_8));
            case EXT_CHARACTER:
                return ByteBuffer.wrap(payload).getChar();
            case EXT_ENCODED_PRIMITIVE:
                return primitives.decode(new String(payload, StandardCharsets.UTF_8));
            case EXT_NUMERIC_ARRAY:
                return decodeArray(payload);
            default:
                throw new SerializationException("Unsupported MessagePack extension type: " + header.getType());
        }
    }

    /**
     * Array payload: dtype code length, dtype code, rank, extents, then
     * little-endian elements.
     */
    private static byte[] encodeArray(NumericArray array) {
        byte[] code = array.dtype().code().getBytes(StandardCharsets.US_ASCII);
        long[] shape = array.shape();
        byte[] data = array.toByteArray(ByteOrder.LITTLE_ENDIAN);
        ByteBuffer buffer = ByteBuffer.allocate(1 + code.length + 1 + shape.length * 8 + data.length);
        buffer.put((byte) code.length).put(code).put((byte) shape.length);
        for (long extent : shape) {
            buffer.putLong(extent);
        }
        return buffer.put(data).array();
    }

    private static NumericArray decodeArray(byte[] payload) {
        ByteBuffer buffer = ByteBuffer.wrap(payload);
        byte[] code = new byte[buffer.get()];
        buffer.get(code);
        long[] shape = new long[buffer.get()];
        for (int i = 0; i < shape.length; i++) {
            shape[i] = buffer.getLong();
        }
        byte[] data = new byte[buffer.remaining()];
        buffer.get(data);
        DType dtype = DType.fromCode(new String(code, StandardCharsets.US_ASCII));
        return NumericArray.fromBytes(dtype, shape, data, ByteOrder.LITTLE_ENDIAN);
    }
}
