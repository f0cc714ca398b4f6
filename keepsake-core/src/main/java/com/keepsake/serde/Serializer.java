package com.keepsake.serde;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Encodes nested structures to bytes and back.
 * 
 * @param <T> Type of structure handled
 */
public interface Serializer<T> {
    /**
     * Encode a structure to bytes.
     *
     * @param obj The structure to encode
     * @return Encoded bytes
     */
    byte[] serialize(T obj);
    
    /**
     * Decode bytes to a structure.
     *
     * @param data The bytes to decode
     * @return Decoded structure
     */
    T deserialize(byte[] data);

    /**
     * Encode a structure to a stream. The stream is not closed.
     *
     * @param obj The structure to encode
     * @param out Target stream
     * @throws IOException If writing fails
     */
    default void writeTo(T obj, OutputStream out) throws IOException {
        out.write(serialize(obj));
    }

    /**
     * Decode a structure from the remaining bytes of a stream. The stream is not closed.
     *
     * @param in Source stream
     * @return Decoded structure
     * @throws IOException If reading fails
     */
    default T readFrom(InputStream in) throws IOException {
        return deserialize(in.readAllBytes());
    }
}
