package com.keepsake.serde;

/**
 * Base of the errors raised while turning values into nested structures,
 * bytes or stores, and back.
 *
 * @see TypeResolutionException
 * @see UnsupportedTypeException
 */
public class SerializationException extends RuntimeException {
    /**
     * @param message What could not be converted
     */
    public SerializationException(String message) {
        super(message);
    }

    /**
     * @param message What could not be converted
     * @param cause Codec or reflection failure that stopped the conversion
     */
    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
