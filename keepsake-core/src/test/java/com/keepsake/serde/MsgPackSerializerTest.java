package com.keepsake.serde;

import com.keepsake.array.DType;
import com.keepsake.array.NumericArray;
import com.keepsake.testing.Color;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class MsgPackSerializerTest {

    private MsgPackSerializer serializer;

    @BeforeEach
    public void setUp() {
        serializer = new MsgPackSerializer();
    }

    @Test
    public void testPrimitivesKeepTheirJavaType() {
        assertRoundTrip("Test string");
        assertRoundTrip(123);
        assertRoundTrip(70_000);
        assertRoundTrip(123456789L);
        assertRoundTrip(5L);
        assertRoundTrip((short) 7);
        assertRoundTrip((byte) -3);
        assertRoundTrip(123.45);
        assertRoundTrip(123.45f);
        assertRoundTrip('q');
        assertRoundTrip(true);
        assertRoundTrip(null);
        assertRoundTrip(new BigInteger("123456789012345678901234567890"));
        assertRoundTrip(new BigDecimal("3.14159265358979323846"));
    }

    @Test
    public void testEncodedPrimitives() {
        assertRoundTrip(Path.of("/var/data/file.h5"));
        assertRoundTrip(Color.GREEN);
        assertRoundTrip(UUID.fromString("123e4567-e89b-12d3-a456-426614174000"));
        assertRoundTrip(Instant.parse("2024-01-02T03:04:05.678Z"));
        assertRoundTrip(LocalDate.of(2024, 2, 29));
    }

    @Test
    public void testCollections() {
        assertRoundTrip(Arrays.asList("one", "two", "three"));
        assertRoundTrip(Arrays.asList(1, 2L, 3.0));
        assertRoundTrip(new LinkedHashSet<>(List.of("a", "b")));

        Object set = serializer.deserialize(serializer.serialize(Set.of(1)));
        assertThat(set).isInstanceOf(Set.class);
    }

    @Test
    public void testNestedMaps() {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("list", Arrays.asList(1, 2, 3));
        nested.put("map", Map.of("key", "value"));
        nested.put("empty", Map.of());
        nested.put("bytes", "raw");

        assertRoundTrip(nested);
    }

    @Test
    public void testSetMarkerKeyIsReserved() {
        assertThatThrownBy(() -> serializer.serialize(Map.of(MsgPackSerializer.SET_KEY, List.of(1, 2))))
            .isInstanceOf(SerializationException.class)
            .hasMessageContaining("reserved");

        Object single = serializer.deserialize(serializer.serialize(Map.of("items", List.of(1, 2))));
        assertThat(single).isInstanceOf(Map.class).isEqualTo(Map.of("items", List.of(1, 2)));
    }

    @Test
    public void testBinary() {
        byte[] data = {1, 2, 3, 4, 5};

        assertThat((byte[]) serializer.deserialize(serializer.serialize(data))).containsExactly(data);
    }

    @Test
    public void testNumericArrays() {
        NumericArray matrix = NumericArray.zeros(DType.FLOAT32, 2, 3);
        matrix.set(1.5f, 1, 2);

        assertRoundTrip(matrix);
        assertRoundTrip(NumericArray.ofLongs(1, -2, Long.MAX_VALUE));
        assertRoundTrip(NumericArray.scalar(2.5));
    }

    @Test
    public void testStreams() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        serializer.writeTo(Map.of("k", 1L), out);

        Object decoded = serializer.readFrom(new ByteArrayInputStream(out.toByteArray()));

        assertThat(decoded).isEqualTo(Map.of("k", 1L));
    }

    @Test
    public void testUnstructuredObjectsRejected() {
        assertThatThrownBy(() -> serializer.serialize(new StringBuilder("x")))
            .isInstanceOf(UnsupportedTypeException.class)
            .hasMessageContaining("java.lang.StringBuilder");
    }

    @Test
    public void testTruncatedInputFails() {
        byte[] bytes = serializer.serialize(List.of("a", "b"));

        assertThatThrownBy(() -> serializer.deserialize(Arrays.copyOf(bytes, bytes.length - 1)))
            .isInstanceOf(SerializationException.class);
    }

    private void assertRoundTrip(Object value) {
        Object decoded = serializer.deserialize(serializer.serialize(value));
        assertThat(decoded).isEqualTo(value);
        if (value != null && !(value instanceof Collection) && !(value instanceof Map)) {
            assertThat(decoded).isInstanceOf(value.getClass());
        }
    }
}
