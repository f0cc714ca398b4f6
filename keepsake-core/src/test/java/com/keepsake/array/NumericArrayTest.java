package com.keepsake.array;

import org.junit.jupiter.api.Test;

import java.nio.ByteOrder;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class NumericArrayTest {

    @Test
    void testShapeAndMetadata() {
        NumericArray array = NumericArray.zeros(DType.INT16, 3, 4);

        assertThat(array.shape()).containsExactly(3L, 4L);
        assertThat(array.ndim()).isEqualTo(2);
        assertThat(array.size()).isEqualTo(12);
        assertThat(array.nbytes()).isEqualTo(24);
        assertThat(array.attributes()).isEmpty();
        assertThat(NumericArray.scalar(1.0).ndim()).isZero();
        assertThat(NumericArray.scalar(1.0).size()).isEqualTo(1);
    }

    @Test
    void testIndexedAccessIsRowMajor() {
        NumericArray array = NumericArray.zeros(DType.FLOAT64, 2, 3);
        array.set(7, 1, 2);

        assertThat(array.getDouble(1, 2)).isEqualTo(7.0);
        assertThat(array.getFlat(5)).isEqualTo(7.0);
        assertThatThrownBy(() -> array.get(2, 0))
            .isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> array.get(0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testValuesConvertToDtype() {
        NumericArray ints = NumericArray.zeros(DType.INT32, 2);
        ints.set(2.9, 0);
        NumericArray bools = NumericArray.zeros(DType.BOOL, 1);
        bools.set(5, 0);
        NumericArray bytes = NumericArray.zeros(DType.UINT8, 1);
        bytes.set(200, 0);

        assertThat(ints.get(0)).isEqualTo(2);
        assertThat(bools.getLong(0)).isEqualTo(1L);
        assertThat(bytes.getLong(0)).isEqualTo(200L);
    }

    @Test
    void testByteOrderConversion() {
        NumericArray array = NumericArray.ofLongs(1, 256);

        byte[] big = array.toByteArray(ByteOrder.BIG_ENDIAN);
        assertThat(big[7]).isEqualTo((byte) 1);

        NumericArray back = NumericArray.fromBytes(DType.INT64, new long[] {2}, big, ByteOrder.BIG_ENDIAN);
        assertThat(back).isEqualTo(array);
    }

    @Test
    void testCopyReshapeAndAstype() {
        NumericArray array = NumericArray.ofInts(1, 2, 3, 4);

        NumericArray copy = array.copy();
        copy.set(9, 0);
        assertThat(array.getLong(0)).isEqualTo(1L);

        NumericArray square = array.reshape(2, 2);
        assertThat(square.getLong(1, 0)).isEqualTo(3L);
        assertThatThrownBy(() -> array.reshape(3))
            .isInstanceOf(IllegalArgumentException.class);

        NumericArray doubles = array.astype(DType.FLOAT64);
        assertThat(doubles.toDoubleArray()).containsExactly(1.0, 2.0, 3.0, 4.0);
        assertThat(array.astype(DType.INT32)).isSameAs(array);
    }

    @Test
    void testEquality() {
        assertThat(NumericArray.of(1, 2)).isEqualTo(NumericArray.of(1, 2));
        assertThat(NumericArray.of(1, 2)).isNotEqualTo(NumericArray.ofLongs(1, 2));
        assertThat(NumericArray.of(1, 2, 3, 4).reshape(2, 2)).isNotEqualTo(NumericArray.of(1, 2, 3, 4));
    }

    @Test
    void testTimestampIndex() {
        TimestampIndex index = new TimestampIndex(new long[] {0L, 1_500_000_000L}, ZoneId.of("UTC"));

        assertThat(index.size()).isEqualTo(2);
        assertThat(index.get(1).toInstant().toEpochMilli()).isEqualTo(1500L);
        assertThat(TimestampIndex.fromEpochNanos(-1).getNano()).isEqualTo(999_999_999);
    }
}
