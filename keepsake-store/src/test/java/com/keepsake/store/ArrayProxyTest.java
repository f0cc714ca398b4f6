package com.keepsake.store;

import com.keepsake.array.DType;
import com.keepsake.array.NumericArray;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ArrayProxyTest {

    @TempDir
    Path tempDir;

    private Path location;
    private HierarchicalStore store;
    private StoreGroup root;

    @BeforeEach
    void setUp() {
        location = tempDir.resolve("arrays");
        store = HierarchicalStore.open(location, OpenMode.CREATE_TRUNCATE);
        root = store.root();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void testMetadata() {
        ArrayProxy array = root.createArray("m", DType.FLOAT32, 4, 3);

        assertThat(array.getName()).isEqualTo("m");
        assertThat(array.dtype()).isEqualTo(DType.FLOAT32);
        assertThat(array.shape()).containsExactly(4L, 3L);
        assertThat(array.ndim()).isEqualTo(2);
        assertThat(array.size()).isEqualTo(12);
        assertThat(array.nbytes()).isEqualTo(48);
        assertThat(array.attributes()).isEmpty();
        assertThat(array.read()).isEqualTo(NumericArray.zeros(DType.FLOAT32, 4, 3));
    }

    @Test
    void testElementAccessConvertsToDtype() {
        ArrayProxy grid = root.createArray("grid", DType.INT32, 2, 3);

        grid.set(5, 1, 2);
        grid.set(2.7, 0, 0);

        assertThat(grid.get(1, 2)).isEqualTo(5);
        assertThat(grid.get(0, 0)).isEqualTo(2);
        assertThat(grid.read().toLongArray()).containsExactly(2, 0, 0, 0, 0, 5);
        assertThatThrownBy(() -> grid.get(1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testLeadingAxisWriteGrowsAndZeroFills() {
        ArrayProxy array = root.createArray("x", NumericArray.of(1, 2, 3));

        array.set(9, 5);

        assertThat(array.shape()).containsExactly(6L);
        assertThat(array.read().toDoubleArray()).containsExactly(1, 2, 3, 0, 0, 9);
    }

    @Test
    void testTrailingAxesCannotGrow() {
        ArrayProxy grid = root.createArray("grid", DType.INT32, 2, 3);

        assertThatThrownBy(() -> grid.set(1, 0, 3))
            .isInstanceOf(StorageShapeException.class)
            .isInstanceOf(UnsupportedOperationException.class)
            .hasMessageContaining("only the leading axis");
        assertThatThrownBy(() -> grid.write(0, NumericArray.zeros(DType.INT32, 1, 4)))
            .isInstanceOf(StorageShapeException.class);
        assertThatThrownBy(() -> grid.append(NumericArray.ofInts(1, 2)))
            .isInstanceOf(StorageShapeException.class);
        assertThat(grid.shape()).containsExactly(2L, 3L);
    }

    @Test
    void testWriteAndAppendBlocks() {
        ArrayProxy grid = root.createArray("grid", DType.INT32, 2, 3);

        grid.write(1, NumericArray.ofInts(7, 8, 9));
        grid.append(NumericArray.ofInts(1, 2, 3, 4, 5, 6).reshape(2, 3));

        assertThat(grid.shape()).containsExactly(4L, 3L);
        assertThat(grid.readRow(1).toLongArray()).containsExactly(7, 8, 9);
        assertThat(grid.readRow(3).toLongArray()).containsExactly(4, 5, 6);
        assertThat(grid.readRow(3).shape()).containsExactly(3L);
        NumericArray tail = grid.read(2, 4);
        assertThat(tail.shape()).containsExactly(2L, 3L);
        assertThat(tail.toLongArray()).containsExactly(1, 2, 3, 4, 5, 6);
    }

    @Test
    void testWritePastTheEndLeavesZeroGap() {
        ArrayProxy array = root.createArray("x", NumericArray.ofLongs(1));

        array.write(3, NumericArray.ofLongs(4, 5));

        assertThat(array.read().toLongArray()).containsExactly(1, 0, 0, 4, 5);
    }

    @Test
    void testResize() {
        ArrayProxy array = root.createArray("x", NumericArray.of(1, 2, 3));

        array.resize(2);
        assertThat(array.read().toDoubleArray()).containsExactly(1, 2);

        array.resize(4);
        assertThat(array.read().toDoubleArray()).containsExactly(1, 2, 0, 0);

        assertThatThrownBy(() -> array.resize(-1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testZeroDimensionalLeaf() {
        ArrayProxy scalar = root.createArray("s", NumericArray.scalar(2.5));

        assertThat(scalar.get()).isEqualTo(2.5);
        scalar.set(3.5);
        assertThat(scalar.get()).isEqualTo(3.5);
        assertThat(scalar.read().shape()).isEmpty();

        assertThatThrownBy(() -> scalar.resize(1))
            .isInstanceOf(StorageShapeException.class)
            .hasMessageContaining("0-dimensional");
        assertThatThrownBy(() -> scalar.append(NumericArray.of(1)))
            .isInstanceOf(StorageShapeException.class);
        assertThatThrownBy(() -> scalar.read(0, 1))
            .isInstanceOf(StorageShapeException.class);
    }

    @Test
    void testReadsBeyondExtentFail() {
        ArrayProxy array = root.createArray("x", NumericArray.of(1, 2, 3));

        assertThatThrownBy(() -> array.get(3))
            .isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> array.read(1, 4))
            .isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> array.readRow(3))
            .isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> array.set(1, -1))
            .isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void testChangesPersistAndReadOnlyRejectsMutation() {
        ArrayProxy array = root.createArray("x", NumericArray.of(1, 2, 3));
        array.append(NumericArray.of(4, 5));
        array.setAttribute("unit", "m");
        store.close();

        store = HierarchicalStore.open(location, OpenMode.READ_ONLY);
        ArrayProxy reopened = store.root().array("x");

        assertThat(reopened.shape()).containsExactly(5L);
        assertThat(reopened.read().toDoubleArray()).containsExactly(1, 2, 3, 4, 5);
        assertThat(reopened.attributes()).containsEntry("unit", "m");
        assertThat(reopened.isWritable()).isFalse();
        assertThatThrownBy(() -> reopened.set(0, 0))
            .isInstanceOf(ReadOnlyStoreException.class);
        assertThatThrownBy(() -> reopened.append(NumericArray.of(6)))
            .isInstanceOf(ReadOnlyStoreException.class);
        assertThatThrownBy(() -> reopened.resize(1))
            .isInstanceOf(ReadOnlyStoreException.class);
        assertThatThrownBy(() -> reopened.setAttribute("unit", "km"))
            .isInstanceOf(ReadOnlyStoreException.class);
        assertThat(reopened.read().toDoubleArray()).containsExactly(1, 2, 3, 4, 5);
    }

    @Test
    void testByteOrderIsRecordedPerLeaf() throws IOException {
        Path bigEndian = tempDir.resolve("big");
        StoreOptions options = StoreOptions.builder().byteOrder(ByteOrder.BIG_ENDIAN).build();
        try (HierarchicalStore big = HierarchicalStore.open(bigEndian, OpenMode.CREATE_TRUNCATE, options)) {
            big.root().createArray("b", NumericArray.ofLongs(1, 256));
        }

        byte[] raw = Files.readAllBytes(bigEndian.resolve("b.bin"));
        assertThat(raw).hasSize(16);
        assertThat(raw[7]).isEqualTo((byte) 1);

        try (HierarchicalStore reopened = HierarchicalStore.open(bigEndian, OpenMode.READ_WRITE)) {
            ArrayProxy array = reopened.root().array("b");
            assertThat(array.read()).isEqualTo(NumericArray.ofLongs(1, 256));
            array.set(2L, 0);
            assertThat(array.get(0)).isEqualTo(2L);
        }
    }

    @Test
    void testHandlesFailAfterCloseOrRemoval() {
        ArrayProxy kept = root.createArray("kept", NumericArray.of(1));
        ArrayProxy removed = root.createArray("removed", NumericArray.of(1));

        root.remove("removed");
        assertThatThrownBy(() -> removed.get(0))
            .isInstanceOf(IllegalStateException.class);

        store.close();
        assertThatThrownBy(() -> kept.get(0))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(kept::read)
            .isInstanceOf(IllegalStateException.class);
    }
}
