package com.keepsake.registry;

import com.keepsake.array.ArrayData;
import com.keepsake.array.NumericArray;
import com.keepsake.array.TimestampIndex;
import com.keepsake.model.Composite;
import com.keepsake.serde.TypeResolutionException;
import com.keepsake.testing.Color;
import com.keepsake.testing.Sample;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TypeRegistryTest {

    private static final AtomicBoolean GUARD_INITIALIZED = new AtomicBoolean();

    private TypeRegistry registry;

    static class InitGuard {
        static {
            GUARD_INITIALIZED.set(true);
        }
    }

    @BeforeEach
    void setUp() {
        registry = new TypeRegistry();
    }

    static class Meters {
        final double value;

        Meters(double value) {
            this.value = value;
        }
    }

    static class Unregistered extends Composite {
    }

    static class Other extends Composite {
    }

    @Test
    void testBuiltinPrimitives() {
        assertThat(registry.isPrimitive(String.class)).isTrue();
        assertThat(registry.isPrimitive(Integer.class)).isTrue();
        assertThat(registry.isPrimitive(BigDecimal.class)).isTrue();
        assertThat(registry.isPrimitive(Path.of("x").getClass())).isTrue();
        assertThat(registry.isPrimitive(Color.class)).isTrue();
        assertThat(registry.isPrimitive(UUID.class)).isTrue();
        assertThat(registry.isPrimitive(Object.class)).isFalse();
    }

    @Test
    void testBuiltinDatasets() {
        assertThat(registry.isDataset(NumericArray.class)).isTrue();
        assertThat(registry.isDataset(ArrayData.class)).isTrue();
        assertThat(registry.isDataset(ZonedDateTime.class)).isTrue();
        assertThat(registry.isDataset(TimestampIndex.class)).isTrue();
        assertThat(registry.datasetFor(NumericArray.class))
            .get()
            .extracting(DatasetType::getName)
            .isEqualTo(NumericArray.class.getName());
    }

    @Test
    void testPrimitiveRegistrationIsIdempotent() {
        registry.registerPrimitive(Meters.class);
        registry.registerPrimitive(Meters.class);

        assertThat(registry.isPrimitive(Meters.class)).isTrue();

        registry.removePrimitive(Meters.class);
        assertThat(registry.isPrimitive(Meters.class)).isFalse();

        // removing an unregistered type is a no-op
        registry.removePrimitive(Meters.class);
        assertThat(registry.isPrimitive(Meters.class)).isFalse();
    }

    @Test
    void testDatasetRegistrationAndRemoval() {
        registry.registerDataset(Meters.class,
            m -> new DatasetPayload(NumericArray.of(m.value), Map.of("unit", "m")),
            (data, metadata) -> new Meters(data.getDouble(0)));

        assertThat(registry.isDataset(Meters.class)).isTrue();
        assertThat(registry.lookupDataset(Meters.class.getName()).getType()).isEqualTo(Meters.class);

        registry.removeDataset(Meters.class);
        registry.removeDataset(Meters.class);

        assertThat(registry.isDataset(Meters.class)).isFalse();
        assertThatThrownBy(() -> registry.lookupDataset(Meters.class.getName()))
            .isInstanceOf(TypeResolutionException.class);
    }

    @Test
    void testPrimitiveAndDatasetOverlapRejected() {
        registry.registerPrimitive(Meters.class);

        assertThatThrownBy(() -> registry.registerDataset(Meters.class,
            m -> new DatasetPayload(NumericArray.of(m.value)),
            (data, metadata) -> new Meters(data.getDouble(0))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining(Meters.class.getName());

        assertThatThrownBy(() -> registry.registerPrimitive(NumericArray.class))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("dataset");
    }

    @Test
    void testCompositeRegistrationAndLookup() {
        registry.registerComposite(Unregistered.class);

        assertThat(registry.isRegistered(Unregistered.class.getName())).isTrue();
        assertThat(registry.isComposite(Unregistered.class)).isTrue();
        assertThat(registry.lookupComposite(Unregistered.class.getName()).getType())
            .isEqualTo(Unregistered.class);
    }

    @Test
    void testLastDefinitionWins() {
        registry.registerComposite("shared.Name", Unregistered.class);
        registry.registerComposite("shared.Name", Other.class);

        assertThat(registry.lookupComposite("shared.Name").getType()).isEqualTo(Other.class);
        assertThat(registry.isComposite(Unregistered.class)).isFalse();
        assertThat(registry.compositeName(Other.class)).contains("shared.Name");
    }

    @Test
    void testUnknownNameFailsResolution() {
        assertThatThrownBy(() -> registry.lookupComposite("no.such.Type"))
            .isInstanceOf(TypeResolutionException.class)
            .hasMessageContaining("no.such.Type")
            .satisfies(e -> assertThat(((TypeResolutionException) e).getTypeName()).isEqualTo("no.such.Type"));
    }

    @Test
    void testExistingClassThatNeverRegistersStillFails() {
        assertThatThrownBy(() -> registry.lookupComposite(Unregistered.class.getName()))
            .isInstanceOf(TypeResolutionException.class);
    }

    @Test
    void testLookupDoesNotInitializeNonComposites() {
        assertThatThrownBy(() -> registry.lookupComposite(InitGuard.class.getName()))
            .isInstanceOf(TypeResolutionException.class);
        assertThat(GUARD_INITIALIZED).isFalse();
    }

    @Test
    void testGlobalLookupInitializesSelfRegisteringClass() {
        // Sample registers itself from its static initializer
        assertThat(TypeRegistry.global().lookupComposite(Sample.class.getName()).getType())
            .isEqualTo(Sample.class);
    }

    @Test
    void testUnregisterComposite() {
        registry.registerComposite(Unregistered.class);
        registry.unregisterComposite(Unregistered.class.getName());

        assertThat(registry.isRegistered(Unregistered.class.getName())).isFalse();
        assertThat(registry.isComposite(Unregistered.class)).isFalse();
    }
}
