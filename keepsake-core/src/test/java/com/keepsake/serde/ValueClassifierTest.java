package com.keepsake.serde;

import com.keepsake.array.NumericArray;
import com.keepsake.model.Composite;
import com.keepsake.registry.DatasetPayload;
import com.keepsake.registry.TypeRegistry;
import com.keepsake.testing.Sample;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ValueClassifierTest {

    private TypeRegistry registry;
    private ValueClassifier classifier;

    static class Token {
    }

    static class Loose extends Composite {
    }

    @BeforeEach
    void setUp() {
        registry = new TypeRegistry();
        registry.registerComposite(Sample.class);
        classifier = new ValueClassifier(registry);
    }

    @Test
    void testCategories() {
        assertThat(classifier.classify(null)).isEqualTo(ValueCategory.PRIMITIVE);
        assertThat(classifier.classify("s")).isEqualTo(ValueCategory.PRIMITIVE);
        assertThat(classifier.classify(3.0f)).isEqualTo(ValueCategory.PRIMITIVE);
        assertThat(classifier.classify(Path.of("p"))).isEqualTo(ValueCategory.PRIMITIVE);
        assertThat(classifier.classify(NumericArray.of(1))).isEqualTo(ValueCategory.DATASET);
        assertThat(classifier.classify(ZonedDateTime.now())).isEqualTo(ValueCategory.DATASET);
        assertThat(classifier.classify(List.of())).isEqualTo(ValueCategory.CONTAINER);
        assertThat(classifier.classify(Set.of())).isEqualTo(ValueCategory.CONTAINER);
        assertThat(classifier.classify(Map.of())).isEqualTo(ValueCategory.CONTAINER);
        assertThat(classifier.classify(new Sample())).isEqualTo(ValueCategory.COMPOSITE);
    }

    @Test
    void testRuntimeRegistrationChangesCategory() {
        assertThatThrownBy(() -> classifier.classify(new Token()))
            .isInstanceOf(UnsupportedTypeException.class)
            .hasMessageContaining(Token.class.getName())
            .satisfies(e -> assertThat(((UnsupportedTypeException) e).getType()).isEqualTo(Token.class));

        registry.registerPrimitive(Token.class);
        assertThat(classifier.classify(new Token())).isEqualTo(ValueCategory.PRIMITIVE);

        registry.removePrimitive(Token.class);
        registry.registerDataset(Token.class,
            token -> new DatasetPayload(NumericArray.of()),
            (data, metadata) -> new Token());
        assertThat(classifier.classify(new Token())).isEqualTo(ValueCategory.DATASET);
    }

    @Test
    void testUnregisteredCompositeIsUnsupported() {
        assertThatThrownBy(() -> classifier.classify(new Loose()))
            .isInstanceOf(UnsupportedTypeException.class)
            .hasMessageContaining("not registered");
    }
}
