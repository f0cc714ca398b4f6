package com.keepsake.store;

import com.keepsake.array.NumericArray;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class StoreSessionTest {

    @TempDir
    Path tempDir;

    private Path saveExperiment() {
        Path location = tempDir.resolve("session");
        Experiment experiment = new Experiment("session");
        experiment.set(Experiment.SAMPLES, NumericArray.of(1, 2, 3));
        new StoreMapper().save(experiment, location, OpenMode.CREATE_TRUNCATE);
        return location;
    }

    @Test
    void testLazyLoadYieldsProxies() {
        Path location = saveExperiment();

        try (StoreSession session = StoreSession.open(location, OpenMode.READ_ONLY)) {
            Experiment loaded = session.load(Experiment.class);

            assertThat(loaded.get(Experiment.SAMPLES)).isInstanceOf(ArrayProxy.class);
            assertThat(loaded.get(Experiment.SAMPLES).read()).isEqualTo(NumericArray.of(1, 2, 3));
        }
    }

    @Test
    void testEagerOptionMaterializesArrays() {
        Path location = saveExperiment();
        StoreOptions eager = StoreOptions.builder().lazyArrays(false).build();

        try (StoreSession session = StoreSession.open(location, OpenMode.READ_ONLY, eager)) {
            Experiment loaded = session.load(Experiment.class);

            assertThat(loaded.get(Experiment.SAMPLES)).isInstanceOf(NumericArray.class);
        }
    }

    @Test
    void testReadOnlySessionRejectsWrites() {
        Path location = saveExperiment();

        try (StoreSession session = StoreSession.open(location, OpenMode.READ_ONLY)) {
            ArrayProxy samples = (ArrayProxy) session.load(Experiment.class).get(Experiment.SAMPLES);

            assertThatThrownBy(() -> samples.set(10, 0))
                .isInstanceOf(ReadOnlyStoreException.class);
            assertThatThrownBy(() -> session.save(new Experiment("other")))
                .isInstanceOf(ReadOnlyStoreException.class);
            assertThat(samples.get(0)).isEqualTo(1.0);
        }
    }

    @Test
    void testSaveAndFlushWithinSession() {
        Path location = tempDir.resolve("fresh");

        try (StoreSession session = StoreSession.open(location, OpenMode.READ_WRITE_CREATE)) {
            session.save(List.of("a", "b"));
            session.flush();

            assertThat(new StoreMapper().load(location)).isEqualTo(List.of("a", "b"));
            assertThat(session.root().attributes()).containsEntry(StoreMapper.CONTAINER_KEY, "sequence");
        }
    }

    @Test
    void testPendingChangesPersistOnClose() {
        Path location = saveExperiment();

        try (StoreSession session = StoreSession.open(location, OpenMode.READ_WRITE)) {
            ArrayProxy samples = (ArrayProxy) session.load(Experiment.class).get(Experiment.SAMPLES);
            samples.set(7, 4);
            session.root().setAttribute("name", "renamed");
        }

        Experiment reloaded = (Experiment) new StoreMapper().load(location);
        assertThat(reloaded.get(Experiment.NAME)).isEqualTo("renamed");
        assertThat(reloaded.get(Experiment.SAMPLES).read().toDoubleArray()).containsExactly(1, 2, 3, 0, 7);
    }

    @Test
    void testClosedSessionRejectsUse() {
        Path location = saveExperiment();
        StoreSession session = StoreSession.open(location, OpenMode.READ_WRITE);
        ArrayProxy samples = (ArrayProxy) session.load(Experiment.class).get(Experiment.SAMPLES);

        session.close();

        assertThat(session.isOpen()).isFalse();
        assertThatThrownBy(session::load)
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(samples::read)
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> samples.append(NumericArray.of(1)))
            .isInstanceOf(IllegalStateException.class);
    }
}
