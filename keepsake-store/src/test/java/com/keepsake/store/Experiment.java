package com.keepsake.store;

import com.keepsake.array.ArrayData;
import com.keepsake.model.Composite;
import com.keepsake.model.Slot;
import com.keepsake.registry.TypeRegistry;

import java.nio.file.Path;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class Experiment extends Composite {
    public static final Slot<String> NAME = Slot.of("name", "");
    public static final Slot<ArrayData> SAMPLES = Slot.of("samples");
    public static final Slot<Path> SOURCE = Slot.of("source");
    public static final Slot<Object> NOTE = Slot.of("note");
    public static final Slot<Long> RUNS = Slot.of("runs", 0L);
    public static final Slot<ZonedDateTime> STARTED = Slot.of("started");
    public static final Slot<Map<String, Object>> PARAMS = Slot.withFactory("params", owner -> new LinkedHashMap<>());
    public static final Slot<List<Experiment>> TRIALS = Slot.withFactory("trials", owner -> new ArrayList<>());

    static {
        TypeRegistry.global().registerComposite(Experiment.class);
    }

    public Experiment() {
    }

    public Experiment(String name) {
        set(NAME, name);
    }

    public Map<String, Object> getParams() {
        return get(PARAMS);
    }

    public List<Experiment> getTrials() {
        return get(TRIALS);
    }
}
