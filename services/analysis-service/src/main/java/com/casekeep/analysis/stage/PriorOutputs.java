package com.casekeep.analysis.stage;

import com.casekeep.analysis.stage.output.StageOutput;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class PriorOutputs {

    private static final PriorOutputs EMPTY = new PriorOutputs(Map.of());

    private final Map<String, StageOutput> outputs;

    private PriorOutputs(Map<String, StageOutput> outputs) {
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }

    public static PriorOutputs empty() {
        return EMPTY;
    }

    public static PriorOutputs of(Map<String, ? extends StageOutput> outputs) {
        return outputs.isEmpty() ? EMPTY : new PriorOutputs(new LinkedHashMap<>(outputs));
    }

    public <T extends StageOutput> Optional<T> get(String stageId, Class<T> type) {
        StageOutput output = outputs.get(stageId);
        return type.isInstance(output) ? Optional.of(type.cast(output)) : Optional.empty();
    }

    public boolean contains(String stageId) {
        return outputs.containsKey(stageId);
    }

    public List<String> stageIds() {
        return List.copyOf(outputs.keySet());
    }

    public Map<String, StageOutput> asMap() {
        return outputs;
    }

    public int size() {
        return outputs.size();
    }

    public PriorOutputs restrictTo(Set<String> stageIds) {
        Map<String, StageOutput> retained = new LinkedHashMap<>();
        outputs.forEach((id, output) -> {
            if (stageIds.contains(id)) {
                retained.put(id, output);
            }
        });
        return of(retained);
    }
}
