package stocksync.engine.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Tagged job description: a job kind resolved against the handler registry plus its
 * input parameters.
 */
public record JobDescriptor(String kind, Map<String, Object> params) {

    public JobDescriptor {
        Objects.requireNonNull(kind, "kind is required");
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static JobDescriptor of(String kind) {
        return new JobDescriptor(kind, Map.of());
    }

    public static JobDescriptor of(String kind, Map<String, Object> params) {
        return new JobDescriptor(kind, params);
    }
}
