package com.whereq.vigil.model.report;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;
import java.util.Optional;

/**
 * Scan-level metadata: attributes of the report root ({@code scanner}, {@code args},
 * {@code start}, {@code version}, ...) and the run statistics.
 */
@Value
@Builder
@Jacksonized
public class ScanInfo {

    public static final ScanInfo EMPTY = ScanInfo.builder().build();

    @Singular
    Map<String, String> attributes;

    RunStats runStats;

    public Optional<String> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public Optional<RunStats> findRunStats() {
        return Optional.ofNullable(runStats);
    }
}
