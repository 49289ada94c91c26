package com.whereq.vigil.model.report;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Optional;

/**
 * One probed port. Service fields are null when the report has no service entry.
 */
@Value
@Builder
@Jacksonized
public class Port {
    String protocol;
    Integer portId;
    String state;
    String reason;

    String service;
    String product;
    String version;

    /**
     * Product and version joined by a single space, either part omitted when empty
     */
    String versionInfo;

    String extraInfo;
    String osType;
    String deviceType;
    String serviceFingerprint;

    @Singular
    List<ScriptOutput> scripts;

    public Optional<String> findService() {
        return Optional.ofNullable(service);
    }
}
