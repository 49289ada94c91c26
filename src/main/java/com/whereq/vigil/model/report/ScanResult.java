package com.whereq.vigil.model.report;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Structured result extracted from one XML scan report.
 * Immutable once built. A result that could not be extracted carries
 * a non-null {@code error} and no hosts.
 */
@Value
@Builder
@Jacksonized
public class ScanResult {

    @Builder.Default
    ScanInfo scanInfo = ScanInfo.EMPTY;

    @Singular
    List<Host> hosts;

    String error;

    @JsonIgnore
    public boolean hasError() {
        return error != null;
    }

    public static ScanResult failed(String error) {
        return ScanResult.builder()
            .error(error == null || error.isBlank() ? "Unparseable scan report" : error)
            .build();
    }
}
