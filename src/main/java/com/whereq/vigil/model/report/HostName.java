package com.whereq.vigil.model.report;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class HostName {
    String name;

    /**
     * user or PTR
     */
    String type;
}
