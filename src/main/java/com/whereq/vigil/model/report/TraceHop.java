package com.whereq.vigil.model.report;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class TraceHop {
    Integer ttl;
    String ipAddr;
    String host;
    Double rtt;
}
