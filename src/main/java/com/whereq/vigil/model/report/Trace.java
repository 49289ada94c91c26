package com.whereq.vigil.model.report;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Traceroute data, hops in report order.
 */
@Value
@Builder
@Jacksonized
public class Trace {
    String proto;
    String port;

    @Singular
    List<TraceHop> hops;
}
