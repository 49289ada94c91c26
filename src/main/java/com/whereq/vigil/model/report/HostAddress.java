package com.whereq.vigil.model.report;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class HostAddress {
    /**
     * ipv4, ipv6 or mac
     */
    String type;
    String addr;
    String vendor;
}
