package com.whereq.vigil.model.report;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class OsClass {
    String type;
    String vendor;
    String osFamily;
    String osGen;
    Integer accuracy;
}
