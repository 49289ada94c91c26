package com.whereq.vigil.model.report;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class OsMatch {
    String name;
    Integer accuracy;
    String line;

    @Singular("osClass")
    List<OsClass> classes;
}
