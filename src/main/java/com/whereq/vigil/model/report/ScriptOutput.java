package com.whereq.vigil.model.report;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ScriptOutput {
    String id;
    String output;
}
