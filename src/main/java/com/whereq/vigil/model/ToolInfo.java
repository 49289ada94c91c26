package com.whereq.vigil.model;

/**
 * Availability of the external scanner binary.
 */
public record ToolInfo(boolean installed, String version) {

    public static final String UNKNOWN_VERSION = "Unknown version";

    public static ToolInfo missing() {
        return new ToolInfo(false, "");
    }
}
