package com.whereq.vigil.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Named, pre-set nmap argument bundles
 */
public enum ScanProfile {
    QUICK("Quick", "-T4 -F"),
    FULL("Full", "-T4 -p-"),
    PING("Ping", "-sn"),
    SERVICE("Service", "-sV"),
    OS_DETECTION("OS Detection", "-O"),
    COMPREHENSIVE("Comprehensive", "-T4 -A -v -PE -PP -PS80,443 -PA3389 -PU40125 -PY -g 53");

    /**
     * Arguments used when a profile name is not recognised
     */
    public static final String DEFAULT_ARGUMENTS = QUICK.arguments;

    private final String displayName;
    private final String arguments;

    ScanProfile(String displayName, String arguments) {
        this.displayName = displayName;
        this.arguments = arguments;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getArguments() {
        return arguments;
    }

    public static Optional<ScanProfile> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        return Arrays.stream(values())
            .filter(p -> p.displayName.equalsIgnoreCase(trimmed) || p.name().equalsIgnoreCase(trimmed))
            .findFirst();
    }

    /**
     * Resolve a profile name to its arguments, falling back to {@link #DEFAULT_ARGUMENTS}
     */
    public static String argumentsFor(String name) {
        return fromName(name).map(ScanProfile::getArguments).orElse(DEFAULT_ARGUMENTS);
    }

    /**
     * Display name to arguments, in declaration order
     */
    public static Map<String, String> asMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (ScanProfile profile : values()) {
            map.put(profile.displayName, profile.arguments);
        }
        return Collections.unmodifiableMap(map);
    }
}
