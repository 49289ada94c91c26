package com.whereq.vigil.model.report;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Optional;

/**
 * One scanned host.
 * {@code ip}, {@code mac} and {@code hostname} are convenience fields; the full
 * address and hostname lists are always kept.
 */
@Value
@Builder
@Jacksonized
public class Host {
    String status;

    @Singular
    List<HostAddress> addresses;

    String ip;
    String mac;

    /**
     * Hostname flagged as user-assigned, if any
     */
    String hostname;

    @Singular("hostnameEntry")
    List<HostName> hostnames;

    @Singular
    List<Port> ports;

    /**
     * Representative OS: the first match the report lists
     */
    OsMatch os;

    @Singular
    List<OsMatch> osMatches;

    Uptime uptime;
    Integer distance;
    Trace trace;

    public Optional<String> findIp() {
        return Optional.ofNullable(ip);
    }

    public Optional<String> findMac() {
        return Optional.ofNullable(mac);
    }

    public Optional<String> findHostname() {
        return Optional.ofNullable(hostname);
    }

    public Optional<OsMatch> findOs() {
        return Optional.ofNullable(os);
    }

    public Optional<Uptime> findUptime() {
        return Optional.ofNullable(uptime);
    }

    public Optional<Integer> findDistance() {
        return Optional.ofNullable(distance);
    }

    public Optional<Trace> findTrace() {
        return Optional.ofNullable(trace);
    }
}
