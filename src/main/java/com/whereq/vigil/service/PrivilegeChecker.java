package com.whereq.vigil.service;

import com.whereq.vigil.executor.CommandProbe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Tells whether the service runs with the privileges raw-socket scans need.
 * Windows: {@code net session} only succeeds in an elevated session.
 * Elsewhere: effective uid must be 0.
 */
@Slf4j
@Component
public class PrivilegeChecker {

    private final CommandProbe commandProbe;
    private final boolean windows;

    @Autowired
    public PrivilegeChecker(CommandProbe commandProbe) {
        this(commandProbe, System.getProperty("os.name", ""));
    }

    PrivilegeChecker(CommandProbe commandProbe, String osName) {
        this.commandProbe = commandProbe;
        this.windows = osName.toLowerCase(Locale.ROOT).startsWith("windows");
    }

    /**
     * @return true if elevated; any probe failure counts as not elevated
     */
    public boolean hasAdminPrivileges() {
        if (windows) {
            return commandProbe.run(List.of("net", "session"))
                .map(CommandProbe.Result::succeeded)
                .orElse(false);
        }

        boolean root = commandProbe.run(List.of("id", "-u"))
            .filter(CommandProbe.Result::succeeded)
            .map(result -> result.output().trim().equals("0"))
            .orElse(false);
        log.debug("Privilege check: root={}", root);
        return root;
    }
}
