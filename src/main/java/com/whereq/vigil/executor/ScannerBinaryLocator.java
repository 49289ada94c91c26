package com.whereq.vigil.executor;

import com.whereq.vigil.config.VigilProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;

/**
 * Finds the scanner executable.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScannerBinaryLocator {

    private final VigilProperties properties;

    private volatile String resolved;

    public String locate() {
        String cached = resolved;
        if (cached == null) {
            cached = find(properties.getScanner().getBinary());
            resolved = cached;
        }
        return cached;
    }

    private String find(String binary) {
        File configured = new File(binary);
        if (configured.isAbsolute() || binary.contains(File.separator)) {
            return configured.getPath();
        }

        // Try NMAP_HOME environment variable
        String nmapHome = System.getenv("NMAP_HOME");
        if (nmapHome != null && !nmapHome.isEmpty()) {
            File candidate = new File(nmapHome, "bin" + File.separator + binary);
            if (candidate.exists()) {
                return candidate.getAbsolutePath();
            }
            candidate = new File(nmapHome, binary);
            if (candidate.exists()) {
                return candidate.getAbsolutePath();
            }
        }

        // Try PATH
        String path = System.getenv("PATH");
        if (path != null) {
            for (String dir : path.split(File.pathSeparator)) {
                for (String name : new String[]{binary, binary + ".exe"}) {
                    File candidate = new File(dir, name);
                    if (candidate.exists() && candidate.canExecute()) {
                        return candidate.getAbsolutePath();
                    }
                }
            }
        }

        log.warn("Could not find {} in NMAP_HOME or PATH, using '{}'", binary, binary);
        return binary;
    }
}
