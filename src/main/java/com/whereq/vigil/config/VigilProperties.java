package com.whereq.vigil.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for WhereQ Vigil.
 *
 * @author WhereQ Inc.
 */
@ConfigurationProperties(prefix = "vigil")
@Data
public class VigilProperties {

    private ScannerConfig scanner = new ScannerConfig();

    private SchedulerConfig scheduler = new SchedulerConfig();

    private StorageConfig storage = new StorageConfig();

    @Data
    public static class ScannerConfig {
        /**
         * Scanner executable. Bare names are looked up in NMAP_HOME/bin and then PATH.
         */
        private String binary = "nmap";

        /**
         * Maximum number of scans executing at once. Further submissions wait for a slot.
         */
        private int maxConcurrentScans = 3;

        /**
         * Interval passed to --stats-every so the scanner reports "About N% done".
         * Empty disables the flag.
         */
        private String statsEvery = "5s";

        /**
         * Time a cancelled process gets to exit before it is forcibly killed.
         */
        private Duration cancelGracePeriod = Duration.ofSeconds(10);

        /**
         * Directory for temporary report files. Empty means the system temp directory.
         */
        private String tempDir = "";

        /**
         * Forward ad-hoc scan results to the result store as soon as they complete.
         */
        private boolean persistAdHocResults = false;

        /**
         * Finished jobs kept in the registry and result cache; older ones are evicted.
         */
        private int retainedJobs = 200;
    }

    @Data
    public static class SchedulerConfig {
        /**
         * Start the schedule evaluator loop with the application.
         */
        private boolean enabled = true;

        /**
         * Wake-up interval of the evaluator loop.
         */
        private Duration checkInterval = Duration.ofSeconds(60);

        /**
         * Extra delay after a failed tick.
         */
        private Duration errorBackoff = Duration.ofSeconds(5);
    }

    @Data
    public static class StorageConfig {
        /**
         * Persistence backend for schedules and results.
         */
        private StorageType type = StorageType.MEMORY;

        /**
         * Timeout for a single blocking Redis call.
         */
        private Duration redisTimeout = Duration.ofSeconds(5);
    }

    public enum StorageType {
        /**
         * Process-local maps, lost on restart
         */
        MEMORY,

        /**
         * JSON documents in Redis
         */
        REDIS
    }
}
