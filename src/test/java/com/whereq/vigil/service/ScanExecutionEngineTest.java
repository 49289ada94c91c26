package com.whereq.vigil.service;

import com.whereq.vigil.config.VigilProperties;
import com.whereq.vigil.exception.InvalidTargetException;
import com.whereq.vigil.executor.ScannerBinaryLocator;
import com.whereq.vigil.model.ScanEvent;
import com.whereq.vigil.model.ScanJobSnapshot;
import com.whereq.vigil.model.ScanStatus;
import com.whereq.vigil.parser.NmapReportParser;
import com.whereq.vigil.support.FakeProcessLauncher;
import com.whereq.vigil.support.RecordingListener;
import com.whereq.vigil.support.Reports;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScanExecutionEngineTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @TempDir
    Path tempDir;

    private VigilProperties properties;
    private FakeProcessLauncher launcher;
    private SimpleMeterRegistry meterRegistry;
    private ScanExecutionEngine engine;

    @BeforeEach
    void setUp() {
        properties = new VigilProperties();
        properties.getScanner().setBinary("/opt/nmap/bin/nmap");
        properties.getScanner().setTempDir(tempDir.toString());
        properties.getScanner().setCancelGracePeriod(Duration.ofMillis(100));
        launcher = new FakeProcessLauncher();
        meterRegistry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.shutdown();
        }
    }

    private ScanExecutionEngine engine(int maxConcurrent) {
        properties.getScanner().setMaxConcurrentScans(maxConcurrent);
        engine = new ScanExecutionEngine(properties, launcher, new ScannerBinaryLocator(properties),
            new NmapReportParser(), Clock.systemUTC(), meterRegistry);
        return engine;
    }

    @Test
    void runsAtMostTheConfiguredNumberOfScansAtOnce() throws Exception {
        engine(3);
        List<String> jobIds = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            jobIds.add(engine.submit("10.0.0." + i, "-T4 -F", null));
        }

        launcher.awaitLaunch(2, TIMEOUT);
        Thread.sleep(200);

        assertThat(launcher.launchCount()).isEqualTo(3);
        List<ScanJobSnapshot> snapshots = jobIds.stream().map(id -> engine.status(id).orElseThrow()).toList();
        assertThat(snapshots).allMatch(s -> s.getStatus() == ScanStatus.RUNNING);
        assertThat(snapshots).filteredOn(ScanJobSnapshot::isAwaitingSlot).hasSize(2);
        assertThat(meterRegistry.get("vigil.scans.active").gauge().value()).isEqualTo(3.0);
        assertThat(meterRegistry.get("vigil.scans.queued").gauge().value()).isEqualTo(2.0);

        launcher.launches().get(0).complete(Reports.singleHost());

        launcher.awaitLaunch(3, TIMEOUT);
        Thread.sleep(100);
        assertThat(launcher.launchCount()).isEqualTo(4);
        long started = jobIds.stream()
            .map(id -> engine.status(id).orElseThrow())
            .filter(s -> s.getStatus() == ScanStatus.RUNNING && !s.isAwaitingSlot())
            .count();
        assertThat(started).isEqualTo(3);
    }

    @Test
    void buildsCommandWithoutShell() throws Exception {
        engine(1);
        engine.submit("10.0.0.1", "-sV --script 'http-title and safe'", null);

        FakeProcessLauncher.Launch launch = launcher.awaitLaunch(0, TIMEOUT);

        assertThat(launch.command()).containsExactly(
            "/opt/nmap/bin/nmap", "-sV", "--script", "http-title and safe",
            "--stats-every", "5s", "-oX", launch.reportFile().toString(), "10.0.0.1");
        assertThat(launch.reportFile()).hasParentRaw(tempDir);
    }

    @Test
    void publishesProgressThenCompletesWithExtractedResult() throws Exception {
        engine(2);
        RecordingListener listener = new RecordingListener();
        String jobId = engine.submit("192.168.1.10", "-sV", listener);

        FakeProcessLauncher.Launch launch = launcher.awaitLaunch(0, TIMEOUT);
        launch.process().emit("Starting Nmap 7.94 ( https://nmap.org )");
        launch.process().emit("SYN Stealth Scan Timing: About 45.50% done; ETC: 12:00 (0:00:10 remaining)");
        listener.awaitEventCount(1, TIMEOUT);
        assertThat(engine.status(jobId).orElseThrow().getProgress()).isEqualTo(45.5);

        launch.complete(Reports.singleHost());
        ScanEvent terminal = listener.awaitTerminal(TIMEOUT);

        assertThat(listener.events()).first().isEqualTo(new ScanEvent.Progress(45.5));
        assertThat(terminal).isInstanceOf(ScanEvent.Completed.class);
        assertThat(terminal.progress()).isEqualTo(100.0);
        assertThat(((ScanEvent.Completed) terminal).result().getHosts().get(0).getIp()).isEqualTo("192.168.1.10");

        ScanJobSnapshot snapshot = engine.status(jobId).orElseThrow();
        assertThat(snapshot.getStatus()).isEqualTo(ScanStatus.COMPLETED);
        assertThat(snapshot.getProgress()).isEqualTo(100.0);
        assertThat(snapshot.getReturnCode()).isZero();
        assertThat(snapshot.getEndedAt()).isNotNull();
        assertThat(snapshot.getResult().getHosts()).hasSize(2);
        assertThat(listener.terminalCount()).isEqualTo(1);
        assertThat(meterRegistry.counter("vigil.scans.completed").count()).isEqualTo(1.0);
    }

    @Test
    void removesTemporaryFilesWhateverTheOutcome() throws Exception {
        engine(2);
        RecordingListener ok = new RecordingListener();
        RecordingListener failed = new RecordingListener();
        engine.submit("10.0.0.1", "-F", ok);
        engine.submit("10.0.0.2", "-F", failed);

        launcher.awaitLaunch(1, TIMEOUT);
        launcher.launches().get(0).complete(Reports.singleHost());
        launcher.launches().get(1).fail(1, "boom");
        ok.awaitTerminal(TIMEOUT);
        failed.awaitTerminal(TIMEOUT);

        try (Stream<Path> leftovers = Files.list(tempDir)) {
            assertThat(leftovers).isEmpty();
        }
    }

    @Test
    void privilegeDiagnosticMeansPermissionDenied() throws Exception {
        engine(1);
        RecordingListener listener = new RecordingListener();
        String jobId = engine.submit("10.0.0.1", "-sS -O", listener);

        launcher.awaitLaunch(0, TIMEOUT)
            .fail(1, "You requested a scan type which requires root privileges.\nQUITTING!\n");
        ScanEvent terminal = listener.awaitTerminal(TIMEOUT);

        assertThat(terminal).isInstanceOf(ScanEvent.PermissionDenied.class);
        assertThat(terminal.progress()).isEqualTo(-2.0);
        ScanJobSnapshot snapshot = engine.status(jobId).orElseThrow();
        assertThat(snapshot.getStatus()).isEqualTo(ScanStatus.PERMISSION_DENIED);
        assertThat(snapshot.getErrorMessage()).isEqualTo(ScanExecutionEngine.PERMISSION_MESSAGE);
        assertThat(snapshot.isNeedsAdmin()).isTrue();
    }

    @Test
    void nonZeroExitFailsWithCodeAndDiagnostics() throws Exception {
        engine(1);
        RecordingListener listener = new RecordingListener();
        String jobId = engine.submit("my-host.local", "-F", listener);

        launcher.awaitLaunch(0, TIMEOUT).fail(2, "Failed to resolve \"my-host.local\".\n");
        ScanEvent terminal = listener.awaitTerminal(TIMEOUT);

        assertThat(terminal).isInstanceOf(ScanEvent.Failed.class);
        assertThat(terminal.progress()).isEqualTo(-1.0);
        ScanJobSnapshot snapshot = engine.status(jobId).orElseThrow();
        assertThat(snapshot.getStatus()).isEqualTo(ScanStatus.FAILED);
        assertThat(snapshot.getErrorMessage()).isEqualTo("Scan failed with error code 2: Failed to resolve \"my-host.local\".");
        assertThat(snapshot.getReturnCode()).isEqualTo(2);
        assertThat(snapshot.isNeedsAdmin()).isFalse();
        assertThat(meterRegistry.counter("vigil.scans.failed").count()).isEqualTo(1.0);
    }

    @Test
    void unparseableReportFailsInsteadOfThrowing() throws Exception {
        engine(1);
        RecordingListener listener = new RecordingListener();
        String jobId = engine.submit("10.0.0.1", "-F", listener);

        launcher.awaitLaunch(0, TIMEOUT).complete("<nmaprun><host>");
        ScanEvent terminal = listener.awaitTerminal(TIMEOUT);

        assertThat(terminal).isInstanceOf(ScanEvent.Failed.class);
        assertThat(engine.status(jobId).orElseThrow().getErrorMessage()).startsWith("Error parsing scan results: ");
        assertThat(engine.status(jobId).orElseThrow().getOutput()).isEqualTo("<nmaprun><host>");
    }

    @Test
    void oldestFinishedJobsAreEvictedBeyondRetentionLimit() throws Exception {
        properties.getScanner().setRetainedJobs(2);
        engine(1);
        List<String> jobIds = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            RecordingListener listener = new RecordingListener();
            jobIds.add(engine.submit("10.0.0." + (i + 1), "-F", listener));
            launcher.awaitLaunch(i, TIMEOUT).complete(Reports.singleHost());
            listener.awaitTerminal(TIMEOUT);
        }

        assertThat(engine.status(jobIds.get(0))).isEmpty();
        assertThat(engine.isRegistered(jobIds.get(0))).isFalse();
        assertThat(engine.allStatuses()).containsOnlyKeys(jobIds.get(1), jobIds.get(2));

        ScanJobSnapshot latest = engine.status(jobIds.get(2)).orElseThrow();
        assertThat(latest.getResult()).isNotNull();
        assertThat(latest.getOutput()).isNull();
    }

    @Test
    void launchFailureStillEmitsExactlyOneTerminalEvent() throws Exception {
        engine(1);
        launcher.failLaunchesWith(new IOException("Cannot run program \"nmap\""));
        RecordingListener listener = new RecordingListener();
        String jobId = engine.submit("10.0.0.1", "-F", listener);

        ScanEvent terminal = listener.awaitTerminal(TIMEOUT);
        Thread.sleep(100);

        assertThat(terminal).isInstanceOf(ScanEvent.Failed.class);
        assertThat(listener.terminalCount()).isEqualTo(1);
        assertThat(engine.status(jobId).orElseThrow().getErrorMessage()).contains("Cannot run program");
    }

    @Test
    void listenerExceptionsDoNotAbortTheWorker() throws Exception {
        engine(1);
        List<ScanEvent> seen = new CopyOnWriteArrayList<>();
        String jobId = engine.submit("10.0.0.1", "-F", (id, event) -> {
            seen.add(event);
            throw new IllegalStateException("listener bug");
        });

        FakeProcessLauncher.Launch launch = launcher.awaitLaunch(0, TIMEOUT);
        launch.process().emit("About 10.00% done");
        launch.complete(Reports.singleHost());

        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (engine.status(jobId).orElseThrow().getStatus() == ScanStatus.RUNNING && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        Thread.sleep(100);

        assertThat(engine.status(jobId).orElseThrow().getStatus()).isEqualTo(ScanStatus.COMPLETED);
        assertThat(seen).hasSize(2);
        assertThat(seen.get(1)).isInstanceOf(ScanEvent.Completed.class);
    }

    @Test
    void cancelRunningScanIsStickyAfterExit() throws Exception {
        engine(1);
        RecordingListener listener = new RecordingListener();
        String jobId = engine.submit("10.0.0.1", "-p-", listener);
        FakeProcessLauncher.Launch launch = launcher.awaitLaunch(0, TIMEOUT);

        assertThat(engine.cancel(jobId)).isTrue();
        ScanEvent terminal = listener.awaitTerminal(TIMEOUT);

        assertThat(launch.process().isDestroyRequested()).isTrue();
        assertThat(terminal).isInstanceOf(ScanEvent.Cancelled.class);
        assertThat(terminal.progress()).isEqualTo(-1.0);
        assertThat(engine.status(jobId).orElseThrow().getStatus()).isEqualTo(ScanStatus.CANCELLED);
        assertThat(engine.cancel(jobId)).isFalse();
        assertThat(meterRegistry.counter("vigil.scans.cancelled").count()).isEqualTo(1.0);
    }

    @Test
    void processIgnoringTerminationIsKilledAfterGracePeriod() throws Exception {
        engine(1);
        launcher.setExitsOnDestroy(false);
        RecordingListener listener = new RecordingListener();
        String jobId = engine.submit("10.0.0.1", "-p-", listener);
        FakeProcessLauncher.Launch launch = launcher.awaitLaunch(0, TIMEOUT);

        engine.cancel(jobId);
        assertThat(launch.process().isForciblyDestroyed()).isFalse();

        listener.awaitTerminal(TIMEOUT);
        assertThat(launch.process().isDestroyRequested()).isTrue();
        assertThat(launch.process().isForciblyDestroyed()).isTrue();
        assertThat(engine.status(jobId).orElseThrow().getStatus()).isEqualTo(ScanStatus.CANCELLED);
    }

    @Test
    void scanCancelledWhileWaitingForSlotNeverLaunches() throws Exception {
        engine(1);
        String first = engine.submit("10.0.0.1", "-F", null);
        RecordingListener queuedListener = new RecordingListener();
        String queued = engine.submit("10.0.0.2", "-F", queuedListener);
        FakeProcessLauncher.Launch launch = launcher.awaitLaunch(0, TIMEOUT);

        assertThat(engine.status(queued).orElseThrow().isAwaitingSlot()).isTrue();
        assertThat(engine.cancel(queued)).isTrue();

        launch.complete(Reports.singleHost());
        ScanEvent terminal = queuedListener.awaitTerminal(TIMEOUT);

        assertThat(terminal).isInstanceOf(ScanEvent.Cancelled.class);
        assertThat(launcher.launchCount()).isEqualTo(1);
        assertThat(engine.status(queued).orElseThrow().isProcessLaunched()).isFalse();
        assertThat(engine.status(first).orElseThrow().getStatus()).isEqualTo(ScanStatus.COMPLETED);
    }

    @Test
    void cancelOfUnknownOrFinishedScanIsRejected() throws Exception {
        engine(1);
        RecordingListener listener = new RecordingListener();
        String jobId = engine.submit("10.0.0.1", "-F", listener);
        launcher.awaitLaunch(0, TIMEOUT).complete(Reports.singleHost());
        listener.awaitTerminal(TIMEOUT);

        assertThat(engine.cancel("no-such-job")).isFalse();
        assertThat(engine.cancel(jobId)).isFalse();
        assertThat(engine.status(jobId).orElseThrow().getStatus()).isEqualTo(ScanStatus.COMPLETED);
    }

    @Test
    void invalidTargetIsRejectedBeforeAnythingIsRegistered() {
        engine(1);

        assertThatThrownBy(() -> engine.submit("10.0.0.256", "-F", null))
            .isInstanceOf(InvalidTargetException.class)
            .hasMessage("Invalid target: 10.0.0.256");

        assertThat(engine.allStatuses()).isEmpty();
        assertThat(launcher.launchCount()).isZero();
    }

    @Test
    void snapshotsAreCopies() throws Exception {
        engine(1);
        String jobId = engine.submit("10.0.0.1", "-F", null);
        ScanJobSnapshot before = engine.status(jobId).orElseThrow();

        FakeProcessLauncher.Launch launch = launcher.awaitLaunch(0, TIMEOUT);
        launch.process().emit("About 80.00% done");
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (engine.status(jobId).orElseThrow().getProgress() < 80.0 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }

        assertThat(before.getProgress()).isZero();
        assertThat(engine.allStatuses()).containsKey(jobId);
        assertThat(engine.status(jobId).orElseThrow().getProgress()).isEqualTo(80.0);
    }

    @Test
    void privilegeHeuristicAndProgressPattern() {
        assertThat(ScanExecutionEngine.needsAdminPrivileges("-T4 -A -v")).isTrue();
        assertThat(ScanExecutionEngine.needsAdminPrivileges("-sS")).isTrue();
        assertThat(ScanExecutionEngine.needsAdminPrivileges("--osscan-guess")).isTrue();
        assertThat(ScanExecutionEngine.needsAdminPrivileges("-T4 -F")).isFalse();

        assertThat(ScanExecutionEngine.parseProgress("Connect Scan Timing: About 12.34% done; ETC: 10:00"))
            .contains(12.34);
        assertThat(ScanExecutionEngine.parseProgress("About 50% done")).isEmpty();
        assertThat(ScanExecutionEngine.parseProgress(null)).isEmpty();
    }
}
