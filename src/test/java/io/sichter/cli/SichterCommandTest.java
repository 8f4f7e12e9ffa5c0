package io.sichter.cli;

import io.sichter.config.SichterConfig;
import io.sichter.events.EventLog;
import io.sichter.model.Event;
import io.sichter.queue.JobQueue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

final class SichterCommandTest {
    private Path root;
    private PrintStream originalOut;
    private PrintStream originalErr;
    private ByteArrayOutputStream out;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("sichter-cli-");
        originalOut = System.out;
        originalErr = System.err;
        out = new ByteArrayOutputStream();
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() throws Exception {
        System.setOut(originalOut);
        System.setErr(originalErr);
        deleteRecursively(root);
    }

    @Test
    void initCreatesLayout() {
        Assertions.assertEquals(0, execute("init"));
        SichterConfig config = SichterConfig.fromRoot(root.toString());
        Assertions.assertTrue(Files.isDirectory(config.processingDir()));
        Assertions.assertTrue(Files.isDirectory(config.rejectedDir()));
        Assertions.assertTrue(Files.exists(config.eventsFile()));
        Assertions.assertTrue(Files.exists(config.dbFile()));
    }

    @Test
    void submitThenWorkerOnceRetiresTheJob() {
        Assertions.assertEquals(0, execute("submit", "--type", "ScanChanged", "--repo", "wgx", "--no-auto-pr"));
        Assertions.assertTrue(out.toString(StandardCharsets.UTF_8).contains("\"auto_pr\" : false"));
        JobQueue queue = new JobQueue(SichterConfig.fromRoot(root.toString()));
        Assertions.assertEquals(1, queue.size());

        // no check command configured, so the job fails once and is dropped
        Assertions.assertEquals(0, execute("worker", "--once"));
        Assertions.assertEquals(0, queue.size());
        Assertions.assertTrue(queue.inFlight().isEmpty());

        SichterConfig config = SichterConfig.fromRoot(root.toString());
        List<String> kinds = new EventLog(config.eventsFile(), 100).tail(10).stream()
                .map(Event::kind)
                .collect(Collectors.toList());
        Assertions.assertEquals(List.of("job.started", "job.progress", "job.failed"), kinds);
    }

    @Test
    void invalidSubmissionExitsWithUsageError() {
        Assertions.assertEquals(2, execute("submit", "--type", "Deploy"));
        Assertions.assertEquals(2, execute("sweep", "--mode", "sometimes"));
        Assertions.assertEquals(0, new JobQueue(SichterConfig.fromRoot(root.toString())).size());
    }

    @Test
    void jobLookupReportsMissingAndInvalidIds() {
        Assertions.assertEquals(2, execute("job", "--id", "../../etc/passwd"));
        Assertions.assertEquals(1, execute("job", "--id", "0000000000001-0123456789abcdef0123456789abcdef"));
    }

    private int execute(String... args) {
        String[] full = new String[args.length + 2];
        full[0] = "--root";
        full[1] = root.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        return new CommandLine(new SichterCommand()).execute(full);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
