package io.sichter.queue;

import io.sichter.config.SichterConfig;
import io.sichter.error.ValidationException;
import io.sichter.model.Job;
import io.sichter.model.JobMode;
import io.sichter.model.JobSpec;
import io.sichter.model.JobType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class JobQueueTest {

    @Test
    void submittedJobsGetUniqueOrderedIdsAndAreVisible() throws Exception {
        Path root = Files.createTempDirectory("sichter-queue-ids-");
        try {
            JobQueue queue = newQueue(root);
            List<String> ids = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                Job job = queue.submit(JobSpec.of(JobType.SCAN_CHANGED, null, "repo-" + i, true));
                Assertions.assertTrue(JobQueue.isValidJobId(job.id()), job.id());
                ids.add(job.id());
            }
            Set<String> unique = new HashSet<>(ids);
            Assertions.assertEquals(50, unique.size());
            List<String> sorted = new ArrayList<>(ids);
            Collections.sort(sorted);
            Assertions.assertEquals(ids, sorted);

            List<Job> pending = queue.peekAll();
            Assertions.assertEquals(50, pending.size());
            Assertions.assertEquals(50, queue.size());
            Assertions.assertEquals(ids.get(0), pending.get(0).id());
            Assertions.assertEquals("repo-0", pending.get(0).repo());
            Assertions.assertFalse(Files.exists(root.resolve("queue").resolve(ids.get(0) + ".json.tmp")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void acceptedJobIsFlushedAndVisibleToAnotherQueueInstance() throws Exception {
        Path root = Files.createTempDirectory("sichter-queue-durable-");
        try {
            JobQueue queue = newQueue(root);
            Assertions.assertTrue(JobQueue.syncDirectory(root.resolve("queue")));

            Job job = queue.submit(JobSpec.of(JobType.SCAN_ALL, null, null, false));

            JobQueue reopened = newQueue(root);
            List<Job> pending = reopened.peekAll();
            Assertions.assertEquals(1, pending.size());
            Assertions.assertEquals(job.id(), pending.get(0).id());
            Assertions.assertEquals(JobMode.ALL, pending.get(0).mode());
            try (Stream<Path> files = Files.list(root.resolve("queue"))) {
                Assertions.assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void directorySyncReportsMissingDirectory() throws Exception {
        Path root = Files.createTempDirectory("sichter-queue-nosync-");
        try {
            Assertions.assertFalse(JobQueue.syncDirectory(root.resolve("missing")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void claimsInSubmissionOrderAndRemovalIsIdempotent() throws Exception {
        Path root = Files.createTempDirectory("sichter-queue-fifo-");
        try {
            JobQueue queue = newQueue(root);
            Job first = queue.submit(JobSpec.of(JobType.SCAN_CHANGED, null, "alpha", true));
            Job second = queue.submit(JobSpec.of(JobType.SCAN_ALL, null, "beta", false));

            JobQueue.ClaimedJob c1 = queue.claimNext().orElseThrow();
            Assertions.assertEquals(first.id(), c1.job().id());
            Assertions.assertEquals(1, queue.size());
            Assertions.assertEquals(1, queue.inFlight().size());

            queue.remove(c1.job().id());
            queue.remove(c1.job().id());
            Assertions.assertTrue(queue.inFlight().isEmpty());

            JobQueue.ClaimedJob c2 = queue.claimNext().orElseThrow();
            Assertions.assertEquals(second.id(), c2.job().id());
            Assertions.assertEquals(JobMode.ALL, c2.job().mode());
            Assertions.assertFalse(c2.job().autoPr());
            Assertions.assertTrue(queue.claimNext().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void concurrentClaimersNeverReceiveTheSameJob() throws Exception {
        Path root = Files.createTempDirectory("sichter-queue-claim-");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            JobQueue queue = newQueue(root);
            JobQueue otherProcessView = new JobQueue(SichterConfig.fromRoot(root.toString()));
            for (int i = 0; i < 40; i++) {
                queue.submit(JobSpec.of(JobType.SCAN_CHANGED, null, "repo-" + i, true));
            }
            CountDownLatch go = new CountDownLatch(1);
            List<Future<List<String>>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                JobQueue claimer = t % 2 == 0 ? queue : otherProcessView;
                futures.add(pool.submit(() -> {
                    go.await();
                    List<String> mine = new ArrayList<>();
                    while (true) {
                        var claimed = claimer.claimNext();
                        if (claimed.isEmpty()) {
                            return mine;
                        }
                        mine.add(claimed.get().job().id());
                    }
                }));
            }
            go.countDown();
            Set<String> seen = new HashSet<>();
            int total = 0;
            for (Future<List<String>> future : futures) {
                List<String> ids = future.get(30, TimeUnit.SECONDS);
                total += ids.size();
                seen.addAll(ids);
            }
            Assertions.assertEquals(40, total);
            Assertions.assertEquals(40, seen.size());
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    @Test
    void rejectsInvalidSubmissions() throws Exception {
        Path root = Files.createTempDirectory("sichter-queue-validate-");
        try {
            JobQueue queue = newQueue(root);
            Assertions.assertThrows(ValidationException.class,
                    () -> queue.submit(new JobSpec("Deploy", null, null, null)));
            Assertions.assertThrows(ValidationException.class,
                    () -> queue.submit(new JobSpec("ScanChanged", "deep", null, null)));
            Assertions.assertThrows(ValidationException.class,
                    () -> queue.submit(new JobSpec("ScanAll", "changed", null, null)));
            Assertions.assertThrows(ValidationException.class,
                    () -> queue.submit(new JobSpec("ScanChanged", null, "../etc", null)));
            Assertions.assertThrows(ValidationException.class,
                    () -> queue.submit(new JobSpec("ScanChanged", null, "a/b/c", null)));
            Assertions.assertThrows(ValidationException.class, () -> queue.submit(null));
            Assertions.assertEquals(0, queue.size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void appliesModeAndAutoPrDefaults() throws Exception {
        Path root = Files.createTempDirectory("sichter-queue-defaults-");
        try {
            JobQueue queue = newQueue(root);
            Instant now = Instant.now();
            Job scanAll = queue.validate(new JobSpec("ScanAll", null, null, null), "id-1", now);
            Assertions.assertEquals(JobMode.ALL, scanAll.mode());
            Assertions.assertTrue(scanAll.autoPr());
            Assertions.assertNull(scanAll.repo());

            Job sweep = queue.validate(new JobSpec("PRSweep", " ", null, false), "id-2", now);
            Assertions.assertEquals(JobType.PR_SWEEP, sweep.type());
            Assertions.assertEquals(JobMode.CHANGED, sweep.mode());
            Assertions.assertFalse(sweep.autoPr());

            Job owned = queue.validate(new JobSpec("ScanChanged", "all", " heimgewebe/wgx ", null), "id-3", now);
            Assertions.assertEquals("heimgewebe/wgx", owned.repo());
            Assertions.assertEquals(JobMode.ALL, owned.mode());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void releaseAndRecoveryReturnClaimedJobsToPending() throws Exception {
        Path root = Files.createTempDirectory("sichter-queue-recover-");
        try {
            JobQueue queue = newQueue(root);
            Job a = queue.submit(JobSpec.of(JobType.SCAN_CHANGED, null, "a", true));
            Job b = queue.submit(JobSpec.of(JobType.SCAN_CHANGED, null, "b", true));

            queue.claimNext().orElseThrow();
            Assertions.assertTrue(queue.release(a.id()));
            Assertions.assertFalse(queue.release(a.id()));
            Assertions.assertEquals(a.id(), queue.peekAll().get(0).id());

            queue.claimNext().orElseThrow();
            queue.claimNext().orElseThrow();
            Assertions.assertEquals(0, queue.size());
            Assertions.assertEquals(2, queue.recoverAbandoned());
            Assertions.assertEquals(List.of(a.id(), b.id()), queue.peekAll().stream().map(Job::id).toList());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void malformedJobFilesAreQuarantined() throws Exception {
        Path root = Files.createTempDirectory("sichter-queue-malformed-");
        try {
            JobQueue queue = newQueue(root);
            Files.writeString(root.resolve("queue").resolve("0000000000001-broken.json"), "{not json");
            Job good = queue.submit(JobSpec.of(JobType.SCAN_CHANGED, null, "ok", true));

            JobQueue.ClaimedJob claimed = queue.claimNext().orElseThrow();
            Assertions.assertEquals(good.id(), claimed.job().id());
            Assertions.assertTrue(Files.exists(root.resolve("queue").resolve("rejected").resolve("0000000000001-broken.json")));
        } finally {
            deleteRecursively(root);
        }
    }

    private static JobQueue newQueue(Path root) {
        JobQueue queue = new JobQueue(SichterConfig.fromRoot(root.toString()));
        queue.init();
        return queue;
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
