package io.sichter.worker;

import io.sichter.collaborator.CheckRunner;
import io.sichter.collaborator.CollaboratorResult;
import io.sichter.collaborator.PrPublisher;
import io.sichter.config.SichterConfig;
import io.sichter.error.StorageException;
import io.sichter.events.EventLog;
import io.sichter.model.Job;
import io.sichter.model.JobMode;
import io.sichter.model.JobStatus;
import io.sichter.model.JobType;
import io.sichter.queue.JobQueue;
import io.sichter.storage.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The single sequential consumer of the job queue.
 *
 * <p>Each cycle claims the oldest job, writes {@code job.started}, dispatches it to the check
 * runner or PR publisher, writes exactly one terminal event and only then deletes the job file.
 * A collaborator failure retires the job as {@code job.failed}; it is not retried. Storage
 * failures of the queue or the event log stop the loop and leave the claimed file in
 * {@code processing/} for recovery; ledger failures are logged only.
 */
public final class WorkerLoop implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(WorkerLoop.class);
    private static final String NO_TARGETS = "no target repositories";

    private final SichterConfig config;
    private final JobQueue queue;
    private final EventLog events;
    private final JobStore store;
    private final CheckRunner checkRunner;
    private final PrPublisher prPublisher;

    private final ReentrantLock waitLock = new ReentrantLock();
    private final Condition wake = waitLock.newCondition();
    private boolean wakeRequested;
    private volatile boolean stopRequested;

    private volatile boolean running;
    private volatile Instant since;
    private volatile String lastExit;
    private volatile String currentJobId;
    private volatile StorageException failure;

    public WorkerLoop(
            SichterConfig config,
            JobQueue queue,
            EventLog events,
            JobStore store,
            CheckRunner checkRunner,
            PrPublisher prPublisher
    ) {
        this.config = config;
        this.queue = queue;
        this.events = events;
        this.store = store;
        this.checkRunner = checkRunner;
        this.prPublisher = prPublisher;
    }

    public WorkerOutcome runOnce() {
        Optional<JobQueue.ClaimedJob> claimed = queue.claimNext();
        if (claimed.isEmpty()) {
            return WorkerOutcome.idle();
        }
        return process(claimed.get().job());
    }

    @Override
    public void run() {
        running = true;
        since = Instant.now();
        lastExit = null;
        failure = null;
        boolean interrupted = false;
        try {
            int recovered = queue.recoverAbandoned();
            if (recovered > 0) {
                events.append("worker.recovered", "recovered " + recovered + " abandoned job(s)",
                        Map.of("count", recovered));
            }
            events.append("worker.started", "worker started", Map.of("pid", ProcessHandle.current().pid()));
            log.info("Worker started (idle={}..{})", config.tuning().idleInterval(), config.tuning().maxIdleInterval());
            Duration wait = config.tuning().idleInterval();
            while (!stopRequested && !Thread.currentThread().isInterrupted()) {
                WorkerOutcome outcome = runOnce();
                if (outcome.processed()) {
                    wait = config.tuning().idleInterval();
                    if (outcome.status() == JobStatus.ABANDONED) {
                        interrupted = true;
                        break;
                    }
                    continue;
                }
                awaitWork(wait);
                wait = nextWait(wait);
            }
            lastExit = interrupted ? "interrupted" : "stopped";
        } catch (InterruptedException e) {
            interrupted = true;
            lastExit = "interrupted";
        } catch (StorageException e) {
            failure = e;
            lastExit = "storage failure: " + e.getMessage();
            log.error("Worker stopping on storage failure", e);
        } finally {
            if (interrupted) {
                Thread.interrupted();
            }
            writeStopped();
            running = false;
            log.info("Worker stopped ({})", lastExit);
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public void stop() {
        stopRequested = true;
        wakeUp();
    }

    public void wakeUp() {
        waitLock.lock();
        try {
            wakeRequested = true;
            wake.signalAll();
        } finally {
            waitLock.unlock();
        }
    }

    public WorkerState state() {
        return new WorkerState(running, since, lastExit, ProcessHandle.current().pid(), currentJobId);
    }

    public StorageException failure() {
        return failure;
    }

    Duration nextWait(Duration current) {
        Duration doubled = current.multipliedBy(2);
        Duration max = config.tuning().maxIdleInterval();
        return doubled.compareTo(max) > 0 ? max : doubled;
    }

    private void awaitWork(Duration wait) throws InterruptedException {
        waitLock.lock();
        try {
            long remaining = wait.toNanos();
            while (!wakeRequested && !stopRequested && remaining > 0L) {
                remaining = wake.awaitNanos(remaining);
            }
            wakeRequested = false;
        } finally {
            waitLock.unlock();
        }
    }

    private WorkerOutcome process(Job job) {
        currentJobId = job.id();
        try {
            Map<String, Object> base = jobPayload(job);
            recordLedger(job.id(), () -> store.markRunning(job));
            events.append("job.started", "started " + describe(job), base);
            CollaboratorResult result;
            try {
                result = dispatch(job);
            } catch (InterruptedException e) {
                return abandon(job, base);
            }
            if (result.success()) {
                events.append("job.succeeded", "succeeded " + describe(job), withDetail(base, "output", result.output()));
                recordLedger(job.id(), () -> store.markFinished(job.id(), JobStatus.SUCCEEDED, result.output(), null));
                queue.remove(job.id());
                log.info("Job {} succeeded", job.id());
                return new WorkerOutcome(true, job.id(), JobStatus.SUCCEEDED, result.output());
            }
            String error = result.error() == null ? "unknown failure" : result.error();
            events.append("job.failed", "failed " + describe(job) + ": " + error, withDetail(base, "error", error));
            recordLedger(job.id(), () -> store.markFinished(job.id(), JobStatus.FAILED, result.output(), error));
            queue.remove(job.id());
            log.warn("Job {} failed: {}", job.id(), error);
            return new WorkerOutcome(true, job.id(), JobStatus.FAILED, error);
        } finally {
            currentJobId = null;
        }
    }

    private CollaboratorResult dispatch(Job job) throws InterruptedException {
        List<String> targets = targets(job);
        if (targets.isEmpty()) {
            return CollaboratorResult.ok(NO_TARGETS);
        }
        if (job.type() == JobType.PR_SWEEP) {
            events.append("job.progress", "publishing PRs for " + targets.size() + " repo(s)",
                    withDetail(jobPayload(job), "repos", targets));
            return invokeSafely(() -> prPublisher.publish(targets, job.mode()));
        }
        JobMode mode = job.type() == JobType.SCAN_ALL ? JobMode.ALL : job.mode();
        List<String> outputs = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        for (String repo : targets) {
            CollaboratorResult result = invokeSafely(() -> checkRunner.run(repo, mode, job.autoPr()));
            Map<String, Object> payload = jobPayload(job);
            payload.put("repo", repo);
            payload.put("ok", result.success());
            events.append("job.progress", (result.success() ? "checked " : "check failed ") + repo, payload);
            if (result.success()) {
                if (result.output() != null && !result.output().isBlank()) {
                    outputs.add(repo + ": " + result.output());
                }
            } else {
                failures.add(repo + ": " + (result.error() == null ? "unknown failure" : result.error()));
            }
        }
        String output = outputs.isEmpty() ? "checked " + targets.size() + " repo(s)" : String.join("\n", outputs);
        if (failures.isEmpty()) {
            return CollaboratorResult.ok(output);
        }
        return CollaboratorResult.fail(String.join("; ", failures), output);
    }

    private CollaboratorResult invokeSafely(CollaboratorCall call) throws InterruptedException {
        try {
            CollaboratorResult result = call.invoke();
            return result == null ? CollaboratorResult.fail("collaborator returned no result") : result;
        } catch (InterruptedException | StorageException | VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            log.warn("Collaborator call failed", e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return CollaboratorResult.fail(message);
        }
    }

    // The ledger only mirrors the queue and the event log; losing an update must not re-run the job.
    private void recordLedger(String jobId, Runnable update) {
        try {
            update.run();
        } catch (StorageException e) {
            log.warn("Ledger update for job {} failed: {}", jobId, e.getMessage());
        }
    }

    // Interrupt status is cleared here and restored after the interruptible bookkeeping writes.
    private WorkerOutcome abandon(Job job, Map<String, Object> base) {
        try {
            queue.release(job.id());
            recordLedger(job.id(), () -> store.markFinished(job.id(), JobStatus.ABANDONED, null, "interrupted"));
            events.append("job.abandoned", "abandoned " + describe(job), base);
            log.warn("Job {} abandoned and returned to the queue", job.id());
        } finally {
            Thread.currentThread().interrupt();
        }
        return new WorkerOutcome(true, job.id(), JobStatus.ABANDONED, "interrupted");
    }

    private List<String> targets(Job job) {
        if (job.repo() != null) {
            return List.of(job.repo());
        }
        return config.settings().repos();
    }

    private void writeStopped() {
        try {
            events.append("worker.stopped", "worker stopped", lastExit == null ? null : Map.of("reason", lastExit));
        } catch (StorageException e) {
            log.warn("Could not record worker stop: {}", e.getMessage());
        }
    }

    private static Map<String, Object> jobPayload(Job job) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("job_id", job.id());
        out.put("type", job.type().wireName());
        out.put("mode", job.mode().wireName());
        if (job.repo() != null) {
            out.put("repo", job.repo());
        }
        out.put("auto_pr", job.autoPr());
        return out;
    }

    private static Map<String, Object> withDetail(Map<String, Object> base, String key, Object value) {
        Map<String, Object> out = new LinkedHashMap<>(base);
        if (value != null) {
            out.put(key, value);
        }
        return out;
    }

    private static String describe(Job job) {
        return job.type().wireName() + " " + (job.repo() == null ? "(all repos)" : job.repo())
                + " [" + job.mode().wireName() + "]";
    }

    @FunctionalInterface
    private interface CollaboratorCall {
        CollaboratorResult invoke() throws Exception;
    }
}
