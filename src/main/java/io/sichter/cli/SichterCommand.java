package io.sichter.cli;

import io.sichter.client.EventStreamAdapter;
import io.sichter.client.PollingEventSource;
import io.sichter.client.SseEventSource;
import io.sichter.client.StreamState;
import io.sichter.collaborator.SystemdStatusProbe;
import io.sichter.collaborator.WorkerStatusProbe;
import io.sichter.config.SichterConfig;
import io.sichter.error.StorageException;
import io.sichter.error.ValidationException;
import io.sichter.gateway.GatewayServer;
import io.sichter.model.Event;
import io.sichter.model.Job;
import io.sichter.model.JobSpec;
import io.sichter.model.JobType;
import io.sichter.model.QueueSnapshot;
import io.sichter.queue.JobQueue;
import io.sichter.runtime.SichterRuntime;
import io.sichter.util.Jsons;
import io.sichter.worker.LocalWorkerProbe;
import io.sichter.worker.WorkerLoop;
import io.sichter.worker.WorkerOutcome;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@Command(
        name = "sichter",
        mixinStandardHelpOptions = true,
        description = "Sichter job queue, worker and live event gateway",
        subcommands = {
                SichterCommand.InitCommand.class,
                SichterCommand.SubmitCommand.class,
                SichterCommand.SweepCommand.class,
                SichterCommand.QueueCommand.class,
                SichterCommand.EventsCommand.class,
                SichterCommand.JobCommand.class,
                SichterCommand.OverviewCommand.class,
                SichterCommand.WorkerCommand.class,
                SichterCommand.ServeCommand.class,
                SichterCommand.WatchCommand.class
        }
)
public final class SichterCommand implements Runnable {
    @Option(names = {"--root"}, description = "State root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | submit | sweep | queue | events | job | overview | worker | serve | watch");
    }

    SichterConfig config() {
        return SichterConfig.fromRoot(root);
    }

    SichterRuntime runtime() {
        SichterRuntime runtime = new SichterRuntime(config());
        runtime.init();
        return runtime;
    }

    static int rejected(ValidationException e) {
        System.err.println(Jsons.toJson(Map.of("error", "invalid_request", "detail", e.getMessage())));
        return 2;
    }

    @Command(name = "init", description = "Create the queue, event log and ledger under --root")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        SichterCommand parent;

        @Override
        public Integer call() {
            SichterRuntime runtime = parent.runtime();
            System.out.println("Initialized Sichter at: " + runtime.config().rootDir());
            return 0;
        }
    }

    @Command(name = "submit", description = "Enqueue an analysis job")
    static final class SubmitCommand implements Callable<Integer> {
        @ParentCommand
        SichterCommand parent;

        @Option(names = {"--type"}, defaultValue = "ScanChanged", description = "ScanChanged | ScanAll | PRSweep")
        String type;

        @Option(names = {"--mode"}, description = "changed | all (defaults by type)")
        String mode;

        @Option(names = {"--repo"}, description = "Repository name or owner/name; all configured repos when absent")
        String repo;

        @Option(names = {"--auto-pr"}, negatable = true, defaultValue = "true",
                description = "Let the check runner open PRs (default true)")
        boolean autoPr;

        @Override
        public Integer call() {
            SichterRuntime runtime = parent.runtime();
            try {
                Job job = runtime.submit(new JobSpec(type, mode, repo, autoPr));
                System.out.println(Jsons.toJson(job));
                return 0;
            } catch (ValidationException e) {
                return rejected(e);
            }
        }
    }

    @Command(name = "sweep", description = "Enqueue a PR sweep over the configured repositories")
    static final class SweepCommand implements Callable<Integer> {
        @ParentCommand
        SichterCommand parent;

        @Option(names = {"--mode"}, defaultValue = "changed", description = "changed | all")
        String mode;

        @Override
        public Integer call() {
            SichterRuntime runtime = parent.runtime();
            try {
                Job job = runtime.submit(new JobSpec(JobType.PR_SWEEP.wireName(), mode, null, null));
                System.out.println(Jsons.toJson(job));
                return 0;
            } catch (ValidationException e) {
                return rejected(e);
            }
        }
    }

    @Command(name = "queue", description = "Show pending jobs, oldest first")
    static final class QueueCommand implements Callable<Integer> {
        @ParentCommand
        SichterCommand parent;

        @Override
        public Integer call() {
            List<Job> items = parent.runtime().queue().peekAll();
            System.out.println(Jsons.toJson(new QueueSnapshot(items.size(), items)));
            return 0;
        }
    }

    @Command(name = "events", description = "Print recent events as JSON lines")
    static final class EventsCommand implements Callable<Integer> {
        @ParentCommand
        SichterCommand parent;

        @Option(names = {"--n"}, defaultValue = "50", description = "Number of newest events")
        int n;

        @Option(names = {"--after"}, description = "Only events with a greater seq")
        Long after;

        @Override
        public Integer call() {
            SichterRuntime runtime = parent.runtime();
            List<Event> events = after == null
                    ? runtime.events().tail(Math.max(1, n))
                    : runtime.events().readAfter(after, Math.max(1, n));
            for (Event event : events) {
                System.out.println(Jsons.toCompactJson(event));
            }
            return 0;
        }
    }

    @Command(name = "job", description = "Show the ledger entry of one job")
    static final class JobCommand implements Callable<Integer> {
        @ParentCommand
        SichterCommand parent;

        @Option(names = {"--id"}, required = true, description = "Job id")
        String id;

        @Override
        public Integer call() {
            if (!JobQueue.isValidJobId(id)) {
                return rejected(new ValidationException("Invalid job id: " + id));
            }
            var record = parent.runtime().store().find(id);
            if (record.isEmpty()) {
                System.err.println(Jsons.toJson(Map.of("error", "job_not_found", "id", id)));
                return 1;
            }
            System.out.println(Jsons.toJson(record.get()));
            return 0;
        }
    }

    @Command(name = "overview", description = "Worker status, queue and recent events in one snapshot")
    static final class OverviewCommand implements Callable<Integer> {
        @ParentCommand
        SichterCommand parent;

        @Option(names = {"--events"}, defaultValue = "50", description = "Number of recent events")
        int events;

        @Override
        public Integer call() {
            SichterRuntime runtime = parent.runtime();
            WorkerStatusProbe probe = new SystemdStatusProbe(runtime.config().settings().workerUnit());
            System.out.println(Jsons.toJson(runtime.overview(probe).snapshot(Math.max(0, events))));
            return 0;
        }
    }

    @Command(name = "worker", description = "Run the job worker")
    static final class WorkerCommand implements Callable<Integer> {
        @ParentCommand
        SichterCommand parent;

        @Option(names = {"--once"}, defaultValue = "false", description = "Process at most one job and exit")
        boolean once;

        @Option(names = {"--idle-ms"}, defaultValue = "2000", description = "Initial idle wait between empty polls")
        long idleMs;

        @Option(names = {"--max-idle-ms"}, defaultValue = "10000", description = "Upper bound of the idle backoff")
        long maxIdleMs;

        @Option(names = {"--graceful-timeout-ms"}, defaultValue = "30000",
                description = "How long shutdown waits for the in-flight job before abandoning it")
        long gracefulTimeoutMs;

        @Override
        public Integer call() throws Exception {
            SichterConfig base = parent.config();
            SichterConfig config = base.withTuning(base.tuning().withIdle(Duration.ofMillis(idleMs), Duration.ofMillis(maxIdleMs)));
            SichterRuntime runtime = new SichterRuntime(config);
            runtime.init();
            WorkerLoop worker = runtime.newWorker();
            if (once) {
                WorkerOutcome outcome = worker.runOnce();
                System.out.println(Jsons.toJson(outcome));
                return 0;
            }
            Thread main = Thread.currentThread();
            CountDownLatch done = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                worker.stop();
                try {
                    if (!done.await(Math.max(0L, gracefulTimeoutMs), TimeUnit.MILLISECONDS)) {
                        main.interrupt();
                        done.await(5, TimeUnit.SECONDS);
                    }
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
            }, "sichter-shutdown-hook"));
            try {
                worker.run();
            } finally {
                done.countDown();
            }
            StorageException failure = worker.failure();
            if (failure != null) {
                System.err.println("Worker stopped: " + failure.getMessage());
                return 1;
            }
            return 0;
        }
    }

    @Command(name = "serve", description = "Run the HTTP gateway with the live event stream")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        SichterCommand parent;

        @Option(names = {"--bind"}, defaultValue = "127.0.0.1", description = "Bind host")
        String bind;

        @Option(names = {"--port"}, defaultValue = "8765", description = "Bind port")
        int port;

        @Option(names = {"--with-worker"}, defaultValue = "false", description = "Run the worker inside this process")
        boolean withWorker;

        @Option(names = {"--replay"}, defaultValue = "50", description = "Default stream replay size")
        int replay;

        @Option(names = {"--heartbeat"}, defaultValue = "15", description = "Default stream heartbeat in seconds")
        int heartbeat;

        @Option(names = {"--max-stream-clients"}, defaultValue = "64", description = "Concurrent stream connections")
        int maxStreamClients;

        @Override
        public Integer call() throws Exception {
            SichterConfig base = parent.config();
            SichterConfig config = base.withTuning(base.tuning()
                    .withStreamDefaults(replay, heartbeat)
                    .withMaxStreamClients(maxStreamClients));
            SichterRuntime runtime = new SichterRuntime(config);
            runtime.init();

            WorkerLoop worker = null;
            Thread workerThread = null;
            WorkerStatusProbe probe;
            Runnable onSubmit = null;
            if (withWorker) {
                worker = runtime.newWorker();
                workerThread = new Thread(worker, "sichter-worker");
                probe = new LocalWorkerProbe(worker);
                onSubmit = worker::wakeUp;
            } else {
                probe = new SystemdStatusProbe(config.settings().workerUnit());
            }
            GatewayServer gateway = runtime.gateway(probe, onSubmit);
            var address = gateway.start(bind, port);
            if (workerThread != null) {
                workerThread.start();
            }
            System.out.println("Sichter gateway listening on http://" + address.getHostString() + ":" + address.getPort()
                    + "/ (worker=" + (withWorker ? "embedded" : "external") + ")");

            CountDownLatch stopped = new CountDownLatch(1);
            WorkerLoop embedded = worker;
            Thread embeddedThread = workerThread;
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                gateway.stop();
                if (embedded != null) {
                    embedded.stop();
                    try {
                        embeddedThread.join(30_000L);
                        if (embeddedThread.isAlive()) {
                            embeddedThread.interrupt();
                            embeddedThread.join(5_000L);
                        }
                    } catch (InterruptedException ignored) {
                        Thread.currentThread().interrupt();
                    }
                }
                stopped.countDown();
            }, "sichter-shutdown-hook"));
            stopped.await();
            return 0;
        }
    }

    @Command(name = "watch", description = "Follow a gateway's events, falling back to polling when the stream is down")
    static final class WatchCommand implements Callable<Integer> {
        @Option(names = {"--url"}, defaultValue = "http://127.0.0.1:8765", description = "Gateway base URL")
        String url;

        @Option(names = {"--api-key"}, description = "API key sent as X-API-Key")
        String apiKey;

        @Option(names = {"--poll-ms"}, defaultValue = "5000", description = "Poll interval while the stream is down")
        long pollMs;

        @Option(names = {"--retry-ms"}, defaultValue = "10000", description = "Stream reconnect interval")
        long retryMs;

        @Option(names = {"--seconds"}, defaultValue = "0", description = "Stop after this many seconds (0 = until interrupted)")
        long seconds;

        @Override
        public Integer call() throws Exception {
            URI base = URI.create(url);
            HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
            long deadline = seconds <= 0 ? Long.MAX_VALUE : System.currentTimeMillis() + seconds * 1000L;
            try (EventStreamAdapter adapter = new EventStreamAdapter(
                    new SseEventSource(client, base, 50, apiKey),
                    new PollingEventSource(client, base, Duration.ofMillis(pollMs), EventStreamAdapter.DEFAULT_MAX_EVENTS, apiKey),
                    Duration.ofMillis(retryMs),
                    EventStreamAdapter.DEFAULT_MAX_EVENTS)) {
                adapter.start();
                long printedSeq = 0L;
                Boolean lastConnected = null;
                while (System.currentTimeMillis() < deadline) {
                    StreamState state = adapter.observe();
                    if (lastConnected == null || lastConnected != state.connected()) {
                        Map<String, Object> status = new LinkedHashMap<>();
                        status.put("connected", state.connected());
                        status.put("error", state.error());
                        System.err.println(Jsons.toCompactJson(status));
                        lastConnected = state.connected();
                    }
                    for (Event event : state.events()) {
                        if (event.seq() > printedSeq) {
                            System.out.println(Jsons.toCompactJson(event));
                            printedSeq = event.seq();
                        }
                    }
                    Thread.sleep(500L);
                }
            }
            return 0;
        }
    }
}
