package io.sichter.runtime;

import io.sichter.collaborator.CheckRunner;
import io.sichter.collaborator.PrPublisher;
import io.sichter.collaborator.ScriptCheckRunner;
import io.sichter.collaborator.ScriptPrPublisher;
import io.sichter.collaborator.WorkerStatusProbe;
import io.sichter.config.SichterConfig;
import io.sichter.config.SichterSettings;
import io.sichter.error.StorageException;
import io.sichter.events.EventLog;
import io.sichter.gateway.GatewayServer;
import io.sichter.model.Job;
import io.sichter.model.JobSpec;
import io.sichter.overview.OverviewAggregator;
import io.sichter.queue.JobQueue;
import io.sichter.storage.Database;
import io.sichter.storage.JobStore;
import io.sichter.worker.WorkerLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SichterRuntime {
    private static final Logger log = LoggerFactory.getLogger(SichterRuntime.class);

    private final SichterConfig config;
    private final JobQueue queue;
    private final Database database;
    private final JobStore store;
    private EventLog events;

    public SichterRuntime(SichterConfig config) {
        this.config = config;
        this.queue = new JobQueue(config);
        this.database = new Database(config);
        this.store = new JobStore(database);
    }

    public synchronized void init() {
        queue.init();
        database.init();
        if (events == null) {
            events = new EventLog(config.eventsFile(), config.tuning().eventWindow());
        }
    }

    public SichterConfig config() {
        return config;
    }

    public JobQueue queue() {
        return queue;
    }

    public JobStore store() {
        return store;
    }

    public synchronized EventLog events() {
        if (events == null) {
            throw new IllegalStateException("runtime not initialized");
        }
        return events;
    }

    public Job submit(JobSpec spec) {
        Job job = queue.submit(spec);
        try {
            store.recordQueued(job);
        } catch (StorageException e) {
            log.warn("Job {} enqueued but not recorded in the ledger: {}", job.id(), e.getMessage());
        }
        return job;
    }

    public WorkerLoop newWorker() {
        SichterSettings settings = config.settings();
        return newWorker(
                new ScriptCheckRunner(settings.checkCommand(), settings.org(), settings.commandTimeoutMs()),
                new ScriptPrPublisher(settings.prCommand(), settings.org(), settings.commandTimeoutMs())
        );
    }

    public WorkerLoop newWorker(CheckRunner checkRunner, PrPublisher prPublisher) {
        return new WorkerLoop(config, queue, events(), store, checkRunner, prPublisher);
    }

    public OverviewAggregator overview(WorkerStatusProbe probe) {
        return new OverviewAggregator(queue, events(), probe);
    }

    public GatewayServer gateway(WorkerStatusProbe probe, Runnable onSubmit) {
        return new GatewayServer(config, queue, events(), store, overview(probe), onSubmit);
    }
}
