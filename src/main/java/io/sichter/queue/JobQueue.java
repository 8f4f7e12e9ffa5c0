package io.sichter.queue;

import io.sichter.config.SichterConfig;
import io.sichter.error.StorageException;
import io.sichter.error.ValidationException;
import io.sichter.model.Job;
import io.sichter.model.JobMode;
import io.sichter.model.JobSpec;
import io.sichter.model.JobType;
import io.sichter.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Durable FIFO of pending jobs, one JSON file per job.
 *
 * <p>Pending jobs live in {@code queue/<id>.json}. Claiming moves the file into
 * {@code queue/processing/}, so a second claimer (thread or process) can never see it again.
 * The file is deleted by {@link #remove(String)} once the worker has written the terminal
 * event, or moved back by {@link #release(String)} when a job is abandoned.
 */
public final class JobQueue {
    private static final Logger log = LoggerFactory.getLogger(JobQueue.class);
    private static final String SUFFIX = ".json";
    private static final Pattern JOB_ID = Pattern.compile("^[0-9]{13}-[0-9a-f]{32}$");
    private static final Pattern SAFE_ID = Pattern.compile("^[A-Za-z0-9_-][A-Za-z0-9_.-]*$");
    private static final Pattern REPO = Pattern.compile("^[A-Za-z0-9_.-]+(/[A-Za-z0-9_.-]+)?$");

    private final SichterConfig config;
    private final AtomicLong lastIdMillis = new AtomicLong(0L);

    public JobQueue(SichterConfig config) {
        this.config = config;
    }

    public void init() {
        try {
            Files.createDirectories(config.queueDir());
            Files.createDirectories(config.processingDir());
            Files.createDirectories(config.rejectedDir());
        } catch (IOException e) {
            throw new StorageException("Failed to initialize queue directories under " + config.queueDir(), e);
        }
    }

    public static boolean isValidJobId(String raw) {
        return raw != null && JOB_ID.matcher(raw).matches();
    }

    public Job submit(JobSpec spec) {
        Job job = validate(spec, newJobId(), Instant.now());
        Path target = config.queueDir().resolve(job.id() + SUFFIX);
        Path temp = config.queueDir().resolve(job.id() + SUFFIX + ".tmp");
        try {
            byte[] bytes = Jsons.toJson(job).getBytes(StandardCharsets.UTF_8);
            try (FileChannel channel = FileChannel.open(temp,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            moveAtomically(temp, target);
            syncDirectory(config.queueDir());
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new StorageException("Failed to enqueue job: " + job.id(), e);
        }
        log.info("Enqueued job {} type={} mode={} repo={}", job.id(), job.type().wireName(),
                job.mode().wireName(), job.repo());
        return job;
    }

    public List<Job> peekAll() {
        List<Job> out = new ArrayList<>();
        for (Path file : listJobFiles(config.queueDir())) {
            try {
                out.add(readJob(file));
            } catch (NoSuchFileException ignored) {
                // Claimed between listing and reading.
            } catch (IOException e) {
                log.warn("Skipping unreadable job file {}: {}", file.getFileName(), e.getMessage());
            }
        }
        return out;
    }

    public int size() {
        return listJobFiles(config.queueDir()).size();
    }

    public List<Job> inFlight() {
        List<Job> out = new ArrayList<>();
        for (Path file : listJobFiles(config.processingDir())) {
            try {
                out.add(readJob(file));
            } catch (IOException e) {
                log.warn("Skipping unreadable in-flight job file {}: {}", file.getFileName(), e.getMessage());
            }
        }
        return out;
    }

    public synchronized Optional<ClaimedJob> claimNext() {
        for (Path candidate : listJobFiles(config.queueDir())) {
            Path claimed = config.processingDir().resolve(candidate.getFileName().toString());
            try {
                moveAtomically(candidate, claimed);
            } catch (NoSuchFileException lost) {
                // Another process claimed it first.
                continue;
            } catch (IOException e) {
                throw new StorageException("Failed to claim job file: " + candidate, e);
            }
            try {
                return Optional.of(new ClaimedJob(readJob(claimed), claimed));
            } catch (IOException e) {
                log.warn("Rejecting malformed job file {}: {}", claimed.getFileName(), e.getMessage());
                quarantine(claimed);
            }
        }
        return Optional.empty();
    }

    public void remove(String jobId) {
        String name = fileName(jobId);
        try {
            Files.deleteIfExists(config.processingDir().resolve(name));
            Files.deleteIfExists(config.queueDir().resolve(name));
        } catch (IOException e) {
            throw new StorageException("Failed to remove job: " + jobId, e);
        }
    }

    public boolean release(String jobId) {
        String name = fileName(jobId);
        Path claimed = config.processingDir().resolve(name);
        if (!Files.exists(claimed)) {
            return false;
        }
        try {
            moveAtomically(claimed, config.queueDir().resolve(name));
            syncDirectory(config.queueDir());
            return true;
        } catch (IOException e) {
            throw new StorageException("Failed to release job: " + jobId, e);
        }
    }

    public int recoverAbandoned() {
        int recovered = 0;
        for (Path file : listJobFiles(config.processingDir())) {
            String name = file.getFileName().toString();
            try {
                moveAtomically(file, config.queueDir().resolve(name));
                recovered++;
            } catch (IOException e) {
                throw new StorageException("Failed to recover abandoned job: " + name, e);
            }
        }
        if (recovered > 0) {
            log.warn("Recovered {} abandoned job(s) from {}", recovered, config.processingDir());
        }
        return recovered;
    }

    Job validate(JobSpec spec, String id, Instant now) {
        if (spec == null) {
            throw new ValidationException("Job payload is required");
        }
        JobType type;
        try {
            type = JobType.fromString(spec.type());
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }
        JobMode mode;
        if (spec.mode() == null || spec.mode().isBlank()) {
            mode = type == JobType.SCAN_ALL ? JobMode.ALL : JobMode.CHANGED;
        } else {
            try {
                mode = JobMode.fromString(spec.mode());
            } catch (IllegalArgumentException e) {
                throw new ValidationException(e.getMessage());
            }
        }
        if (type == JobType.SCAN_ALL && mode != JobMode.ALL) {
            throw new ValidationException("ScanAll requires mode=all");
        }
        String repo = normalizeRepo(spec.repo());
        boolean autoPr = spec.autoPr() == null || spec.autoPr();
        return new Job(id, type, mode, repo, autoPr, now);
    }

    private static String normalizeRepo(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String trimmed = raw.trim();
        if (!REPO.matcher(trimmed).matches() || trimmed.contains("..")) {
            throw new ValidationException("Invalid repo name format: " + raw);
        }
        return trimmed;
    }

    private String newJobId() {
        long now = System.currentTimeMillis();
        long millis = lastIdMillis.updateAndGet(prev -> Math.max(prev + 1L, now));
        String random = UUID.randomUUID().toString().replace("-", "").toLowerCase(Locale.ROOT);
        return String.format(Locale.ROOT, "%013d-%s", millis, random);
    }

    private Job readJob(Path file) throws IOException {
        Job job = Jsons.mapper().readValue(file.toFile(), Job.class);
        if (job == null || job.id() == null || job.type() == null || job.mode() == null) {
            throw new IOException("missing required job fields");
        }
        if (!file.getFileName().toString().equals(job.id() + SUFFIX)) {
            throw new IOException("job id does not match file name");
        }
        return job;
    }

    private void quarantine(Path file) {
        try {
            Files.move(file, config.rejectedDir().resolve(file.getFileName().toString()),
                    StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StorageException("Failed to quarantine malformed job file: " + file, e);
        }
    }

    private static String fileName(String jobId) {
        if (jobId == null || !SAFE_ID.matcher(jobId).matches() || jobId.contains("..")) {
            throw new ValidationException("Invalid job id: " + jobId);
        }
        return jobId + SUFFIX;
    }

    private static void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target);
        }
    }

    static boolean syncDirectory(Path dir) {
        try (FileChannel channel = FileChannel.open(dir, StandardOpenOption.READ)) {
            channel.force(true);
            return true;
        } catch (IOException e) {
            log.debug("Directory sync unavailable for {}: {}", dir, e.getMessage());
            return false;
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("Could not delete temp file {}: {}", path, e.getMessage());
        }
    }

    private static List<Path> listJobFiles(Path dir) {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    files.add(path);
                }
            }
        } catch (NoSuchFileException e) {
            return files;
        } catch (IOException e) {
            throw new StorageException("Failed to list job files in " + dir, e);
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return files;
    }

    public record ClaimedJob(Job job, Path processingFile) {
    }
}
