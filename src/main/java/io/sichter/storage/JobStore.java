package io.sichter.storage;

import io.sichter.error.StorageException;
import io.sichter.model.Job;
import io.sichter.model.JobRecord;
import io.sichter.model.JobStatus;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public final class JobStore {
    private static final int MAX_TEXT_CHARS = 8_192;

    private final Database database;

    public JobStore(Database database) {
        this.database = database;
    }

    public void recordQueued(Job job) {
        long now = Instant.now().toEpochMilli();
        String sql = """
                INSERT INTO jobs(job_id,type,mode,repo,auto_pr,status,enqueued_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?)
                ON CONFLICT(job_id) DO NOTHING
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, job.id());
            ps.setString(2, job.type().wireName());
            ps.setString(3, job.mode().wireName());
            ps.setString(4, job.repo());
            ps.setInt(5, job.autoPr() ? 1 : 0);
            ps.setString(6, JobStatus.QUEUED.name());
            ps.setLong(7, job.enqueuedAt() == null ? now : job.enqueuedAt().toEpochMilli());
            ps.setLong(8, now);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to record queued job " + job.id(), e);
        }
    }

    public void markRunning(Job job) {
        recordQueued(job);
        long now = Instant.now().toEpochMilli();
        String sql = "UPDATE jobs SET status=?,started_at_ms=?,finished_at_ms=NULL,updated_at_ms=? WHERE job_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, JobStatus.RUNNING.name());
            ps.setLong(2, now);
            ps.setLong(3, now);
            ps.setString(4, job.id());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to mark job running " + job.id(), e);
        }
    }

    public void markFinished(String jobId, JobStatus status, String output, String error) {
        long now = Instant.now().toEpochMilli();
        String sql = "UPDATE jobs SET status=?,output=?,last_error=?,finished_at_ms=?,updated_at_ms=? WHERE job_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, status.name());
            setText(ps, 2, output);
            setText(ps, 3, error);
            if (status == JobStatus.ABANDONED) {
                ps.setNull(4, Types.INTEGER);
            } else {
                ps.setLong(4, now);
            }
            ps.setLong(5, now);
            ps.setString(6, jobId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to mark job finished " + jobId, e);
        }
    }

    public Optional<JobRecord> find(String jobId) {
        String sql = """
                SELECT job_id,type,mode,repo,auto_pr,status,last_error,output,
                       enqueued_at_ms,started_at_ms,finished_at_ms,updated_at_ms
                FROM jobs WHERE job_id=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new JobRecord(
                        rs.getString("job_id"), rs.getString("type"), rs.getString("mode"),
                        rs.getString("repo"), rs.getInt("auto_pr") != 0, rs.getString("status"),
                        rs.getString("last_error"), rs.getString("output"),
                        rs.getLong("enqueued_at_ms"), nullableLong(rs, "started_at_ms"),
                        nullableLong(rs, "finished_at_ms"), rs.getLong("updated_at_ms")
                ));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read job " + jobId, e);
        }
    }

    public Map<String, Long> countByStatus() {
        Map<String, Long> out = new LinkedHashMap<>();
        for (JobStatus status : JobStatus.values()) {
            out.put(status.name(), 0L);
        }
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT status, COUNT(*) AS n FROM jobs GROUP BY status");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.put(rs.getString("status"), rs.getLong("n"));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to count jobs by status", e);
        }
        return out;
    }

    private static void setText(PreparedStatement ps, int index, String value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
            return;
        }
        ps.setString(index, value.length() <= MAX_TEXT_CHARS ? value : value.substring(0, MAX_TEXT_CHARS) + "...");
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }
}
