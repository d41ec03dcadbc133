package io.recordqueue.jdbc.dead;

import io.recordqueue.Job;
import io.recordqueue.JobContext;
import io.recordqueue.JobData;
import io.recordqueue.JobPriority;
import io.recordqueue.dead.DeadJob;
import io.recordqueue.jdbc.ConnectionProvider;
import io.recordqueue.jdbc.JdbcTemplate;
import io.recordqueue.jdbc.TableNames;
import io.recordqueue.spi.DeadLetterSink;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * {@link DeadLetterSink} that persists dead jobs to a table, so that failures survive a
 * restart and can be inspected or replayed by hand.
 *
 * <p>Each dead job is one row, keyed by job id. Long error messages are truncated.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * var sink = new JdbcDeadLetterSink(new DataSourceConnectionProvider(dataSource));
 * RecordQueue queue = RecordQueue.builder()
 *     .recordStore(store)
 *     .deadLetterSink(sink)
 *     .build();
 *
 * for (DeadJob dead : sink.list(50)) {
 *     System.out.println(dead.job().id() + ": " + dead.error());
 * }
 * }</pre>
 */
public final class JdbcDeadLetterSink implements DeadLetterSink {
  private static final int MAX_ERROR_LENGTH = 4000;

  private static final String COLUMNS = "job_id, action, priority, owner_id, target_id, payload, " +
      "acting_admin_id, reason, attempts, error_type, error, enqueued_at, failed_at";

  private static final JdbcTemplate.RowMapper<DeadJob> DEAD_JOB_ROW_MAPPER = rs -> {
    String actingAdminId = rs.getString("acting_admin_id");
    String reason = rs.getString("reason");
    JobContext context = actingAdminId == null && reason == null
        ? null : JobContext.ofAdmin(actingAdminId, reason);
    JobData data = JobData.builder()
        .action(rs.getString("action"))
        .ownerId(rs.getString("owner_id"))
        .targetId(rs.getString("target_id"))
        .payloadJson(rs.getString("payload"))
        .context(context)
        .build();
    Job job = new Job(rs.getString("job_id"), data, JobPriority.valueOf(rs.getString("priority")),
        JdbcTemplate.instant(rs, "enqueued_at"), rs.getInt("attempts"));
    return new DeadJob(job, rs.getString("error_type"), rs.getString("error"),
        JdbcTemplate.instant(rs, "failed_at"));
  };

  private final ConnectionProvider connectionProvider;
  private final String tableName;

  public JdbcDeadLetterSink(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.DEFAULT_DEAD_JOB_TABLE);
  }

  public JdbcDeadLetterSink(ConnectionProvider connectionProvider, String tableName) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.tableName = TableNames.validate(tableName);
  }

  @Override
  public void accept(DeadJob deadJob) {
    Job job = deadJob.job();
    JobData data = job.data();
    JobContext context = data.context();
    String sql = "INSERT INTO " + tableName + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?)";
    withConnection("insert dead job", conn -> JdbcTemplate.update(conn, sql,
        job.id(), data.action(), job.priority().name(), data.ownerId(), data.targetId(),
        data.payloadJson(), context == null ? null : context.actingAdminId(),
        context == null ? null : context.reason(), job.attempts(), deadJob.errorType(),
        truncateError(deadJob.error()), job.enqueuedAt(), deadJob.failedAt()));
  }

  /**
   * Returns the most recent dead jobs, newest first.
   *
   * @param limit maximum rows
   * @return dead jobs
   */
  public List<DeadJob> list(int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName + " ORDER BY failed_at DESC LIMIT ?";
    return withConnection("list dead jobs", conn -> JdbcTemplate.query(conn, sql, DEAD_JOB_ROW_MAPPER, limit));
  }

  public int count() {
    String sql = "SELECT COUNT(*) AS n FROM " + tableName;
    return withConnection("count dead jobs", conn ->
        JdbcTemplate.query(conn, sql, rs -> rs.getInt("n")).get(0));
  }

  /**
   * Deletes a dead job row, typically after it has been re-enqueued.
   *
   * @param jobId the job id
   * @return {@code true} if a row was deleted
   */
  public boolean delete(String jobId) {
    String sql = "DELETE FROM " + tableName + " WHERE job_id=?";
    return withConnection("delete dead job", conn -> JdbcTemplate.update(conn, sql, jobId)) > 0;
  }

  private <T> T withConnection(String action, Function<Connection, T> op) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return op.apply(conn);
    } catch (SQLException e) {
      throw JdbcTemplate.translate(action, e);
    }
  }

  private static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
