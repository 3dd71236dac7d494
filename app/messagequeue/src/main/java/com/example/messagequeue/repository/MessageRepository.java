/*
 * どこで: MessageQueue データアクセス
 * 何を: message_queue テーブルの登録/リース/削除/集計を担う
 * なぜ: リース判定を DB 時刻と行ロックに委ねるため
 */
package com.example.messagequeue.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;

import com.example.messagequeue.config.MessageQueueProperties;
import com.example.messagequeue.model.LeasedMessage;
import com.example.messagequeue.model.MessageRecord;
import com.example.messagequeue.model.QueueStats;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Row-level access to the message table. Every statement evaluates time with the database's
 * {@code now()}, so lease expiry does not depend on the clocks of the consumer processes.
 *
 * <p>Callers own the transaction boundary; {@link #selectEligibleForUpdate} only holds its row
 * lock for the duration of the surrounding transaction.
 */
@Repository
public class MessageRepository {

  private static final String COLUMNS =
      "id, queue_name, payload, created_at, leased_at, lease_expires_at, lease_seconds, locked";

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final String tableName;

  public MessageRepository(
      NamedParameterJdbcTemplate jdbcTemplate, MessageQueueProperties properties) {
    this.jdbcTemplate = jdbcTemplate;
    this.tableName = MessageSchemaRepository.validTableName(properties.tableName());
  }

  public long insert(String queueName, String payload, int leaseSeconds) {
    final String sql =
        """
        INSERT INTO %s (queue_name, payload, lease_seconds)
        VALUES (:queueName, :payload, :leaseSeconds)
        RETURNING id
        """
            .formatted(tableName);
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("queueName", queueName)
            .addValue("payload", PayloadCodec.encode(payload), Types.BINARY)
            .addValue("leaseSeconds", leaseSeconds);
    final Long id = jdbcTemplate.queryForObject(sql, params, Long.class);
    if (id == null) {
      throw new IllegalStateException("insert returned no id queue=" + queueName);
    }
    return id;
  }

  public Optional<LeasedMessage> selectEligibleForUpdate(String queueName) {
    // 未ロック行と lease 切れ行を同列に扱い、id 昇順の先頭だけをロックする
    final String sql =
        """
        SELECT id, payload
        FROM %s
        WHERE queue_name = :queueName
          AND (NOT locked OR lease_expires_at <= now())
        ORDER BY id
        LIMIT 1
        FOR UPDATE SKIP LOCKED
        """
            .formatted(tableName);
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("queueName", queueName);
    final List<LeasedMessage> rows =
        jdbcTemplate.query(
            sql,
            params,
            (rs, rowNum) ->
                new LeasedMessage(rs.getLong("id"), PayloadCodec.decode(rs.getBytes("payload"))));
    return rows.stream().findFirst();
  }

  public int markLeased(long id) {
    final String sql =
        """
        UPDATE %s
        SET locked = TRUE,
            leased_at = now(),
            lease_expires_at = now() + lease_seconds * INTERVAL '1 second'
        WHERE id = :id
        """
            .formatted(tableName);
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("id", id));
  }

  public int updateLeaseExpiry(long id, int leaseSeconds) {
    final String sql =
        """
        UPDATE %s
        SET lease_expires_at = now() + :leaseSeconds * INTERVAL '1 second'
        WHERE id = :id
        """
            .formatted(tableName);
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("id", id).addValue("leaseSeconds", leaseSeconds);
    return jdbcTemplate.update(sql, params);
  }

  public int deleteById(long id) {
    final String sql = "DELETE FROM %s WHERE id = :id".formatted(tableName);
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("id", id));
  }

  public int deleteByQueueName(String queueName) {
    final String sql = "DELETE FROM %s WHERE queue_name = :queueName".formatted(tableName);
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("queueName", queueName));
  }

  public Optional<MessageRecord> findById(long id) {
    final String sql = "SELECT %s FROM %s WHERE id = :id".formatted(COLUMNS, tableName);
    final List<MessageRecord> rows =
        jdbcTemplate.query(sql, new MapSqlParameterSource().addValue("id", id), this::mapRow);
    return rows.stream().findFirst();
  }

  public List<MessageRecord> findByQueueName(String queueName) {
    final String sql =
        """
        SELECT %s
        FROM %s
        WHERE queue_name = :queueName
        ORDER BY id
        """
            .formatted(COLUMNS, tableName);
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("queueName", queueName), this::mapRow);
  }

  public QueueStats countStats(String queueName) {
    final String sql =
        """
        SELECT COUNT(*) FILTER (WHERE NOT locked) AS unlocked,
               COUNT(*) FILTER (WHERE locked AND lease_expires_at > now()) AS leased,
               COUNT(*) FILTER (WHERE locked AND lease_expires_at <= now()) AS stale
        FROM %s
        WHERE queue_name = :queueName
        """
            .formatted(tableName);
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("queueName", queueName);
    return jdbcTemplate.queryForObject(
        sql,
        params,
        (rs, rowNum) -> {
          final long stale = rs.getLong("stale");
          return new QueueStats(
              queueName, rs.getLong("unlocked") + stale, rs.getLong("leased"), stale);
        });
  }

  private MessageRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new MessageRecord(
        rs.getLong("id"),
        rs.getString("queue_name"),
        PayloadCodec.decode(rs.getBytes("payload")),
        getInstant(rs, "created_at"),
        getInstant(rs, "leased_at"),
        getInstant(rs, "lease_expires_at"),
        rs.getInt("lease_seconds"),
        rs.getBoolean("locked"));
  }
}
