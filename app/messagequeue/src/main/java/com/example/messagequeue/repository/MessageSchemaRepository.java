/*
 * どこで: MessageQueue データアクセス
 * 何を: message_queue テーブルとインデックスの作成/削除を担う
 * なぜ: キューの管理操作を冪等な DDL で提供するため
 */
package com.example.messagequeue.repository;

import com.example.messagequeue.config.MessageQueueProperties;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class MessageSchemaRepository {

  private static final Logger logger = LoggerFactory.getLogger(MessageSchemaRepository.class);
  private static final Pattern TABLE_NAME = Pattern.compile("^[a-zA-Z0-9_]+$");

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final String tableName;

  public MessageSchemaRepository(
      NamedParameterJdbcTemplate jdbcTemplate, MessageQueueProperties properties) {
    this.jdbcTemplate = jdbcTemplate;
    this.tableName = validTableName(properties.tableName());
  }

  public void create() {
    // SKIP LOCKED でのリース取得は (queue_name, id) の索引順に走査する
    final String createTable =
        """
        CREATE TABLE IF NOT EXISTS %s (
          id BIGSERIAL PRIMARY KEY,
          queue_name VARCHAR(200) NOT NULL,
          payload BYTEA,
          created_at TIMESTAMPTZ NOT NULL DEFAULT now(),
          leased_at TIMESTAMPTZ,
          lease_expires_at TIMESTAMPTZ,
          lease_seconds INTEGER NOT NULL,
          locked BOOLEAN NOT NULL DEFAULT FALSE
        )
        """
            .formatted(tableName);
    final String createIndex =
        "CREATE INDEX IF NOT EXISTS %s_queue_name_id_idx ON %s (queue_name, id)"
            .formatted(tableName, tableName);
    jdbcTemplate.getJdbcTemplate().execute(createTable);
    jdbcTemplate.getJdbcTemplate().execute(createIndex);
    logger.info("message queue table ensured table={}", tableName);
  }

  public void drop() {
    jdbcTemplate.getJdbcTemplate().execute("DROP TABLE IF EXISTS " + tableName);
    logger.info("message queue table dropped table={}", tableName);
  }

  public boolean exists() {
    final String sql = "SELECT to_regclass(:tableName) IS NOT NULL";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("tableName", tableName);
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  public String tableName() {
    return tableName;
  }

  // テーブル名は SQL に直接埋め込むため、英数字とアンダースコアのみ許可する
  static String validTableName(String tableName) {
    if (tableName == null || !TABLE_NAME.matcher(tableName).matches()) {
      throw new IllegalArgumentException(
          "table name must match " + TABLE_NAME.pattern() + ": " + tableName);
    }
    return tableName;
  }
}
