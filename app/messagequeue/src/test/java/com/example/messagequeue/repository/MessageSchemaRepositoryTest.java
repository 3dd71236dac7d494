/*
 * どこで: MessageQueue テスト
 * 何を: テーブル作成/削除の冪等性を検証する
 * なぜ: 管理操作を何度呼んでも失敗しないことを保証するため
 */
package com.example.messagequeue.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.messagequeue.AbstractPostgresContainerTest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class MessageSchemaRepositoryTest extends AbstractPostgresContainerTest {

  @Autowired private MessageSchemaRepository schemaRepository;
  @Autowired private MessageRepository messageRepository;

  @AfterEach
  void restoreTable() {
    // 他のテストクラスとコンテキストを共有するため、テーブルを必ず戻す
    schemaRepository.create();
  }

  @Test
  void createIsIdempotent() {
    schemaRepository.create();
    schemaRepository.create();

    assertThat(schemaRepository.exists()).isTrue();
  }

  @Test
  void dropIsIdempotentAndRemovesMessages() {
    messageRepository.insert("schema-drop", "payload", 30);

    schemaRepository.drop();
    schemaRepository.drop();

    assertThat(schemaRepository.exists()).isFalse();
    schemaRepository.create();
    assertThat(messageRepository.findByQueueName("schema-drop")).isEmpty();
  }

  @Test
  void tableNameRejectsSqlFragments() {
    assertThatThrownBy(() -> MessageSchemaRepository.validTableName("queue; DROP TABLE x"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> MessageSchemaRepository.validTableName(null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(MessageSchemaRepository.validTableName("message_queue_2")).isEqualTo("message_queue_2");
  }
}
