/*
 * どこで: MessageQueue アプリのスモークテスト
 * 何を: Spring コンテキストの起動と起動時テーブル作成を確認する
 * なぜ: 主要な構成が破壊されていないことを担保するため
 */
package com.example.messagequeue;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.messagequeue.repository.MessageSchemaRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class MessageQueueApplicationTests extends AbstractPostgresContainerTest {

  @Autowired private MessageSchemaRepository schemaRepository;

  @Test
  void contextLoadsAndCreatesTable() {
    assertThat(schemaRepository.exists()).isTrue();
  }
}
