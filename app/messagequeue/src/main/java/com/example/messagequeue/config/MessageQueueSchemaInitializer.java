/*
 * どこで: MessageQueue 起動処理
 * 何を: 設定に応じて message_queue テーブルを drop/create する
 * なぜ: 監視ワーカーが動き出す前にテーブルを用意するため
 */
package com.example.messagequeue.config;

import com.example.messagequeue.repository.MessageSchemaRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class MessageQueueSchemaInitializer implements SmartInitializingSingleton {

  private static final Logger logger = LoggerFactory.getLogger(MessageQueueSchemaInitializer.class);

  private final MessageSchemaRepository schemaRepository;
  private final MessageQueueProperties properties;

  @Override
  public void afterSingletonsInstantiated() {
    final MessageQueueProperties.Schema schema = properties.schema();
    if (schema.dropOnStartup()) {
      logger.warn("message queue table dropped on startup table={}", properties.tableName());
      schemaRepository.drop();
    }
    if (schema.createOnStartup()) {
      schemaRepository.create();
    }
  }
}
