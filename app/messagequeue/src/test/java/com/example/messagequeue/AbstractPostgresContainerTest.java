/*
 * どこで: MessageQueue テスト基盤
 * 何を: Testcontainers(Postgres) と DataSource の共通設定を提供する
 * なぜ: SKIP LOCKED と DB 時刻に依存するリース判定を実 DB で検証するため
 */
package com.example.messagequeue;

import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

// Docker が無い環境ではクラスごとスキップする
@Testcontainers(disabledWithoutDocker = true)
public abstract class AbstractPostgresContainerTest {

    // JVM 内のテスト全体で共通の Postgres コンテナを使い回し、起動コストを抑える
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    static {
        // Spring の @DynamicPropertySource は JUnit の Testcontainers 拡張より先に動く場合がある。
        // コンテキストキャッシュで接続情報が使い回されても DB が必ず起動済みになるよう、ここで明示起動する。
        POSTGRES.start();
    }

    @DynamicPropertySource
    static void registerProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);

        // テーブルは起動時に作成する
        registry.add("messagequeue.schema.create-on-startup", () -> "true");
        registry.add("messagequeue.schema.drop-on-startup", () -> "false");
    }
}
