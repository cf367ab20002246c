/*
 * どこで: Milestone テスト基盤
 * 何を: Testcontainers(Postgres) と Flyway の共通設定を提供する
 * なぜ: 確保と LISTEN の挙動は PostgreSQL 固有で、実サーバが必要なため
 */
package com.example.milestone;

import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;

public abstract class AbstractPostgresContainerTest {

    // JVM 内で 1 つのコンテナを、キャッシュされた全 Spring コンテキストで使い回す
    protected static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    static {
        // @DynamicPropertySource が Testcontainers 拡張より先に動く場合があるため、ここで明示起動する
        POSTGRES.start();
    }

    @DynamicPropertySource
    static void registerProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);

        // 本番の migration に加え、他コンポーネントのテーブルと関数のスタブを流す
        registry.add("spring.flyway.enabled", () -> "true");
        registry.add("spring.flyway.locations", () -> "classpath:db/migration,classpath:db/testdata");
    }
}
