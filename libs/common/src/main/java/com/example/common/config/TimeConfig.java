/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: 処理時間の計測をテストで固定できるようにするため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  // リース期限は DB 時刻で判定するため、この Clock は計測専用
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
