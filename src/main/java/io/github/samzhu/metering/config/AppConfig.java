package io.github.samzhu.metering.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 應用程式主要配置類別。
 *
 * <p>啟用 {@link MeteringProperties} 的型別安全配置綁定，並提供 UTC {@link Clock}，
 * 所有計費週期、冪等期限與重試排程都由此時鐘取得目前時間。
 *
 * @see MeteringProperties
 */
@Configuration
@EnableConfigurationProperties(MeteringProperties.class)
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
