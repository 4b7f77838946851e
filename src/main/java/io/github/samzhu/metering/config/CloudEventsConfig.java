package io.github.samzhu.metering.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.cloudevents.spring.messaging.CloudEventMessageConverter;

/**
 * CloudEvents 訊息轉換器配置。
 *
 * <p>死信事件以 CloudEvents 格式發送到 {@code job-dead-letters}，
 * attributes (id, type, source, subject, time) 放在 Message Headers，
 * data 為 {@link io.github.samzhu.metering.dto.DeadLetterEvent} 的 JSON。
 * 註冊 {@link CloudEventMessageConverter} 使 Spring Cloud Stream 也能解析
 * Structured Mode ({@code application/cloudevents+json}) 的訊息。
 *
 * @see <a href="https://cloudevents.github.io/sdk-java/spring.html">CloudEvents Java SDK - Spring Integration</a>
 */
@Configuration
public class CloudEventsConfig {

    @Bean
    public CloudEventMessageConverter cloudEventMessageConverter() {
        return new CloudEventMessageConverter();
    }
}
