package io.github.samzhu.metering.function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.cloud.function.cloudevent.CloudEventMessageUtils;
import org.springframework.cloud.stream.binder.test.InputDestination;
import org.springframework.cloud.stream.binder.test.TestChannelBinderConfiguration;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.util.MimeTypeUtils;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.metering.dto.DeadLetterEvent;
import io.github.samzhu.metering.dto.TraceContext;
import io.github.samzhu.metering.service.DeadLetterPublisher;
import io.github.samzhu.metering.service.DeadLetterService;

/**
 * DeadLetterFunction 整合測試，使用 Spring Cloud Stream Test Binder。
 *
 * <p>模擬 Spring Cloud Stream 解析 CloudEvent 之後交給消費者的訊息格式：
 * attributes 位於 headers，payload 僅為 data。
 *
 * @see <a href="https://docs.spring.io/spring-cloud-stream/reference/spring-cloud-stream/spring_integration_test_binder.html">Test Binder</a>
 */
class DeadLetterFunctionTest {

    private static ConfigurableApplicationContext context;
    private static InputDestination inputDestination;
    private static DeadLetterService mockDeadLetterService;
    private static ObjectMapper objectMapper;

    @BeforeAll
    static void setupContext() {
        mockDeadLetterService = mock(DeadLetterService.class);

        context = new SpringApplicationBuilder(
            TestChannelBinderConfiguration.getCompleteConfiguration(TestConfig.class))
            .web(WebApplicationType.NONE)
            .run(
                "--spring.cloud.function.definition=deadLetterConsumer",
                "--spring.cloud.stream.default-binder=integration",
                "--spring.jmx.enabled=false"
            );

        inputDestination = context.getBean(InputDestination.class);
        objectMapper = context.getBean(ObjectMapper.class);
    }

    @AfterAll
    static void closeContext() {
        if (context != null) {
            context.close();
        }
    }

    @BeforeEach
    void resetMock() {
        reset(mockDeadLetterService);
    }

    @Test
    void shouldRecordDeadLetterEvent() throws Exception {
        // Given
        Instant deadLetteredAt = Instant.parse("2025-03-01T12:00:00Z");
        DeadLetterEvent event = new DeadLetterEvent(
            "a1b2c3d4e5f60718",
            "scans",
            Map.of("orgId", 42, "model", "perplexity-sonar"),
            "IllegalStateException: upstream unavailable",
            3,
            3,
            "scan:42:client-key-000001",
            new TraceContext("req-123", "user-abc", 42L),
            deadLetteredAt);
        String eventId = UUID.randomUUID().toString();

        // When
        inputDestination.send(cloudEvent(event, eventId));

        // Then
        ArgumentCaptor<DeadLetterEvent> captor = ArgumentCaptor.forClass(DeadLetterEvent.class);
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
            verify(mockDeadLetterService, atLeastOnce()).record(captor.capture(), eq(eventId)));

        DeadLetterEvent received = captor.getValue();
        assertThat(received.jobId()).isEqualTo("a1b2c3d4e5f60718");
        assertThat(received.queue()).isEqualTo("scans");
        assertThat(received.retryCount()).isEqualTo(3);
        assertThat(received.failureReason()).isEqualTo("IllegalStateException: upstream unavailable");
        assertThat(received.trace().requestId()).isEqualTo("req-123");
        assertThat(received.trace().orgId()).isEqualTo(42L);
        assertThat(received.deadLetteredAt()).isEqualTo(deadLetteredAt);
    }

    @Test
    void shouldKeepConsumingWhenRecordFails() throws Exception {
        // Given: 第一則保存失敗
        when(mockDeadLetterService.record(any(), any()))
            .thenThrow(new IllegalStateException("mongo unavailable"))
            .thenReturn(null);
        DeadLetterEvent first = new DeadLetterEvent("job-first-000001", "pages", Map.of(), "boom", 3, 3,
            "page:1:key-first-0000001", TraceContext.empty(), Instant.now());
        DeadLetterEvent second = new DeadLetterEvent("job-second-00001", "pages", Map.of(), "boom", 3, 3,
            "page:1:key-second-000001", TraceContext.empty(), Instant.now());

        // When
        inputDestination.send(cloudEvent(first, UUID.randomUUID().toString()));
        inputDestination.send(cloudEvent(second, UUID.randomUUID().toString()));

        // Then: 例外不會中斷消費
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
            verify(mockDeadLetterService, times(2)).record(any(), any()));
    }

    private static Message<byte[]> cloudEvent(DeadLetterEvent event, String eventId) throws Exception {
        return MessageBuilder.withPayload(objectMapper.writeValueAsBytes(event))
            .setHeader(MessageHeaders.CONTENT_TYPE, MimeTypeUtils.APPLICATION_JSON)
            .setHeader(CloudEventMessageUtils.ID, eventId)
            .setHeader(CloudEventMessageUtils.SOURCE, DeadLetterPublisher.EVENT_SOURCE)
            .setHeader(CloudEventMessageUtils.TYPE, DeadLetterPublisher.EVENT_TYPE)
            .setHeader(CloudEventMessageUtils.SUBJECT, event.jobId())
            .setHeader(CloudEventMessageUtils.TIME, OffsetDateTime.now())
            .setHeader(CloudEventMessageUtils.SPECVERSION, "1.0")
            .build();
    }

    @Configuration
    @EnableAutoConfiguration(exclude = {
        MongoAutoConfiguration.class,
        MongoDataAutoConfiguration.class
    })
    @Import(DeadLetterFunction.class)
    static class TestConfig {

        @Bean
        public DeadLetterService deadLetterService() {
            return mockDeadLetterService;
        }
    }
}
