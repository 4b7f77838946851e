package io.github.samzhu.metering.function;

import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cloud.function.cloudevent.CloudEventMessageUtils;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.Message;

import io.github.samzhu.metering.dto.DeadLetterEvent;
import io.github.samzhu.metering.service.DeadLetterService;

/**
 * 死信佇列消費者函式配置。
 *
 * <p>使用 Spring Cloud Function 程式設計模型，消費 {@code job-dead-letters} 上的 CloudEvents。
 * CloudEvent attributes 位於 Message Headers，payload 自動轉換為 {@link DeadLetterEvent}。
 *
 * <p>Binding name: {@code deadLetterConsumer-in-0}
 *
 * @see <a href="https://docs.spring.io/spring-cloud-stream/reference/spring-cloud-stream/producing-and-consuming-messages.html">Spring Cloud Stream Function Model</a>
 */
@Configuration
public class DeadLetterFunction {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterFunction.class);

    private final DeadLetterService deadLetterService;

    public DeadLetterFunction(DeadLetterService deadLetterService) {
        this.deadLetterService = deadLetterService;
    }

    /**
     * 死信事件消費者 Bean。
     *
     * <p>保存死信紀錄並發出告警。死信不會再重試。
     *
     * <p>錯誤處理：不重新拋出例外，避免訊息重複投遞迴圈。
     *
     * @return 死信事件消費者
     */
    @Bean
    public Consumer<Message<DeadLetterEvent>> deadLetterConsumer() {
        return message -> {
            String eventId = CloudEventMessageUtils.getId(message);
            try {
                DeadLetterEvent event = message.getPayload();
                log.debug("Dead-letter CloudEvent received: id={}, type={}, jobId={}",
                    eventId, CloudEventMessageUtils.getType(message), event.jobId());

                deadLetterService.record(event, eventId);
            } catch (Exception e) {
                log.error("Failed to record dead-letter event: id={}, error={}", eventId, e.getMessage(), e);
                // 不重新拋出例外，避免訊息重複投遞
            }
        };
    }
}
