package io.github.samzhu.metering.service;

import java.net.URI;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cloud.function.cloudevent.CloudEventMessageUtils;
import org.springframework.cloud.stream.function.StreamBridge;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.stereotype.Component;
import org.springframework.util.MimeTypeUtils;

import io.github.samzhu.metering.config.MeteringProperties;
import io.github.samzhu.metering.dto.DeadLetterEvent;

/**
 * 死信事件發送者。
 *
 * <p>以 CloudEvents Binary Mode 經 {@link StreamBridge} 發送到 {@code deadLetters-out-0}
 * (destination {@code job-dead-letters})：
 * <ul>
 *   <li>CloudEvent attributes → Message Headers</li>
 *   <li>{@link DeadLetterEvent} → JSON payload</li>
 * </ul>
 *
 * <p>訊息代理無法使用時直接寫入死信紀錄，工作本身已標記為 {@code DEAD_LETTERED}，不會遺失。
 */
@Component
public class DeadLetterPublisher {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterPublisher.class);

    public static final String EVENT_TYPE = "io.github.samzhu.metering.job.dead-lettered.v1";
    public static final URI EVENT_SOURCE = URI.create("urn:metering:job-dispatcher");

    private final StreamBridge streamBridge;
    private final DeadLetterService deadLetterService;
    private final String bindingName;
    private final Clock clock;

    public DeadLetterPublisher(
            StreamBridge streamBridge,
            DeadLetterService deadLetterService,
            MeteringProperties properties,
            Clock clock) {
        this.streamBridge = streamBridge;
        this.deadLetterService = deadLetterService;
        this.bindingName = properties.jobs().deadLetterBinding();
        this.clock = clock;
    }

    /**
     * 發送死信事件。
     *
     * @param event 死信事件
     * @return true 表示已交給訊息代理，false 表示改為直接寫入死信紀錄
     */
    public boolean publish(DeadLetterEvent event) {
        String eventId = UUID.randomUUID().toString();
        Message<DeadLetterEvent> message = MessageBuilder.withPayload(event)
            .setHeader(MessageHeaders.CONTENT_TYPE, MimeTypeUtils.APPLICATION_JSON)
            .setHeader(CloudEventMessageUtils.ID, eventId)
            .setHeader(CloudEventMessageUtils.SPECVERSION, "1.0")
            .setHeader(CloudEventMessageUtils.TYPE, EVENT_TYPE)
            .setHeader(CloudEventMessageUtils.SOURCE, EVENT_SOURCE)
            .setHeader(CloudEventMessageUtils.SUBJECT, event.jobId())
            .setHeader(CloudEventMessageUtils.TIME, OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC))
            .build();

        try {
            if (streamBridge.send(bindingName, message)) {
                log.info("Dead-letter event published: id={}, jobId={}, queue={}",
                    eventId, event.jobId(), event.queue());
                return true;
            }
            log.error("Dead-letter event not accepted by binding {}: jobId={}", bindingName, event.jobId());
        } catch (Exception e) {
            log.error("Failed to publish dead-letter event: jobId={}, error={}",
                event.jobId(), e.getMessage(), e);
        }

        deadLetterService.record(event, eventId);
        return false;
    }
}
