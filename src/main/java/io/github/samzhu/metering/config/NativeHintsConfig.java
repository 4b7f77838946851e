package io.github.samzhu.metering.config;

import org.springframework.aot.hint.MemberCategory;
import org.springframework.aot.hint.RuntimeHints;
import org.springframework.aot.hint.RuntimeHintsRegistrar;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.ImportRuntimeHints;

import io.github.samzhu.metering.document.DeadLetterRecord;
import io.github.samzhu.metering.document.EnqueueMarker;
import io.github.samzhu.metering.document.IdempotencyRecord;
import io.github.samzhu.metering.document.Job;
import io.github.samzhu.metering.document.Organization;
import io.github.samzhu.metering.document.UsagePeriodRecord;
import io.github.samzhu.metering.dto.DeadLetterEvent;
import io.github.samzhu.metering.dto.JobStatusView;
import io.github.samzhu.metering.dto.QueueStats;
import io.github.samzhu.metering.dto.TraceContext;
import io.github.samzhu.metering.dto.UsageResult;
import io.github.samzhu.metering.dto.UsageSummary;
import io.github.samzhu.metering.dto.api.OrganizationRequest;
import io.github.samzhu.metering.dto.api.ReservationRequest;
import io.github.samzhu.metering.dto.api.SubmissionAccepted;
import io.github.samzhu.metering.dto.api.SubmissionRequest;

/**
 * GraalVM Native Image 執行時期提示配置。
 *
 * <p>註冊 Jackson 與 Spring Data MongoDB 需要反射存取的 record 類別：
 * <ul>
 *   <li>{@link DeadLetterEvent} - 經訊息代理傳遞的死信事件</li>
 *   <li>MongoDB 文件與其嵌套記錄</li>
 *   <li>API 請求與回應 DTO</li>
 * </ul>
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/native-image/introducing-graalvm-native-images.html">Spring Boot Native Image Support</a>
 */
@Configuration
@ImportRuntimeHints(NativeHintsConfig.MeteringRuntimeHints.class)
public class NativeHintsConfig {

    static class MeteringRuntimeHints implements RuntimeHintsRegistrar {

        @Override
        public void registerHints(RuntimeHints hints, ClassLoader classLoader) {
            // 訊息 payload
            hints.reflection()
                .registerType(DeadLetterEvent.class, MemberCategory.values())
                .registerType(TraceContext.class, MemberCategory.values());

            // Document 類別
            hints.reflection()
                .registerType(Organization.class, MemberCategory.values())
                .registerType(UsagePeriodRecord.class, MemberCategory.values())
                .registerType(IdempotencyRecord.class, MemberCategory.values())
                .registerType(Job.class, MemberCategory.values())
                .registerType(Job.Metadata.class, MemberCategory.values())
                .registerType(EnqueueMarker.class, MemberCategory.values())
                .registerType(DeadLetterRecord.class, MemberCategory.values());

            // API DTO
            hints.reflection()
                .registerType(OrganizationRequest.class, MemberCategory.values())
                .registerType(ReservationRequest.class, MemberCategory.values())
                .registerType(SubmissionRequest.class, MemberCategory.values())
                .registerType(SubmissionAccepted.class, MemberCategory.values())
                .registerType(UsageResult.class, MemberCategory.values())
                .registerType(UsageSummary.class, MemberCategory.values())
                .registerType(UsageSummary.ResourceUsage.class, MemberCategory.values())
                .registerType(JobStatusView.class, MemberCategory.values())
                .registerType(QueueStats.class, MemberCategory.values())
                .registerType(QueueStats.ExecutionStats.class, MemberCategory.values());
        }
    }
}
