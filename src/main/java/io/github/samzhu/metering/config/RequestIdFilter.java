package io.github.samzhu.metering.config;

import java.io.IOException;
import java.util.UUID;

import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * 為每個 HTTP 請求傳遞或產生 request id。
 *
 * <p>若用戶端帶有 {@code X-Request-ID} 則沿用，否則產生 UUID。
 * request id 會放入 SLF4J MDC ({@code requestId})、回寫至回應 header，
 * 並隨背景工作的 metadata 傳遞，使 log 可跨請求與 worker 追蹤。
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String MDC_KEY = "requestId";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }

        MDC.put(MDC_KEY, requestId);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    /**
     * 取得目前執行緒的 request id。
     *
     * @return request id，不在請求範圍內時為 {@code null}
     */
    public static String currentRequestId() {
        return MDC.get(MDC_KEY);
    }
}
