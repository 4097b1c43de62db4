package com.edge.metrics.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.util.ContentCachingResponseWrapper;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 记录 API 请求与响应
 * <p>
 * 评估请求可能包含大量框，请求体和响应体只打印前一部分
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    private static final int MAX_REQUEST_BODY_LOG = 1000;
    private static final int MAX_RESPONSE_BODY_LOG = 2000;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        // 文档页面和静态资源不记录
        return !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        ContentCachingRequestWrapper requestWrapper = new ContentCachingRequestWrapper(request);
        ContentCachingResponseWrapper responseWrapper = new ContentCachingResponseWrapper(response);

        long startTime = System.currentTimeMillis();

        try {
            logger.info("=== Incoming Request ===");
            logger.info("Method: {} {}", request.getMethod(), request.getRequestURI());

            filterChain.doFilter(requestWrapper, responseWrapper);

        } finally {
            long duration = System.currentTimeMillis() - startTime;

            if (request.getMethod().equalsIgnoreCase("POST") || request.getMethod().equalsIgnoreCase("PUT")) {
                byte[] content = requestWrapper.getContentAsByteArray();
                if (content.length > 0) {
                    logger.info("Request Body: {}", truncate(new String(content, StandardCharsets.UTF_8),
                        MAX_REQUEST_BODY_LOG));
                }
            }

            byte[] responseContent = responseWrapper.getContentAsByteArray();
            String contentType = responseWrapper.getContentType();
            // 只有 Content-Type 是文本时才打印
            if (responseContent.length > 0 && contentType != null
                    && (contentType.contains("json") || contentType.contains("text"))) {
                logger.debug("Response Body: {}", truncate(new String(responseContent, StandardCharsets.UTF_8),
                    MAX_RESPONSE_BODY_LOG));
            }

            // 复制响应到原始响应，否则客户端收不到数据
            responseWrapper.copyBodyToResponse();

            logger.info("Duration: {} ms | Status: {}", duration, responseWrapper.getStatus());
            logger.info("======================");
        }
    }

    private static String truncate(String body, int limit) {
        return body.length() > limit ? body.substring(0, limit) + "..." : body;
    }
}
