package com.edge.counter.config;

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
 * 记录 JSON 接口的请求/响应；图像接口只放行，不缓存响应体
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    private static final int MAX_BODY_LOG_LENGTH = 1000;
    private static final int MAX_RESPONSE_LOG_SIZE = 5000;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String path = request.getRequestURI();

        // 图像和 Swagger 静态资源直接放行
        if (isImagePath(path) || path.startsWith("/swagger-ui") || path.startsWith("/v3/api-docs")) {
            filterChain.doFilter(request, response);
            return;
        }

        ContentCachingRequestWrapper requestWrapper = new ContentCachingRequestWrapper(request);
        ContentCachingResponseWrapper responseWrapper = new ContentCachingResponseWrapper(response);

        long startTime = System.currentTimeMillis();

        try {
            logger.info("=== Incoming Request ===");
            logger.info("Method: {} {}", request.getMethod(), path);

            filterChain.doFilter(requestWrapper, responseWrapper);
        } finally {
            long duration = System.currentTimeMillis() - startTime;

            if (request.getMethod().equalsIgnoreCase("POST") || request.getMethod().equalsIgnoreCase("PUT")) {
                byte[] content = requestWrapper.getContentAsByteArray();
                if (content.length > 0) {
                    logger.info("Request Body: {}", truncate(new String(content, StandardCharsets.UTF_8)));
                }
            }

            byte[] responseContent = responseWrapper.getContentAsByteArray();
            String contentType = responseWrapper.getContentType();
            if (responseContent.length > 0 && responseContent.length < MAX_RESPONSE_LOG_SIZE
                    && contentType != null && (contentType.contains("json") || contentType.contains("text"))) {
                logger.info("Response Body: {}", new String(responseContent, StandardCharsets.UTF_8));
            }

            // 把缓存的响应体写回原始响应，否则客户端收不到数据
            responseWrapper.copyBodyToResponse();

            logger.info("Duration: {} ms | Status: {}", duration, response.getStatus());
            logger.info("======================");
        }
    }

    static boolean isImagePath(String path) {
        return path.startsWith("/stream/")
                || path.endsWith("/snapshot")
                || path.endsWith("/frame");
    }

    private static String truncate(String body) {
        return body.length() > MAX_BODY_LOG_LENGTH ? body.substring(0, MAX_BODY_LOG_LENGTH) + "..." : body;
    }
}
