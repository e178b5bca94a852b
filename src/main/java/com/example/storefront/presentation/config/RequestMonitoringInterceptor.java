package com.example.storefront.presentation.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * API request logging
 * - method, path, status and duration of every request
 * - warns on requests slower than one second
 */
@Slf4j
@Component
public class RequestMonitoringInterceptor implements HandlerInterceptor {

    private static final String REQ_START_TIME = "storefront.requestStartTime";
    private static final long SLOW_REQUEST_MS = 1000;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        request.setAttribute(REQ_START_TIME, System.currentTimeMillis());
        log.debug("Request started: {} {}", request.getMethod(), request.getRequestURI());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        Long startTime = (Long) request.getAttribute(REQ_START_TIME);
        if (startTime == null) {
            return;
        }

        long duration = System.currentTimeMillis() - startTime;
        log.info("{} {} - {}ms (status {})",
                request.getMethod(), request.getRequestURI(), duration, response.getStatus());

        if (duration > SLOW_REQUEST_MS) {
            log.warn("Slow request: {} {} - {}ms", request.getMethod(), request.getRequestURI(), duration);
        }
    }
}
