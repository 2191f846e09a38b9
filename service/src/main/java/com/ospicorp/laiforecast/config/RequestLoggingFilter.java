package com.ospicorp.laiforecast.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/** Logs one line per request and tags everything logged while serving it with a request id. */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

  static final String REQUEST_ID = "requestId";
  static final String REQUEST_ID_HEADER = "X-Request-Id";

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response, @NonNull FilterChain filterChain)
      throws ServletException, IOException {
    String requestId = request.getHeader(REQUEST_ID_HEADER);
    if (requestId == null || requestId.isBlank()) {
      requestId = UUID.randomUUID().toString();
    }
    MDC.put(REQUEST_ID, requestId);
    response.setHeader(REQUEST_ID_HEADER, requestId);
    long startTime = System.currentTimeMillis();
    try {
      filterChain.doFilter(request, response);
    } catch (ServletException | IOException | RuntimeException ex) {
      log.error("Request {} {} failed: {}",
          request.getMethod(), getRequestUriWithQuery(request), ex.getMessage(), ex);
      throw ex;
    } finally {
      long duration = System.currentTimeMillis() - startTime;
      log.info("HTTP {} {} -> {} ({} ms)",
          request.getMethod(), getRequestUriWithQuery(request), response.getStatus(), duration);
      MDC.remove(REQUEST_ID);
    }
  }

  private String getRequestUriWithQuery(HttpServletRequest request) {
    String queryString = request.getQueryString();
    if (queryString == null || queryString.isBlank()) {
      return request.getRequestURI();
    }
    return request.getRequestURI() + "?" + queryString;
  }
}
