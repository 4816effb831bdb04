package com.example.bookreview.security;

import com.example.bookreview.api.dto.ErrorResponse;
import com.example.bookreview.exception.GlobalExceptionHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.oauth2.core.OAuth2AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;
import org.springframework.web.util.ServletRequestPathUtils;

import java.io.IOException;

/**
 * Writes the guard's 401 and 403 answers in the same JSON shape the controllers use.
 * A path no controller maps answers 404 before any token check.
 */
@Slf4j
@Component
public class JsonSecurityErrorHandler implements AuthenticationEntryPoint, AccessDeniedHandler {

  private final ObjectMapper objectMapper;
  private final RequestMappingHandlerMapping routes;

  public JsonSecurityErrorHandler(ObjectMapper objectMapper,
                                  @Qualifier("requestMappingHandlerMapping") RequestMappingHandlerMapping routes) {
    this.objectMapper = objectMapper;
    this.routes = routes;
  }

  @Override
  public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException ex) throws IOException {
    if (!isMapped(request)) {
      write(response, new ErrorResponse(GlobalExceptionHandler.ENDPOINT_NOT_FOUND, "NOT_FOUND", 404, request.getRequestURI()));
    } else if (ex instanceof OAuth2AuthenticationException) {
      log.warn("Rejected token on {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
      write(response, new ErrorResponse("Invalid token", "INVALID_TOKEN", 401, request.getRequestURI()));
    } else {
      write(response, new ErrorResponse("Access token required", "MISSING_TOKEN", 401, request.getRequestURI()));
    }
  }

  @Override
  public void handle(HttpServletRequest request, HttpServletResponse response, AccessDeniedException ex) throws IOException {
    write(response, new ErrorResponse(GlobalExceptionHandler.ADMIN_REQUIRED, "ACCESS_DENIED", 403, request.getRequestURI()));
  }

  /** A path that matches a mapping under another method still counts as mapped. */
  boolean isMapped(HttpServletRequest request) {
    if (!ServletRequestPathUtils.hasParsedRequestPath(request)) {
      ServletRequestPathUtils.parseAndCache(request);
    }
    try {
      return routes.getHandler(request) != null;
    } catch (Exception e) {
      log.debug("Partial route match on {} {}: {}", request.getMethod(), request.getRequestURI(), e.getMessage());
      return true;
    }
  }

  private void write(HttpServletResponse response, ErrorResponse body) throws IOException {
    response.setStatus(body.status());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    objectMapper.writeValue(response.getOutputStream(), body);
  }
}
