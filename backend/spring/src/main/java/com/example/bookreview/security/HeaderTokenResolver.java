package com.example.bookreview.security;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.oauth2.server.resource.web.BearerTokenResolver;
import org.springframework.security.web.util.matcher.RequestMatcher;
import org.springframework.util.StringUtils;

/**
 * Reads the raw token from a single header, without a {@code Bearer} prefix.
 * Public endpoints resolve to no token so a stale header never fails them.
 */
public class HeaderTokenResolver implements BearerTokenResolver {

  private final String headerName;
  private final RequestMatcher publicEndpoints;

  public HeaderTokenResolver(String headerName, RequestMatcher publicEndpoints) {
    this.headerName = headerName;
    this.publicEndpoints = publicEndpoints;
  }

  @Override
  public String resolve(HttpServletRequest request) {
    if (publicEndpoints.matches(request)) {
      return null;
    }
    String token = request.getHeader(headerName);
    return StringUtils.hasText(token) ? token.trim() : null;
  }
}
