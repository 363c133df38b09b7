package com.sharecost.config;

import com.sharecost.exception.AuthInvalidException;
import com.sharecost.model.GroupPrincipal;
import com.sharecost.service.CapabilityAuthority;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Collections;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates requests that carry an {@code Authorization} header. A rejected credential leaves the
 * request anonymous and records the failure reason under {@link #AUTH_FAILURE_ATTRIBUTE}, so that
 * operations requiring a group report an invalid token rather than a missing one.
 */
@Component
public class JwtAuthFilter extends OncePerRequestFilter {
  public static final String AUTH_FAILURE_ATTRIBUTE = JwtAuthFilter.class.getName() + ".failure";

  private static final Logger log = LoggerFactory.getLogger(JwtAuthFilter.class);
  private final CapabilityAuthority capabilityAuthority;

  public JwtAuthFilter(CapabilityAuthority capabilityAuthority) {
    this.capabilityAuthority = capabilityAuthority;
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String header = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (header != null && !header.isBlank()) {
      try {
        GroupPrincipal principal = capabilityAuthority.authenticate(header);
        UsernamePasswordAuthenticationToken authentication =
            new UsernamePasswordAuthenticationToken(principal, null, Collections.emptyList());
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);
      } catch (AuthInvalidException ex) {
        request.setAttribute(AUTH_FAILURE_ATTRIBUTE, ex.getReason());
        log.warn("Token rejected for {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
      }
    }
    filterChain.doFilter(request, response);
  }
}
