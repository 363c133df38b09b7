package com.sharecost.service;

import com.sharecost.config.JwtAuthFilter;
import com.sharecost.exception.AuthInvalidException;
import com.sharecost.exception.AuthMissingException;
import com.sharecost.exception.TokenVerificationException;
import com.sharecost.model.GroupPrincipal;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Service;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;

@Service
public class CurrentGroupService {

  public GroupPrincipal requireGroup() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication != null && authentication.getPrincipal() instanceof GroupPrincipal) {
      return (GroupPrincipal) authentication.getPrincipal();
    }
    TokenVerificationException.Reason failure = recordedFailure();
    if (failure != null) {
      throw new AuthInvalidException(failure);
    }
    throw new AuthMissingException();
  }

  private TokenVerificationException.Reason recordedFailure() {
    RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
    if (attributes == null) {
      return null;
    }
    Object failure = attributes.getAttribute(JwtAuthFilter.AUTH_FAILURE_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
    return failure instanceof TokenVerificationException.Reason ? (TokenVerificationException.Reason) failure : null;
  }
}
