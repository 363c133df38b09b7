package com.sharecost.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sharecost.config.JwtProperties;
import com.sharecost.exception.TokenVerificationException;
import com.sharecost.exception.TokenVerificationException.Reason;
import com.sharecost.model.CapabilitySet;
import com.sharecost.model.TokenClaims;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SecurityException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Map;
import java.util.UUID;
import javax.crypto.SecretKey;
import org.springframework.stereotype.Service;

/**
 * Signs and verifies group tokens.
 *
 * <p>Tokens double as durable share links, so they expire years after issue. Claims are written
 * with compact names ({@value #GROUP_ID}, {@value #CAPABILITIES}); tokens from the earlier schema,
 * which used {@value #LEGACY_GROUP_ID} and {@value #LEGACY_CAPABILITIES}, still verify. A token
 * without a capability claim yields claims without a {@link CapabilitySet}.
 */
@Service
public class TokenService {
  static final String GROUP_ID = "gid";
  static final String CAPABILITIES = "cap";
  static final String LEGACY_GROUP_ID = "group_id";
  static final String LEGACY_CAPABILITIES = "capabilities";

  private final JwtProperties properties;
  private final ObjectMapper objectMapper;
  private final SecretKey key;

  public TokenService(JwtProperties properties, ObjectMapper objectMapper) {
    if (properties.secret() == null || properties.secret().isBlank()) {
      throw new IllegalStateException("sharecost.jwt.secret is required");
    }
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.key = Keys.hmacShaKeyFor(properties.secret().getBytes(StandardCharsets.UTF_8));
  }

  public String issue(UUID groupId, CapabilitySet capabilities) {
    Instant now = Instant.now();
    Instant expiry = now.plus(Duration.ofDays(properties.ttlDays()));

    var builder = Jwts.builder()
        .setIssuer(properties.issuer())
        .setIssuedAt(Date.from(now))
        .setExpiration(Date.from(expiry))
        .claim(GROUP_ID, groupId.toString());
    if (capabilities != null) {
      builder.claim(CAPABILITIES, objectMapper.convertValue(capabilities, Map.class));
    }
    return builder
        .signWith(key, SignatureAlgorithm.HS256)
        .compact();
  }

  public TokenClaims verify(String token) {
    if (token == null || token.isBlank()) {
      throw new TokenVerificationException(Reason.MALFORMED, "Empty token");
    }
    Claims claims;
    try {
      claims = Jwts.parserBuilder()
          .setSigningKey(key)
          .build()
          .parseClaimsJws(token)
          .getBody();
    } catch (ExpiredJwtException ex) {
      throw new TokenVerificationException(Reason.EXPIRED, ex.getMessage(), ex);
    } catch (SecurityException ex) {
      throw new TokenVerificationException(Reason.SIGNATURE_MISMATCH, ex.getMessage(), ex);
    } catch (JwtException | IllegalArgumentException ex) {
      throw new TokenVerificationException(Reason.MALFORMED, ex.getMessage(), ex);
    }
    return toClaims(claims);
  }

  private TokenClaims toClaims(Claims claims) {
    Object groupId = firstPresent(claims, GROUP_ID, LEGACY_GROUP_ID);
    if (groupId == null) {
      throw new TokenVerificationException(Reason.MALFORMED, "Token carries no group id");
    }
    Date expiration = claims.getExpiration();
    if (expiration == null) {
      throw new TokenVerificationException(Reason.MALFORMED, "Token carries no expiry");
    }
    try {
      Object rawCapabilities = firstPresent(claims, CAPABILITIES, LEGACY_CAPABILITIES);
      CapabilitySet capabilities = rawCapabilities == null
          ? null
          : objectMapper.convertValue(rawCapabilities, CapabilitySet.class);
      return new TokenClaims(UUID.fromString(groupId.toString()), expiration.toInstant(), capabilities);
    } catch (IllegalArgumentException ex) {
      throw new TokenVerificationException(Reason.MALFORMED, "Unreadable claims: " + ex.getMessage(), ex);
    }
  }

  private static Object firstPresent(Claims claims, String name, String legacyName) {
    Object value = claims.get(name);
    return value != null ? value : claims.get(legacyName);
  }
}
