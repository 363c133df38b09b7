package com.sharecost.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sharecost.config.JwtProperties;
import com.sharecost.exception.TokenVerificationException;
import com.sharecost.exception.TokenVerificationException.Reason;
import com.sharecost.model.Capability;
import com.sharecost.model.CapabilitySet;
import com.sharecost.model.CapabilitySets;
import com.sharecost.model.TokenClaims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.UUID;
import javax.crypto.SecretKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TokenServiceTest {
  static final String SECRET = "test-secret-for-share-cost-tokens-0123456789abcdef";
  static final UUID LEGACY_GROUP_ID = UUID.fromString("3f2c9a8e-5b1d-4c7e-9a6f-0d1e2f3a4b5c");

  /** Issued before capabilities existed: {"group_id": ..., "exp": 4102444800}. */
  static final String LEGACY_TOKEN =
      "eyJ0eXAiOiJKV1QiLCJhbGciOiJIUzI1NiJ9"
          + ".eyJncm91cF9pZCI6IjNmMmM5YThlLTViMWQtNGM3ZS05YTZmLTBkMWUyZjNhNGI1YyIsImV4cCI6NDEwMjQ0NDgwMH0"
          + ".UmEzC5Luvmn4gRhN8x8gWA_Dfqyr32yMzQxBbI_kUZo";

  /** Verbose capability names: {"group_id": ..., "exp": ..., "capabilities": {"manage_members": false, "delete_group": false}}. */
  static final String LEGACY_CAPABILITY_TOKEN =
      "eyJ0eXAiOiJKV1QiLCJhbGciOiJIUzI1NiJ9"
          + ".eyJncm91cF9pZCI6IjNmMmM5YThlLTViMWQtNGM3ZS05YTZmLTBkMWUyZjNhNGI1YyIsImV4cCI6NDEwMjQ0NDgwMCwiY2FwYWJpbGl0aWVzIjp7Im1hbmFnZV9tZW1iZXJzIjpmYWxzZSwiZGVsZXRlX2dyb3VwIjpmYWxzZX19"
          + ".4k6IXVDr0MhvlRH0fSuSbxbWWydc89qqUgs-cyjhwPI";

  private final SecretKey key = Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8));
  private TokenService tokenService;

  static TokenService newTokenService() {
    return new TokenService(new JwtProperties(SECRET, "sharecost", 3650), new ObjectMapper());
  }

  @BeforeEach
  void setUp() {
    tokenService = newTokenService();
  }

  @Test
  void issuedTokenVerifiesWithItsCapabilities() {
    UUID groupId = UUID.randomUUID();
    CapabilitySet capabilities = CapabilitySets.flags(Capability.MANAGE_MEMBERS, false, Capability.ADD_EXPENSES, true);

    TokenClaims claims = tokenService.verify(tokenService.issue(groupId, capabilities));

    assertEquals(groupId, claims.groupId());
    assertEquals(capabilities, claims.capabilities());
    assertEquals(Boolean.FALSE, claims.capabilities().raw(Capability.MANAGE_MEMBERS));
    assertNull(claims.capabilities().raw(Capability.DELETE_GROUP));
  }

  @Test
  void tokensLiveForYears() {
    TokenClaims claims = tokenService.verify(tokenService.issue(UUID.randomUUID(), null));

    assertTrue(claims.expiresAt().isAfter(Instant.now().plus(Duration.ofDays(3600))));
  }

  @Test
  void tokenWithoutCapabilitiesCarriesNone() {
    TokenClaims claims = tokenService.verify(tokenService.issue(UUID.randomUUID(), null));

    assertNull(claims.capabilities());
  }

  @Test
  void encoderWritesCompactClaimNames() {
    String token = tokenService.issue(UUID.randomUUID(), CapabilitySets.flags(Capability.EDIT_EXPENSES, false));

    String payload = new String(Base64.getUrlDecoder().decode(token.split("\\.")[1]), StandardCharsets.UTF_8);

    assertTrue(payload.contains("\"gid\""), payload);
    assertTrue(payload.contains("\"cap\":{\"ee\":false}"), payload);
    assertFalse(payload.contains("group_id"), payload);
    assertFalse(payload.contains("edit_expenses"), payload);
  }

  @Test
  void legacyTokenWithoutCapabilitiesStillVerifies() {
    TokenClaims claims = tokenService.verify(LEGACY_TOKEN);

    assertEquals(LEGACY_GROUP_ID, claims.groupId());
    assertEquals(Instant.ofEpochSecond(4102444800L), claims.expiresAt());
    assertNull(claims.capabilities());
  }

  @Test
  void legacyVerboseCapabilityNamesDecode() {
    TokenClaims claims = tokenService.verify(LEGACY_CAPABILITY_TOKEN);

    assertEquals(LEGACY_GROUP_ID, claims.groupId());
    assertNotNull(claims.capabilities());
    assertFalse(claims.capabilities().hasManageMembers());
    assertFalse(claims.capabilities().hasDeleteGroup());
    assertTrue(claims.capabilities().hasAddExpenses());
    assertTrue(claims.capabilities().hasEditExpenses());
    assertTrue(claims.capabilities().hasUpdatePayment());
  }

  @Test
  void tokenSignedWithAnotherKeyIsRejected() {
    TokenService other = new TokenService(
        new JwtProperties("another-secret-for-share-cost-tokens-9876543210", "sharecost", 3650), new ObjectMapper());
    String token = other.issue(UUID.randomUUID(), CapabilitySet.all());

    TokenVerificationException ex = assertThrows(TokenVerificationException.class, () -> tokenService.verify(token));

    assertEquals(Reason.SIGNATURE_MISMATCH, ex.getReason());
  }

  @Test
  void tamperedPayloadIsRejected() {
    String[] restricted = tokenService.issue(UUID.randomUUID(), CapabilitySets.flags(Capability.DELETE_GROUP, false))
        .split("\\.");
    String[] broad = tokenService.issue(UUID.randomUUID(), CapabilitySet.all()).split("\\.");
    String forged = restricted[0] + "." + broad[1] + "." + restricted[2];

    TokenVerificationException ex = assertThrows(TokenVerificationException.class, () -> tokenService.verify(forged));

    assertEquals(Reason.SIGNATURE_MISMATCH, ex.getReason());
  }

  @Test
  void expiredTokenIsRejected() {
    Instant past = Instant.now().minus(Duration.ofDays(1));
    String token = Jwts.builder()
        .setIssuedAt(Date.from(past.minus(Duration.ofDays(1))))
        .setExpiration(Date.from(past))
        .claim("gid", UUID.randomUUID().toString())
        .signWith(key, SignatureAlgorithm.HS256)
        .compact();

    TokenVerificationException ex = assertThrows(TokenVerificationException.class, () -> tokenService.verify(token));

    assertEquals(Reason.EXPIRED, ex.getReason());
  }

  @Test
  void garbageIsMalformed() {
    assertEquals(Reason.MALFORMED,
        assertThrows(TokenVerificationException.class, () -> tokenService.verify("not-a-token")).getReason());
    assertEquals(Reason.MALFORMED,
        assertThrows(TokenVerificationException.class, () -> tokenService.verify("")).getReason());
  }

  @Test
  void unsignedTokenIsMalformed() {
    String token = Jwts.builder()
        .setExpiration(Date.from(Instant.now().plus(Duration.ofDays(1))))
        .claim("gid", UUID.randomUUID().toString())
        .compact();

    TokenVerificationException ex = assertThrows(TokenVerificationException.class, () -> tokenService.verify(token));

    assertEquals(Reason.MALFORMED, ex.getReason());
  }

  @Test
  void signedTokenWithoutGroupIsMalformed() {
    String token = Jwts.builder()
        .setExpiration(Date.from(Instant.now().plus(Duration.ofDays(1))))
        .claim("something", "else")
        .signWith(key, SignatureAlgorithm.HS256)
        .compact();

    TokenVerificationException ex = assertThrows(TokenVerificationException.class, () -> tokenService.verify(token));

    assertEquals(Reason.MALFORMED, ex.getReason());
  }

  @Test
  void unreadableGroupIdIsMalformed() {
    String token = Jwts.builder()
        .setExpiration(Date.from(Instant.now().plus(Duration.ofDays(1))))
        .claim("gid", "not-a-uuid")
        .signWith(key, SignatureAlgorithm.HS256)
        .compact();

    TokenVerificationException ex = assertThrows(TokenVerificationException.class, () -> tokenService.verify(token));

    assertEquals(Reason.MALFORMED, ex.getReason());
  }
}
