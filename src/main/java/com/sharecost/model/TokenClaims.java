package com.sharecost.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Verified contents of a group token. {@code capabilities} is {@code null} for tokens issued before
 * capabilities were introduced.
 */
public record TokenClaims(UUID groupId, Instant expiresAt, CapabilitySet capabilities) {}
