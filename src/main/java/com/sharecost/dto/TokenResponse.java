package com.sharecost.dto;

import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class TokenResponse {
  private String token;
  private UUID groupId;
  private CapabilitiesResponse capabilities;
}
