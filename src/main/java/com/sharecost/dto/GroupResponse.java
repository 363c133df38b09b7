package com.sharecost.dto;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class GroupResponse {
  private UUID id;
  private String name;
  private String currency;
  private List<MemberResponse> members;
  private Instant createdAt;
}
