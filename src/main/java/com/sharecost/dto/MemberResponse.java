package com.sharecost.dto;

import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class MemberResponse {
  private UUID id;
  private String name;
  private String paypalEmail;
  private String iban;
}
