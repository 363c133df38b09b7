package com.sharecost.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class GroupCreatedResponse {
  private GroupResponse group;
  private String token;
}
