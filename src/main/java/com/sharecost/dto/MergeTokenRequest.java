package com.sharecost.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class MergeTokenRequest {
  @NotBlank
  private String token;
}
