package com.sharecost.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class CreateGroupRequest {
  @NotBlank
  private String name;

  @Pattern(regexp = "[A-Za-z]{3}", message = "must be a three-letter currency code")
  private String currency;

  @NotNull
  private List<@NotBlank String> memberNames = new ArrayList<>();
}
