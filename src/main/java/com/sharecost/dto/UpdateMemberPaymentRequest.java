package com.sharecost.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class UpdateMemberPaymentRequest {
  @Email
  private String paypalEmail;

  @Size(max = 64)
  private String iban;
}
