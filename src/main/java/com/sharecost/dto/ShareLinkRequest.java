package com.sharecost.dto;

import com.sharecost.model.CapabilitySet;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class ShareLinkRequest {
  /** Requested rights; omitted flags ask for everything the caller holds. */
  private CapabilitySet capabilities;
}
