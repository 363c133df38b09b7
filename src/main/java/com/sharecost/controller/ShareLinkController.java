package com.sharecost.controller;

import com.sharecost.dto.CapabilitiesResponse;
import com.sharecost.dto.MergeTokenRequest;
import com.sharecost.dto.ShareLinkRequest;
import com.sharecost.dto.TokenResponse;
import com.sharecost.service.CurrentGroupService;
import com.sharecost.service.ShareLinkService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class ShareLinkController {
  private final ShareLinkService shareLinkService;
  private final CurrentGroupService currentGroupService;

  public ShareLinkController(ShareLinkService shareLinkService, CurrentGroupService currentGroupService) {
    this.shareLinkService = shareLinkService;
    this.currentGroupService = currentGroupService;
  }

  @GetMapping("/groups/current/capabilities")
  public CapabilitiesResponse capabilities() {
    return shareLinkService.describe(currentGroupService.requireGroup());
  }

  @PostMapping("/groups/current/share-links")
  @ResponseStatus(HttpStatus.CREATED)
  public TokenResponse createShareLink(@RequestBody(required = false) ShareLinkRequest request) {
    return shareLinkService.createShareLink(
        currentGroupService.requireGroup(),
        request == null ? null : request.getCapabilities());
  }

  @PostMapping("/tokens/merge")
  public TokenResponse merge(@Valid @RequestBody MergeTokenRequest request) {
    return shareLinkService.mergeTokens(currentGroupService.requireGroup(), request.getToken());
  }
}
