package com.sharecost.controller;

import com.sharecost.dto.AddMemberRequest;
import com.sharecost.dto.BalanceResponse;
import com.sharecost.dto.CreateGroupRequest;
import com.sharecost.dto.GroupCreatedResponse;
import com.sharecost.dto.GroupResponse;
import com.sharecost.dto.MemberResponse;
import com.sharecost.dto.UpdateMemberPaymentRequest;
import com.sharecost.service.BalanceService;
import com.sharecost.service.CurrentGroupService;
import com.sharecost.service.GroupService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/groups")
public class GroupController {
  private final GroupService groupService;
  private final BalanceService balanceService;
  private final CurrentGroupService currentGroupService;

  public GroupController(GroupService groupService,
                         BalanceService balanceService,
                         CurrentGroupService currentGroupService) {
    this.groupService = groupService;
    this.balanceService = balanceService;
    this.currentGroupService = currentGroupService;
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public GroupCreatedResponse create(@Valid @RequestBody CreateGroupRequest request) {
    return groupService.createGroup(request);
  }

  @GetMapping("/current")
  public GroupResponse current() {
    return groupService.getGroup(currentGroupService.requireGroup());
  }

  @DeleteMapping("/current")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void delete() {
    groupService.deleteGroup(currentGroupService.requireGroup());
  }

  @PostMapping("/current/members")
  public GroupResponse addMember(@Valid @RequestBody AddMemberRequest request) {
    return groupService.addMember(currentGroupService.requireGroup(), request);
  }

  @DeleteMapping("/current/members/{memberId}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void removeMember(@PathVariable UUID memberId) {
    groupService.removeMember(currentGroupService.requireGroup(), memberId);
  }

  @PutMapping("/current/members/{memberId}/payment")
  public MemberResponse updatePayment(@PathVariable UUID memberId,
                                      @Valid @RequestBody UpdateMemberPaymentRequest request) {
    return groupService.updatePayment(currentGroupService.requireGroup(), memberId, request);
  }

  @GetMapping("/current/balances")
  public List<BalanceResponse> balances() {
    return balanceService.balances(currentGroupService.requireGroup());
  }
}
