package com.sharecost.service;

import com.sharecost.config.AppProperties;
import com.sharecost.dto.AddMemberRequest;
import com.sharecost.dto.CreateGroupRequest;
import com.sharecost.dto.GroupCreatedResponse;
import com.sharecost.dto.GroupResponse;
import com.sharecost.dto.MemberResponse;
import com.sharecost.dto.UpdateMemberPaymentRequest;
import com.sharecost.model.Capability;
import com.sharecost.model.CapabilitySet;
import com.sharecost.model.GroupPrincipal;
import com.sharecost.model.Member;
import com.sharecost.model.ShareGroup;
import com.sharecost.repository.MemberRepository;
import com.sharecost.repository.ShareGroupRepository;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
public class GroupService {
  private static final Logger log = LoggerFactory.getLogger(GroupService.class);

  private final ShareGroupRepository groupRepository;
  private final MemberRepository memberRepository;
  private final TokenService tokenService;
  private final AppProperties appProperties;

  public GroupService(ShareGroupRepository groupRepository,
                      MemberRepository memberRepository,
                      TokenService tokenService,
                      AppProperties appProperties) {
    this.groupRepository = groupRepository;
    this.memberRepository = memberRepository;
    this.tokenService = tokenService;
    this.appProperties = appProperties;
  }

  /** Creates a group and returns it with a token granting its creator every capability. */
  @Transactional
  public GroupCreatedResponse createGroup(CreateGroupRequest request) {
    ShareGroup group = new ShareGroup();
    group.setName(request.getName().trim());
    group.setCurrency(normalizeCurrency(request.getCurrency()));
    ShareGroup saved = groupRepository.save(group);

    int index = 0;
    for (String name : request.getMemberNames()) {
      newMember(saved, name, index++);
    }

    String token = tokenService.issue(saved.getId(), CapabilitySet.all());
    log.info("Created group {} with {} members", saved.getId(), index);
    return new GroupCreatedResponse(toResponse(saved), token);
  }

  public GroupResponse getGroup(GroupPrincipal principal) {
    return toResponse(requireGroup(principal.groupId()));
  }

  @Transactional
  public void deleteGroup(GroupPrincipal principal) {
    principal.requireCapability(Capability.DELETE_GROUP);
    ShareGroup group = requireGroup(principal.groupId());
    groupRepository.delete(group);
    log.info("Deleted group {}", group.getId());
  }

  @Transactional
  public GroupResponse addMember(GroupPrincipal principal, AddMemberRequest request) {
    principal.requireCapability(Capability.MANAGE_MEMBERS);
    ShareGroup group = requireGroup(principal.groupId());
    newMember(group, request.getName(), memberRepository.findMaxJoinIndex(group.getId()) + 1);
    return toResponse(group);
  }

  /** Removes a member. The database drops their transactions and split entries with them. */
  @Transactional
  public void removeMember(GroupPrincipal principal, UUID memberId) {
    principal.requireCapability(Capability.MANAGE_MEMBERS);
    Member member = requireMember(principal.groupId(), memberId);
    memberRepository.delete(member);
  }

  @Transactional
  public MemberResponse updatePayment(GroupPrincipal principal, UUID memberId, UpdateMemberPaymentRequest request) {
    principal.requireCapability(Capability.UPDATE_PAYMENT);
    Member member = requireMember(principal.groupId(), memberId);
    member.setPaypalEmail(blankToNull(request.getPaypalEmail()));
    member.setIban(blankToNull(request.getIban()));
    return toMemberResponse(memberRepository.save(member));
  }

  ShareGroup requireGroup(UUID groupId) {
    return groupRepository.findById(groupId)
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Group not found"));
  }

  private Member requireMember(UUID groupId, UUID memberId) {
    return memberRepository.findByIdAndGroupId(memberId, groupId)
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Member not found"));
  }

  private void newMember(ShareGroup group, String name, int joinIndex) {
    Member member = new Member();
    member.setGroup(group);
    member.setName(name.trim());
    member.setJoinIndex(joinIndex);
    memberRepository.save(member);
  }

  private String normalizeCurrency(String currency) {
    if (currency == null || currency.isBlank()) {
      return appProperties.defaultCurrency();
    }
    return currency.trim().toUpperCase(Locale.ROOT);
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }

  private GroupResponse toResponse(ShareGroup group) {
    List<MemberResponse> members = memberRepository.findByGroupId(group.getId()).stream()
        .map(GroupService::toMemberResponse)
        .toList();
    return new GroupResponse(group.getId(), group.getName(), group.getCurrency(), members, group.getCreatedAt());
  }

  private static MemberResponse toMemberResponse(Member member) {
    return new MemberResponse(member.getId(), member.getName(), member.getPaypalEmail(), member.getIban());
  }
}
