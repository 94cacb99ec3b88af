package com.homesplit.service;

import com.homesplit.config.LedgerProperties;
import com.homesplit.dto.HouseholdJoinRequest;
import com.homesplit.dto.HouseholdMemberResponse;
import com.homesplit.dto.HouseholdRequest;
import com.homesplit.dto.HouseholdResponse;
import com.homesplit.model.Household;
import com.homesplit.model.HouseholdMember;
import com.homesplit.model.HouseholdRole;
import com.homesplit.model.User;
import com.homesplit.repository.HouseholdMemberRepository;
import com.homesplit.repository.HouseholdRepository;
import com.homesplit.repository.UserRepository;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/** Households and their members. The member list is the participant roster every split uses. */
@Service
public class HouseholdService {
  private static final String DEFAULT_CURRENCY = "EUR";

  private final HouseholdRepository householdRepository;
  private final HouseholdMemberRepository memberRepository;
  private final UserRepository userRepository;
  private final LedgerProperties ledgerProperties;

  public HouseholdService(HouseholdRepository householdRepository,
                          HouseholdMemberRepository memberRepository,
                          UserRepository userRepository,
                          LedgerProperties ledgerProperties) {
    this.householdRepository = householdRepository;
    this.memberRepository = memberRepository;
    this.userRepository = userRepository;
    this.ledgerProperties = ledgerProperties;
  }

  @Transactional
  public HouseholdResponse createHousehold(UUID userId, HouseholdRequest request) {
    User user = requireUser(userId);

    Household household = new Household();
    household.setName(request.getName().trim());
    household.setCurrency(resolveCurrency(request.getCurrency()));
    household.setInviteCode(generateInviteCode());
    Household saved = householdRepository.save(household);

    HouseholdMember member = new HouseholdMember();
    member.setHousehold(saved);
    member.setUser(user);
    member.setRole(HouseholdRole.OWNER);
    memberRepository.save(member);

    return toResponse(saved, HouseholdRole.OWNER);
  }

  @Transactional
  public HouseholdResponse joinHousehold(UUID userId, HouseholdJoinRequest request) {
    User user = requireUser(userId);
    Household household = householdRepository.findByInviteCode(request.getInviteCode().trim().toUpperCase(Locale.ROOT))
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Invite code not found"));

    memberRepository.findByUserIdAndHouseholdId(userId, household.getId())
        .ifPresent(existing -> {
          throw new ResponseStatusException(HttpStatus.CONFLICT, "Already joined");
        });

    HouseholdMember member = new HouseholdMember();
    member.setHousehold(household);
    member.setUser(user);
    member.setRole(HouseholdRole.MEMBER);
    memberRepository.save(member);

    return toResponse(household, HouseholdRole.MEMBER);
  }

  public List<HouseholdResponse> listHouseholds(UUID userId) {
    return memberRepository.findByUserId(userId).stream()
        .map(m -> toResponse(m.getHousehold(), m.getRole()))
        .toList();
  }

  public List<HouseholdMemberResponse> listMembers(UUID userId, UUID householdId) {
    requireMembership(userId, householdId);
    return members(householdId).stream()
        .map(m -> new HouseholdMemberResponse(
            m.getUser().getId(),
            m.getUser().getEmail(),
            m.getUser().label(),
            m.getRole().name(),
            m.getJoinedAt()))
        .toList();
  }

  public HouseholdMember requireMembership(UUID userId, UUID householdId) {
    return memberRepository.findByUserIdAndHouseholdId(userId, householdId)
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.FORBIDDEN, "Not a household member"));
  }

  public List<HouseholdMember> members(UUID householdId) {
    return memberRepository.findByHouseholdId(householdId);
  }

  /** Member ids as the ledger knows them. */
  public List<String> roster(UUID householdId) {
    return memberRepository.findUserIdsByHouseholdId(householdId).stream()
        .map(UUID::toString)
        .toList();
  }

  /** The member who paid; {@code fallback} when no payer was given. */
  public User resolvePayer(UUID householdId, UUID paidBy, User fallback) {
    if (paidBy == null || paidBy.equals(fallback.getId())) {
      return fallback;
    }
    return members(householdId).stream()
        .map(HouseholdMember::getUser)
        .filter(user -> user.getId().equals(paidBy))
        .findFirst()
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "Payer is not a household member"));
  }

  private User requireUser(UUID userId) {
    return userRepository.findById(userId)
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "User not found"));
  }

  private String resolveCurrency(String requested) {
    if (requested != null && !requested.isBlank()) {
      return requested.trim().toUpperCase(Locale.ROOT);
    }
    String configured = ledgerProperties.currency();
    return configured == null || configured.isBlank() ? DEFAULT_CURRENCY : configured;
  }

  private String generateInviteCode() {
    return UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
  }

  private HouseholdResponse toResponse(Household household, HouseholdRole role) {
    return new HouseholdResponse(household.getId(), household.getName(), household.getInviteCode(),
        household.getCurrency(), role.name());
  }
}
