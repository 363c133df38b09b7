package com.sharecost.model;

import java.math.BigDecimal;
import java.util.UUID;

/** Net position of one member: positive means the group owes them, negative means they owe. */
public record MemberBalance(UUID memberId, String memberName, BigDecimal balance) {}
