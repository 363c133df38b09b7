package com.sharecost.model;

import java.util.UUID;

public record LedgerMember(UUID id, String name) {}
