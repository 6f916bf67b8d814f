package com.boxline.billing.application.ports;

import com.boxline.billing.domain.model.MemberRole;

import java.util.UUID;

/** Authoritative count of active members. Never cached. */
public interface MembershipCounter {

    int countActive(UUID tenantId, MemberRole role);
}
