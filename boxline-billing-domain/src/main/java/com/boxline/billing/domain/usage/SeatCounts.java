package com.boxline.billing.domain.usage;

import com.boxline.billing.domain.model.MemberRole;

/** Active member counts per billed role. */
public record SeatCounts(int athletes, int coaches) {

    public int of(MemberRole role) {
        return role == MemberRole.ATHLETE ? athletes : coaches;
    }
}
