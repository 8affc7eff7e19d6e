package com.flagship.fundraising_ledger.ledger;

import com.flagship.fundraising_ledger.exception.ClubAccessDeniedException;

import java.util.UUID;

/**
 * The calling club, from the X-Club-Id header, may only touch its own data.
 * Routes keyed by campaign, event or entry id rely on the lookups being
 * scoped by club instead.
 */
public final class ClubAccess {

    public static final String CLUB_ID_HEADER = "X-Club-Id";
    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private ClubAccess() {
    }

    public static void requireSameClub(UUID callerClubId, UUID requestedClubId) {
        if (!callerClubId.equals(requestedClubId)) {
            throw new ClubAccessDeniedException(callerClubId, requestedClubId);
        }
    }
}
