package com.flagship.fundraising_ledger.exception;

import java.util.UUID;

/**
 * The club in the path is not the calling club.
 */
public class ClubAccessDeniedException extends RuntimeException {

    public ClubAccessDeniedException(UUID callerClubId, UUID requestedClubId) {
        super("Club " + callerClubId + " cannot access club " + requestedClubId);
    }
}
