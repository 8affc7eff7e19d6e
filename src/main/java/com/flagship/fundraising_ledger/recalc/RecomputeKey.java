package com.flagship.fundraising_ledger.recalc;

import com.flagship.fundraising_ledger.ledger.OwnershipLevel;
import lombok.Value;

import java.util.UUID;

/**
 * Identity of one summary node; recomputes of the same key never overlap.
 */
@Value
public class RecomputeKey {
    UUID clubId;
    OwnershipLevel level;
    UUID nodeId;

    @Override
    public String toString() {
        return level + ":" + nodeId;
    }
}
