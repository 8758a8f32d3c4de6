package com.fifogains.jdbc.ledger;

import java.util.Objects;

/** Snapshot of a lot still open once its group has been processed. */
public final class RemainingLot {
    private final GroupKey key;
    private final int position;
    private final OpenLot lot;

    public RemainingLot(GroupKey key, int position, OpenLot lot) {
        this.key = Objects.requireNonNull(key, "key");
        this.position = position;
        this.lot = Objects.requireNonNull(lot, "lot").copy();
    }

    public GroupKey getKey() {
        return key;
    }

    /** Zero-based position in the group's queue; position 0 is consumed first. */
    public int getPosition() {
        return position;
    }

    public OpenLot getLot() {
        return lot.copy();
    }
}
