package com.curvemarket.position;

import java.util.List;

/** Outcome of a liquidation batch. Entries that were inactive or healthy are skipped, not failed. */
public record BulkLiquidationResult(int requested, List<LiquidationSettlement> liquidations) {

    public int liquidated() {
        return liquidations.size();
    }

    public int skipped() {
        return requested - liquidations.size();
    }
}
