package com.curvemarket.position;

import java.math.BigInteger;

/** A forced unwind and how its surplus is split. External units. */
public record LiquidationSettlement(
        PositionSettlement settlement,
        BigInteger insuranceFee,
        BigInteger keeperReward,
        BigInteger traderRefund) {}
