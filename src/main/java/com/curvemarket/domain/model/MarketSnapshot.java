package com.curvemarket.domain.model;

import com.curvemarket.domain.enums.MarketPhase;
import com.curvemarket.domain.enums.OutcomeSide;
import java.math.BigInteger;
import java.time.Instant;

/** Read-only copy of the market state handed to queries, metrics and the REST layer. */
public record MarketSnapshot(
        MarketPhase phase,
        int parametersVersion,
        String authority,
        BigInteger currentSupply,
        BigInteger totalCapitalRaised,
        BigInteger migrationThreshold,
        boolean migrated,
        BigInteger reserveStable,
        BigInteger reserveYes,
        BigInteger reserveNo,
        BigInteger invariantK,
        BigInteger priceYes,
        BigInteger priceNo,
        BigInteger totalBorrowed,
        BigInteger openInterestYes,
        BigInteger openInterestNo,
        OutcomeSide winningSide,
        BigInteger settlementPrice,
        BigInteger bonusReserve,
        Instant resolvedAt) {}
