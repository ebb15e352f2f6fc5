package com.curvemarket.settlement;

import com.curvemarket.domain.enums.OutcomeSide;
import java.math.BigInteger;

/** Frozen settlement terms. Backing, liabilities and bonus reserve in external units. */
public record Resolution(
        OutcomeSide winningSide,
        BigInteger settlementPrice,
        BigInteger backing,
        BigInteger liabilities,
        BigInteger bonusReserve) {}
