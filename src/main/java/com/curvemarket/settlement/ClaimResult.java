package com.curvemarket.settlement;

import com.curvemarket.domain.enums.ClaimKind;
import java.math.BigInteger;

/** What a claim or sweep paid out, in external units. {@code bonus} is included in {@code payout}. */
public record ClaimResult(String account, ClaimKind claimKind, BigInteger payout, BigInteger bonus) {}
