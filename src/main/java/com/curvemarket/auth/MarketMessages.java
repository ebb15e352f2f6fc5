package com.curvemarket.auth;

import com.curvemarket.domain.enums.ClaimKind;
import com.curvemarket.domain.enums.OutcomeSide;
import com.curvemarket.domain.enums.UserTier;
import java.math.BigInteger;
import java.util.List;

/** The typed messages that authorize market operations. */
public final class MarketMessages {

    private MarketMessages() {}

    public static TypedMessage buyShares(
            String buyer, OutcomeSide side, BigInteger shareAmount, BigInteger nonce, long deadline) {
        return TypedMessage.builder("BuyShares")
                .address("buyer", buyer)
                .bool("isYes", side.isYes())
                .uint256("shareAmount", shareAmount)
                .uint256("nonce", nonce)
                .uint256("deadline", BigInteger.valueOf(deadline))
                .build();
    }

    public static TypedMessage openPosition(
            String trader,
            OutcomeSide side,
            BigInteger collateral,
            int leverage,
            BigInteger minShares,
            BigInteger nonce,
            long deadline) {
        return TypedMessage.builder("OpenPosition")
                .address("trader", trader)
                .bool("isYes", side.isYes())
                .uint256("collateral", collateral)
                .uint256("leverage", BigInteger.valueOf(leverage))
                .uint256("minShares", minShares)
                .uint256("nonce", nonce)
                .uint256("deadline", BigInteger.valueOf(deadline))
                .build();
    }

    public static TypedMessage closePosition(String trader, OutcomeSide side, BigInteger nonce, long deadline) {
        return TypedMessage.builder("ClosePosition")
                .address("trader", trader)
                .bool("isYes", side.isYes())
                .uint256("nonce", nonce)
                .uint256("deadline", BigInteger.valueOf(deadline))
                .build();
    }

    public static TypedMessage bulkLiquidate(
            String keeper, List<String> traders, List<OutcomeSide> sides, BigInteger nonce, long deadline) {
        return TypedMessage.builder("BulkLiquidate")
                .address("keeper", keeper)
                .addressArray("traders", traders)
                .boolArray("sides", sides.stream().map(OutcomeSide::isYes).toList())
                .uint256("nonce", nonce)
                .uint256("deadline", BigInteger.valueOf(deadline))
                .build();
    }

    public static TypedMessage claimTier(
            String user, ClaimKind claimKind, UserTier tier, BigInteger nonce, long deadline) {
        return TypedMessage.builder("ClaimTier")
                .address("user", user)
                .uint8("claimKind", claimKind.ordinal())
                .uint8("tier", tier.ordinal())
                .uint256("nonce", nonce)
                .uint256("deadline", BigInteger.valueOf(deadline))
                .build();
    }
}
