package com.curvemarket.support;

import com.curvemarket.amm.VirtualAmm;
import com.curvemarket.auth.AuthorizationService;
import com.curvemarket.auth.Eip712Domain;
import com.curvemarket.auth.Eip712SignatureVerifier;
import com.curvemarket.auth.MarketMessages;
import com.curvemarket.auth.TypedMessage;
import com.curvemarket.curve.BondingCurveLedger;
import com.curvemarket.curve.CurveQuote;
import com.curvemarket.domain.enums.ClaimKind;
import com.curvemarket.domain.enums.OutcomeSide;
import com.curvemarket.domain.enums.UserTier;
import com.curvemarket.domain.model.LeveragedPosition;
import com.curvemarket.domain.model.MarketParameters;
import com.curvemarket.engine.MarketEngine;
import com.curvemarket.event.MarketEventPublisher;
import com.curvemarket.gateway.CustodyVault;
import com.curvemarket.gateway.FundsRouter;
import com.curvemarket.math.MarketMath;
import com.curvemarket.position.BulkLiquidationResult;
import com.curvemarket.position.PositionLedger;
import com.curvemarket.position.PositionSettlement;
import com.curvemarket.settlement.ClaimResult;
import com.curvemarket.settlement.SettlementGuardian;
import com.curvemarket.simulator.SimulatedSettlementBank;
import com.curvemarket.state.MarketStateStore;
import com.curvemarket.token.NonTransferableOutcomeToken;
import com.curvemarket.token.OutcomeTokens;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Wires a real {@link MarketEngine} over the in-process settlement simulator, with signing
 * helpers for every signed operation. Published events are collected in {@link #published}.
 */
public class MarketHarness {

    public static final String MARKET_ADDRESS = "0x00000000000000000000000000000000000c0de1";
    public static final Instant START = Instant.parse("2025-03-01T00:00:00Z");

    /** Requesting this many shares from an empty curve fills it to the threshold. */
    public static final BigInteger FILL_CURVE_SHARES = new BigInteger("374165000000000000000000");

    public static final BigInteger LENDING_DEPOSITS = BigInteger.valueOf(1_000_000_000_000L);
    public static final BigInteger INSURANCE_BALANCE = BigInteger.valueOf(100_000_000_000L);

    public final MutableClock clock = new MutableClock(START);
    public final List<Object> published = new ArrayList<>();
    public final MarketParameters parameters;
    public final MarketStateStore store = new MarketStateStore();
    public final SimulatedSettlementBank bank;
    public final OutcomeTokens outcomeTokens =
            new OutcomeTokens(new NonTransferableOutcomeToken("YES"), new NonTransferableOutcomeToken("NO"));
    public final Eip712SignatureVerifier verifier = new Eip712SignatureVerifier();
    public final MarketEngine engine;

    public MarketHarness() {
        this(defaultParameters(), Function.identity());
    }

    public MarketHarness(MarketParameters parameters) {
        this(parameters, Function.identity());
    }

    /** {@code custodyDecorator} may wrap the simulator's vault, e.g. to call back into the engine. */
    public MarketHarness(MarketParameters parameters, Function<CustodyVault, CustodyVault> custodyDecorator) {
        this.parameters = parameters;
        this.bank = new SimulatedSettlementBank(MARKET_ADDRESS, LENDING_DEPOSITS, INSURANCE_BALANCE, 8000);
        VirtualAmm amm = new VirtualAmm(store);
        PositionLedger positionLedger = new PositionLedger(store, amm);
        this.engine = new MarketEngine(
                store,
                new BondingCurveLedger(store),
                amm,
                positionLedger,
                new SettlementGuardian(store, positionLedger),
                new AuthorizationService(verifier, store, clock),
                new FundsRouter(custodyDecorator.apply(bank), bank, bank, store),
                outcomeTokens,
                new MarketEventPublisher(published::add),
                List.of(store, bank, outcomeTokens),
                clock);
    }

    public static MarketParameters defaultParameters() {
        return MarketParameters.builder().marketAddress(MARKET_ADDRESS).build();
    }

    public static BigInteger units(long whole) {
        return BigInteger.valueOf(whole).multiply(BigInteger.valueOf(1_000_000L));
    }

    public static BigInteger shares(long whole) {
        return BigInteger.valueOf(whole).multiply(MarketMath.WAD);
    }

    public MarketHarness initialized() {
        engine.initialize(parameters, TestSigner.AUTHORITY.address());
        return this;
    }

    public long deadline() {
        return clock.instant().getEpochSecond() + Duration.ofHours(1).toSeconds();
    }

    public String sign(TestSigner signer, TypedMessage message) {
        Eip712Domain domain = Eip712Domain.forMarket(parameters.getChainId(), parameters.getMarketAddress());
        return signer.sign(verifier.digest(domain, message));
    }

    public void fund(TestSigner account, BigInteger externalAmount) {
        bank.fundWallet(account.address(), MarketMath.toAccounting(externalAmount));
    }

    // ---- Signed operations ----

    public CurveQuote buy(TestSigner buyer, OutcomeSide side, BigInteger shareAmount) {
        long deadline = deadline();
        TypedMessage message = MarketMessages.buyShares(
                buyer.address(), side, shareAmount, engine.nonceOf(buyer.address()), deadline);
        return engine.buyShares(buyer.address(), side, shareAmount, deadline,
                sign(buyer, message), sign(TestSigner.AUTHORITY, message));
    }

    /** Funds a whale and buys YES until the curve migrates. */
    public CurveQuote migrate(TestSigner whale) {
        fund(whale, units(60_000));
        return buy(whale, OutcomeSide.YES, FILL_CURVE_SHARES);
    }

    public LeveragedPosition open(TestSigner trader, OutcomeSide side, BigInteger collateral, int leverage) {
        return open(trader, side, collateral, leverage, BigInteger.ZERO);
    }

    public LeveragedPosition open(
            TestSigner trader, OutcomeSide side, BigInteger collateral, int leverage, BigInteger minShares) {
        long deadline = deadline();
        TypedMessage message = MarketMessages.openPosition(
                trader.address(), side, collateral, leverage, minShares, engine.nonceOf(trader.address()), deadline);
        return engine.openPosition(trader.address(), side, collateral, leverage, minShares, deadline,
                sign(trader, message), sign(TestSigner.AUTHORITY, message));
    }

    public PositionSettlement close(TestSigner trader, OutcomeSide side) {
        long deadline = deadline();
        TypedMessage message =
                MarketMessages.closePosition(trader.address(), side, engine.nonceOf(trader.address()), deadline);
        return engine.closePosition(trader.address(), side, deadline,
                sign(trader, message), sign(TestSigner.AUTHORITY, message));
    }

    public BulkLiquidationResult bulkLiquidate(TestSigner keeper, List<String> traders, List<OutcomeSide> sides) {
        long deadline = deadline();
        TypedMessage message = MarketMessages.bulkLiquidate(
                keeper.address(), traders, sides, engine.nonceOf(keeper.address()), deadline);
        return engine.bulkLiquidate(keeper.address(), traders, sides, deadline, sign(TestSigner.AUTHORITY, message));
    }

    public ClaimResult claim(TestSigner user, ClaimKind claimKind, UserTier tier) {
        long deadline = deadline();
        TypedMessage message = MarketMessages.claimTier(
                user.address(), claimKind, tier, engine.nonceOf(user.address()), deadline);
        return engine.claimWinnings(user.address(), claimKind, tier, deadline, sign(TestSigner.AUTHORITY, message));
    }

    public <T> List<T> publishedOfType(Class<T> type) {
        return published.stream().filter(type::isInstance).map(type::cast).toList();
    }
}
