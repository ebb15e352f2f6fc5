package com.curvemarket.engine;

import com.curvemarket.amm.AmmTrade;
import com.curvemarket.amm.VirtualAmm;
import com.curvemarket.auth.Addresses;
import com.curvemarket.auth.AuthorizationService;
import com.curvemarket.auth.MarketMessages;
import com.curvemarket.curve.BondingCurveLedger;
import com.curvemarket.curve.CurveQuote;
import com.curvemarket.domain.enums.ClaimKind;
import com.curvemarket.domain.enums.MarketPhase;
import com.curvemarket.domain.enums.OutcomeSide;
import com.curvemarket.domain.enums.UserTier;
import com.curvemarket.domain.model.LeveragedPosition;
import com.curvemarket.domain.model.MarketParameters;
import com.curvemarket.domain.model.MarketSnapshot;
import com.curvemarket.domain.model.MarketState;
import com.curvemarket.event.ClaimEventType;
import com.curvemarket.event.MarketEventPublisher;
import com.curvemarket.event.PositionEventType;
import com.curvemarket.exception.BaseException;
import com.curvemarket.exception.ErrorCode;
import com.curvemarket.exception.GuardViolationException;
import com.curvemarket.exception.LifecycleException;
import com.curvemarket.exception.ValidationException;
import com.curvemarket.gateway.FundsRouter;
import com.curvemarket.gateway.OutcomeToken;
import com.curvemarket.math.MarketMath;
import com.curvemarket.position.BulkLiquidationResult;
import com.curvemarket.position.LeveragePreview;
import com.curvemarket.position.LiquidationSettlement;
import com.curvemarket.position.PositionLedger;
import com.curvemarket.position.PositionLedger.OpenedPosition;
import com.curvemarket.position.PositionSettlement;
import com.curvemarket.settlement.ClaimResult;
import com.curvemarket.settlement.PositionClaim;
import com.curvemarket.settlement.Resolution;
import com.curvemarket.settlement.SettlementGuardian;
import com.curvemarket.state.MarketStateStore;
import com.curvemarket.state.RollbackSupport;
import com.curvemarket.token.OutcomeTokens;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single entry point of the market. Every operation that changes state runs here.
 *
 * <p>Each mutating call:
 * <ol>
 *   <li>is rejected with {@code REENTRANT_CALL} if the calling thread is already inside the engine
 *       (a collaborator calling back in), and otherwise waits for the call lock;</li>
 *   <li>checkpoints the state store and every collaborator that implements {@link RollbackSupport};</li>
 *   <li>updates market state first and only then moves money or tokens through collaborators;</li>
 *   <li>on any {@link RuntimeException} restores all checkpoints, drops its staged events and rethrows;</li>
 *   <li>on success publishes the events it staged, in order.</li>
 * </ol>
 *
 * <p>Queries take the same lock, so they never see a half-applied operation. They may be called
 * from event listeners running inside a committed call.
 */
@Service
public class MarketEngine {

    private static final Logger log = LoggerFactory.getLogger(MarketEngine.class);

    private final ReentrantLock lock = new ReentrantLock();

    private final MarketStateStore store;
    private final BondingCurveLedger curve;
    private final VirtualAmm amm;
    private final PositionLedger positionLedger;
    private final SettlementGuardian settlementGuardian;
    private final AuthorizationService authorization;
    private final FundsRouter funds;
    private final OutcomeTokens outcomeTokens;
    private final MarketEventPublisher events;
    private final List<RollbackSupport> rollbackParticipants;
    private final Clock clock;

    public MarketEngine(
            MarketStateStore store,
            BondingCurveLedger curve,
            VirtualAmm amm,
            PositionLedger positionLedger,
            SettlementGuardian settlementGuardian,
            AuthorizationService authorization,
            FundsRouter funds,
            OutcomeTokens outcomeTokens,
            MarketEventPublisher events,
            List<RollbackSupport> rollbackParticipants,
            Clock clock) {
        this.store = store;
        this.curve = curve;
        this.amm = amm;
        this.positionLedger = positionLedger;
        this.settlementGuardian = settlementGuardian;
        this.authorization = authorization;
        this.funds = funds;
        this.outcomeTokens = outcomeTokens;
        this.events = events;
        this.rollbackParticipants = List.copyOf(rollbackParticipants);
        this.clock = clock;
    }

    // ==============================
    // LIFECYCLE
    // ==============================

    public void initialize(MarketParameters parameters, String authority) {
        execute("initialize", () -> {
            store.initialize(parameters, Addresses.normalize(authority));
            log.info("Market {} initialized (parameters v{}, address {})",
                    parameters.getMarketId(), parameters.getVersion(), parameters.getMarketAddress());
            return null;
        });
    }

    public boolean isInitialized() {
        return read(store::isInitialized);
    }

    /** Current phase, empty until the market is initialized. */
    public Optional<MarketPhase> currentPhase() {
        return read(() -> store.isInitialized() ? Optional.of(store.state().getPhase()) : Optional.empty());
    }

    public void rotateAuthority(String caller, String newAuthority) {
        execute("rotateAuthority", () -> {
            store.requireInitialized();
            authorization.requireAuthority(caller);
            String next = Addresses.normalize(newAuthority);
            MarketState state = store.state();
            String previous = state.getAuthority();
            if (previous.equals(next)) {
                throw new ValidationException(ErrorCode.VALIDATION_ERROR, "New authority equals the current one");
            }
            state.setAuthority(next);
            events.stageAuthorityRotated(this, previous, next);
            log.info("Market authority rotated from {} to {}", previous, next);
            return null;
        });
    }

    // ==============================
    // PHASE 1: BONDING CURVE
    // ==============================

    public CurveQuote buyShares(
            String buyer,
            OutcomeSide side,
            BigInteger shareAmount,
            long deadline,
            String buyerSignature,
            String authoritySignature) {
        return execute("buyShares", () -> {
            store.requireInitialized();
            requirePreMigration();
            String account = Addresses.normalize(buyer);
            CurveQuote quote = curve.quote(shareAmount);
            authorization.authorizeDual(
                    account,
                    deadline,
                    MarketMessages.buyShares(account, side, shareAmount, authorization.nonceOf(account), deadline),
                    buyerSignature,
                    authoritySignature);

            curve.apply(quote);
            MarketState state = store.state();
            events.stageCurveBuy(this, account, side, quote.shares(), quote.rawCost(), quote.fee(),
                    state.getCurrentSupply(), state.getTotalCapitalRaised());
            log.debug("Curve buy {} {} shares by {}: rawCost={}, fee={}, capped={}",
                    quote.shares(), side, account, quote.rawCost(), quote.fee(), quote.capped());
            if (quote.reachesThreshold()) {
                migrate();
            }

            funds.collectCurvePayment(account, quote.rawCost(), quote.fee());
            outcomeTokens.of(side).mint(account, quote.shares());
            if (quote.reachesThreshold()) {
                funds.releaseCurveCapital(state.getTotalCapitalRaised());
            }
            return quote;
        });
    }

    public CurveQuote quoteBuy(BigInteger shareAmount) {
        return read(() -> {
            store.requireInitialized();
            requirePreMigration();
            return curve.quote(shareAmount);
        });
    }

    private void migrate() {
        MarketState state = store.state();
        amm.seed(state.getTotalCapitalRaised());
        state.setMigrated(true);
        state.setPhase(MarketPhase.PHASE2_ACTIVE);
        events.stageMigration(this, state.getTotalCapitalRaised(), state.getReserveStable(),
                state.getReserveYes(), state.getReserveNo(), state.getInvariantK());
        log.info("Market migrated: capital {} seeded reserves stable={}, yes={}, no={}",
                state.getTotalCapitalRaised(), state.getReserveStable(), state.getReserveYes(), state.getReserveNo());
    }

    // ==============================
    // PHASE 2: LEVERAGED POSITIONS
    // ==============================

    public LeveragedPosition openPosition(
            String trader,
            OutcomeSide side,
            BigInteger collateral,
            int leverage,
            BigInteger minShares,
            long deadline,
            String traderSignature,
            String authoritySignature) {
        return execute("openPosition", () -> {
            store.requireInitialized();
            requirePhase2Active();
            String account = Addresses.normalize(trader);
            BigInteger minimum = minShares != null ? minShares : BigInteger.ZERO;
            authorization.authorizeDual(
                    account,
                    deadline,
                    MarketMessages.openPosition(
                            account, side, collateral, leverage, minimum, authorization.nonceOf(account), deadline),
                    traderSignature,
                    authoritySignature);

            OpenedPosition opened = positionLedger.open(account, side, collateral, leverage, minimum, clock.instant());
            LeveragedPosition position = opened.position();
            stageRebalance(opened.trade());
            if (position.getLoanAmount().signum() > 0) {
                events.stagePosition(this, position, PositionEventType.LEVERAGE_ACTIVATED,
                        Map.of("loanAmount", position.getLoanAmount(), "leverage", leverage));
            }
            events.stagePosition(this, position, PositionEventType.OPENED,
                    Map.of("notional", opened.trade().amountIn(), "entryPrice", position.getEntryPrice()));

            funds.postCollateral(account, collateral);
            funds.fundLoan(position.getLoanAmount());
            return position;
        });
    }

    public PositionSettlement closePosition(
            String trader, OutcomeSide side, long deadline, String traderSignature, String authoritySignature) {
        return execute("closePosition", () -> {
            store.requireInitialized();
            requirePhase2Active();
            String account = Addresses.normalize(trader);
            authorization.authorizeDual(
                    account,
                    deadline,
                    MarketMessages.closePosition(account, side, authorization.nonceOf(account), deadline),
                    traderSignature,
                    authoritySignature);

            PositionSettlement settlement = positionLedger.close(account, side, clock.instant());
            stageRebalance(settlement.trade());
            events.stagePosition(this, settlement.position(), PositionEventType.CLOSED, settlementDetails(settlement));
            log.info("Closed {} position of {}: proceeds={}, debt={}, payout={}, pnl={}",
                    side, account, settlement.proceeds(), settlement.debt(), settlement.surplus(), settlement.pnl());

            funds.settleDebt(settlement.principal(), settlement.interest(), settlement.shortfall());
            funds.pay(account, settlement.surplus());
            return settlement;
        });
    }

    public LiquidationSettlement liquidate(String keeper, String trader, OutcomeSide side) {
        return execute("liquidate", () -> {
            store.requireInitialized();
            requirePhase2Active();
            return liquidateOne(Addresses.normalize(keeper), Addresses.normalize(trader), side, clock.instant());
        });
    }

    public BulkLiquidationResult bulkLiquidate(
            String keeper, List<String> traders, List<OutcomeSide> sides, long deadline, String authoritySignature) {
        return execute("bulkLiquidate", () -> {
            store.requireInitialized();
            if (traders.size() != sides.size()) {
                throw new ValidationException(
                        ErrorCode.ARRAY_LENGTH_MISMATCH,
                        traders.size() + " traders but " + sides.size() + " sides");
            }
            requirePhase2Active();
            String keeperAccount = Addresses.normalize(keeper);
            List<String> accounts = traders.stream().map(Addresses::normalize).toList();
            authorization.authorizeByAuthority(
                    keeperAccount,
                    deadline,
                    MarketMessages.bulkLiquidate(
                            keeperAccount, accounts, sides, authorization.nonceOf(keeperAccount), deadline),
                    authoritySignature);

            Instant now = clock.instant();
            List<LiquidationSettlement> liquidations = new ArrayList<>();
            for (int i = 0; i < accounts.size(); i++) {
                String account = accounts.get(i);
                OutcomeSide side = sides.get(i);
                Optional<LeveragedPosition> position = store.findActivePosition(account, side);
                if (position.isEmpty() || !positionLedger.isLiquidatable(position.get(), now)) {
                    log.warn("Bulk liquidation skipped {} {}: {}",
                            account, side, position.isEmpty() ? "no active position" : "healthy");
                    continue;
                }
                liquidations.add(liquidateOne(keeperAccount, account, side, now));
            }
            log.info("Bulk liquidation by {}: {} of {} liquidated", keeperAccount, liquidations.size(), accounts.size());
            return new BulkLiquidationResult(accounts.size(), List.copyOf(liquidations));
        });
    }

    private LiquidationSettlement liquidateOne(String keeper, String trader, OutcomeSide side, Instant now) {
        LiquidationSettlement liquidation = positionLedger.liquidate(trader, side, now);
        PositionSettlement settlement = liquidation.settlement();
        stageRebalance(settlement.trade());
        Map<String, Object> details = settlementDetails(settlement);
        details.put("keeper", keeper);
        details.put("keeperReward", liquidation.keeperReward());
        details.put("insuranceFee", liquidation.insuranceFee());
        details.put("traderRefund", liquidation.traderRefund());
        events.stagePosition(this, settlement.position(), PositionEventType.LIQUIDATED, details);
        log.info("Liquidated {} position of {} by {}: proceeds={}, shortfall={}, keeperReward={}",
                side, trader, keeper, settlement.proceeds(), settlement.shortfall(), liquidation.keeperReward());

        funds.settleDebt(settlement.principal(), settlement.interest(), settlement.shortfall());
        funds.payInsurance(liquidation.insuranceFee());
        funds.pay(keeper, liquidation.keeperReward());
        funds.pay(trader, liquidation.traderRefund());
        return liquidation;
    }

    public LeveragePreview previewLeverage(OutcomeSide side, BigInteger collateral, int leverage) {
        return read(() -> {
            store.requireInitialized();
            requirePhase2Active();
            return positionLedger.preview(side, collateral, leverage);
        });
    }

    public BigInteger healthFactor(String trader, OutcomeSide side) {
        return read(() -> {
            store.requireInitialized();
            return positionLedger.healthFactor(Addresses.normalize(trader), side, clock.instant());
        });
    }

    // ==============================
    // RESOLUTION AND SETTLEMENT
    // ==============================

    public Resolution resolveMarket(String caller, OutcomeSide winningSide) {
        return execute("resolveMarket", () -> {
            store.requireInitialized();
            MarketState state = store.state();
            if (state.isResolved()) {
                throw new LifecycleException(ErrorCode.MARKET_ALREADY_RESOLVED, "Market is already resolved");
            }
            authorization.requireAuthority(caller);

            boolean releaseCurveCapital = !state.isMigrated() && state.getTotalCapitalRaised().signum() > 0;
            BigInteger backing = funds.settlementBacking();
            if (releaseCurveCapital) {
                backing = backing.add(MarketMath.toExternal(state.getTotalCapitalRaised()));
            }
            BigInteger winningSupply = outcomeTokens.of(winningSide).totalSupply();
            Resolution resolution = settlementGuardian.resolve(winningSide, winningSupply, backing, clock.instant());
            events.stageResolution(this, resolution.winningSide(), resolution.settlementPrice(),
                    resolution.backing(), resolution.liabilities(), resolution.bonusReserve());

            if (releaseCurveCapital) {
                funds.releaseCurveCapital(state.getTotalCapitalRaised());
            }
            return resolution;
        });
    }

    public ClaimResult claimWinnings(
            String user, ClaimKind claimKind, UserTier tier, long deadline, String authoritySignature) {
        return execute("claimWinnings", () -> {
            store.requireInitialized();
            settlementGuardian.requireResolved();
            String account = Addresses.normalize(user);
            authorization.authorizeByAuthority(
                    account,
                    deadline,
                    MarketMessages.claimTier(account, claimKind, tier, authorization.nonceOf(account), deadline),
                    authoritySignature);

            ClaimResult result = switch (claimKind) {
                case OUTCOME_TOKENS -> redeemOutcomeTokens(account);
                case LEVERAGED_POSITION -> {
                    LeveragedPosition position = settlementGuardian.requireWinningPosition(account);
                    PositionClaim claim = settlementGuardian.settlePosition(position, tier);
                    funds.settleDebt(claim.principal(), claim.interest(), claim.shortfall());
                    yield new ClaimResult(account, claimKind, claim.payout(), claim.bonus());
                }
            };
            events.stageClaim(this, ClaimEventType.CLAIMED, account, claimKind, result.payout(), result.bonus());
            log.info("{} claimed {} {} (bonus {})", account, result.payout(), claimKind, result.bonus());
            funds.pay(account, result.payout());
            return result;
        });
    }

    /**
     * Settles a holder's unclaimed holding after the cooling-off period and sends the proceeds to
     * insurance. Leveraged positions on either side are settled, which also repays their loans.
     */
    public ClaimResult sweepUnclaimed(String caller, String user, ClaimKind claimKind) {
        return execute("sweepUnclaimed", () -> {
            store.requireInitialized();
            authorization.requireAuthority(caller);
            settlementGuardian.requireResolved();
            settlementGuardian.requireCoolingOffElapsed(clock.instant());
            String account = Addresses.normalize(user);

            ClaimResult result = switch (claimKind) {
                case OUTCOME_TOKENS -> redeemOutcomeTokens(account);
                case LEVERAGED_POSITION -> sweepPositions(account);
            };
            events.stageClaim(this, ClaimEventType.SWEPT, account, claimKind, result.payout(), result.bonus());
            log.info("Swept {} {} of {} to insurance", result.payout(), claimKind, account);
            funds.payInsurance(result.payout());
            return result;
        });
    }

    private ClaimResult redeemOutcomeTokens(String account) {
        OutcomeToken token = outcomeTokens.of(store.state().getWinningSide());
        BigInteger balance = token.balanceOf(account);
        if (balance.signum() == 0) {
            throw new LifecycleException(
                    ErrorCode.NOTHING_TO_CLAIM, account + " holds no winning " + token.symbol() + " tokens");
        }
        BigInteger payout = settlementGuardian.outcomeTokenPayout(balance);
        token.burn(account, balance);
        return new ClaimResult(account, ClaimKind.OUTCOME_TOKENS, payout, BigInteger.ZERO);
    }

    private ClaimResult sweepPositions(String account) {
        List<LeveragedPosition> open = new ArrayList<>();
        for (OutcomeSide side : OutcomeSide.values()) {
            store.findActivePosition(account, side).ifPresent(open::add);
        }
        if (open.isEmpty()) {
            throw new LifecycleException(ErrorCode.NO_ACTIVE_POSITION, account + " has no unclaimed positions");
        }
        BigInteger total = BigInteger.ZERO;
        for (LeveragedPosition position : open) {
            PositionClaim claim = settlementGuardian.settlePosition(position, null);
            funds.settleDebt(claim.principal(), claim.interest(), claim.shortfall());
            total = total.add(claim.net());
        }
        return new ClaimResult(account, ClaimKind.LEVERAGED_POSITION, total, BigInteger.ZERO);
    }

    // ==============================
    // QUERIES
    // ==============================

    public MarketSnapshot snapshot() {
        return read(() -> {
            store.requireInitialized();
            MarketState s = store.state();
            return new MarketSnapshot(
                    s.getPhase(),
                    s.getParametersVersion(),
                    s.getAuthority(),
                    s.getCurrentSupply(),
                    s.getTotalCapitalRaised(),
                    store.parameters().getMigrationThreshold(),
                    s.isMigrated(),
                    s.getReserveStable(),
                    s.getReserveYes(),
                    s.getReserveNo(),
                    s.getInvariantK(),
                    amm.priceOf(OutcomeSide.YES),
                    amm.priceOf(OutcomeSide.NO),
                    s.getTotalBorrowed(),
                    s.getOpenInterestYes(),
                    s.getOpenInterestNo(),
                    s.getWinningSide(),
                    s.getSettlementPrice(),
                    s.getBonusReserve(),
                    s.getResolvedAt());
        });
    }

    /** WAD price of a side; zero before migration. */
    public BigInteger priceOf(OutcomeSide side) {
        return read(() -> amm.priceOf(side));
    }

    public BigInteger openInterestOf(OutcomeSide side) {
        return read(() -> store.state().openInterestOf(side));
    }

    public Optional<LeveragedPosition> position(String trader, OutcomeSide side) {
        return read(() -> store.findPosition(Addresses.normalize(trader), side).map(p -> p.toBuilder().build()));
    }

    public List<LeveragedPosition> activePositions() {
        return read(store::activePositions);
    }

    public BigInteger nonceOf(String address) {
        return read(() -> store.nonceOf(Addresses.normalize(address)));
    }

    public BigInteger outcomeBalance(OutcomeSide side, String holder) {
        return read(() -> outcomeTokens.of(side).balanceOf(Addresses.normalize(holder)));
    }

    // ==============================
    // INTERNALS
    // ==============================

    private void requirePreMigration() {
        MarketPhase phase = store.state().getPhase();
        if (phase == MarketPhase.RESOLVED) {
            throw new LifecycleException(ErrorCode.MARKET_ALREADY_RESOLVED, "Market is already resolved");
        }
        if (phase == MarketPhase.PHASE2_ACTIVE) {
            throw new LifecycleException(ErrorCode.MARKET_ALREADY_MIGRATED, "Bonding curve sale has ended");
        }
    }

    private void requirePhase2Active() {
        if (store.state().getPhase() != MarketPhase.PHASE2_ACTIVE) {
            throw new LifecycleException(
                    ErrorCode.PHASE2_NOT_ACTIVE, "Leveraged trading is not active in phase " + store.state().getPhase());
        }
    }

    private void stageRebalance(AmmTrade trade) {
        events.stageRebalance(this, trade.side(), trade.priceYes(), trade.priceNo(), trade.clamped());
    }

    private static Map<String, Object> settlementDetails(PositionSettlement settlement) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("proceeds", settlement.proceeds());
        details.put("principal", settlement.principal());
        details.put("interest", settlement.interest());
        details.put("shortfall", settlement.shortfall());
        details.put("payout", settlement.surplus());
        details.put("pnl", settlement.pnl());
        return details;
    }

    private <T> T read(Supplier<T> query) {
        lock.lock();
        try {
            return query.get();
        } finally {
            lock.unlock();
        }
    }

    private <T> T execute(String operation, Supplier<T> action) {
        if (lock.isHeldByCurrentThread()) {
            throw new GuardViolationException(
                    ErrorCode.REENTRANT_CALL, "Re-entrant call to " + operation + " while another call is in flight");
        }
        lock.lock();
        try {
            T result = runAtomically(operation, action);
            events.flush();
            return result;
        } finally {
            lock.unlock();
        }
    }

    private <T> T runAtomically(String operation, Supplier<T> action) {
        List<Runnable> restorers = new ArrayList<>(rollbackParticipants.size());
        for (RollbackSupport participant : rollbackParticipants) {
            restorers.add(participant.checkpoint());
        }
        try {
            return action.get();
        } catch (RuntimeException e) {
            events.discard();
            for (int i = restorers.size() - 1; i >= 0; i--) {
                restorers.get(i).run();
            }
            if (e instanceof BaseException baseException) {
                log.warn("{} rejected [{}]: {}", operation, baseException.getErrorCode().getCode(), e.getMessage());
            } else {
                log.error("{} failed, market state rolled back", operation, e);
            }
            throw e;
        }
    }
}
