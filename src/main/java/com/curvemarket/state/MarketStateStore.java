package com.curvemarket.state;

import com.curvemarket.domain.enums.OutcomeSide;
import com.curvemarket.domain.model.LeveragedPosition;
import com.curvemarket.domain.model.MarketParameters;
import com.curvemarket.domain.model.MarketState;
import com.curvemarket.domain.model.PositionKey;
import com.curvemarket.exception.ErrorCode;
import com.curvemarket.exception.LifecycleException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * In-memory home of one market: parameters, aggregate state, positions and signer nonces.
 *
 * <p>Not thread-safe on its own. {@link com.curvemarket.engine.MarketEngine} serialises every
 * access through its call lock.
 */
@Component
public class MarketStateStore implements RollbackSupport {

    private MarketParameters parameters;
    private MarketState state = MarketState.builder().build();
    private final Map<PositionKey, LeveragedPosition> positions = new LinkedHashMap<>();
    private final Map<String, BigInteger> nonces = new HashMap<>();

    public void initialize(MarketParameters parameters, String authority) {
        if (state.isInitialized()) {
            throw new LifecycleException(ErrorCode.ALREADY_INITIALIZED, "Market is already initialized");
        }
        parameters.validate();
        this.parameters = parameters;
        this.state = MarketState.builder()
                .initialized(true)
                .parametersVersion(parameters.getVersion())
                .authority(authority)
                .build();
    }

    public boolean isInitialized() {
        return state.isInitialized();
    }

    public MarketParameters parameters() {
        requireInitialized();
        return parameters;
    }

    public MarketState state() {
        return state;
    }

    public void requireInitialized() {
        if (!state.isInitialized()) {
            throw new LifecycleException(ErrorCode.NOT_INITIALIZED, "Market has not been initialized");
        }
    }

    // ---- Positions ----

    public Optional<LeveragedPosition> findPosition(String trader, OutcomeSide side) {
        return Optional.ofNullable(positions.get(new PositionKey(trader, side)));
    }

    public Optional<LeveragedPosition> findActivePosition(String trader, OutcomeSide side) {
        return findPosition(trader, side).filter(LeveragedPosition::isActive);
    }

    public void savePosition(LeveragedPosition position) {
        positions.put(position.key(), position);
    }

    public List<LeveragedPosition> activePositions() {
        List<LeveragedPosition> active = new ArrayList<>();
        for (LeveragedPosition position : positions.values()) {
            if (position.isActive()) {
                active.add(position.toBuilder().build());
            }
        }
        return active;
    }

    // ---- Nonces ----

    public BigInteger nonceOf(String signer) {
        return nonces.getOrDefault(signer, BigInteger.ZERO);
    }

    public void incrementNonce(String signer) {
        nonces.merge(signer, BigInteger.ONE, BigInteger::add);
    }

    @Override
    public Runnable checkpoint() {
        MarketParameters savedParameters = parameters;
        MarketState savedState = state.toBuilder().build();
        Map<PositionKey, LeveragedPosition> savedPositions = new LinkedHashMap<>();
        positions.forEach((key, position) -> savedPositions.put(key, position.toBuilder().build()));
        Map<String, BigInteger> savedNonces = new HashMap<>(nonces);
        return () -> {
            parameters = savedParameters;
            state = savedState;
            positions.clear();
            positions.putAll(savedPositions);
            nonces.clear();
            nonces.putAll(savedNonces);
        };
    }
}
