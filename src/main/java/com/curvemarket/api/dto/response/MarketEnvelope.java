package com.curvemarket.api.dto.response;

import com.curvemarket.domain.enums.MarketPhase;
import com.curvemarket.exception.ErrorCategory;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Map;
import lombok.Getter;

/**
 * Body of every market API response. Carries the market it came from and the phase the
 * market was in once the call finished, so a client can tell a rejected trade from a market
 * that has moved on. Exactly one of {@code data} and {@code error} is present.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MarketEnvelope<T> {

    private final boolean success;
    private final String marketId;
    private final MarketPhase phase;
    private final T data;
    private final MarketError error;
    private final Instant timestamp;

    private MarketEnvelope(String marketId, MarketPhase phase, T data, MarketError error, Instant timestamp) {
        this.success = error == null;
        this.marketId = marketId;
        this.phase = phase;
        this.data = data;
        this.error = error;
        this.timestamp = timestamp;
    }

    public static <T> MarketEnvelope<T> ok(String marketId, MarketPhase phase, T data, Instant timestamp) {
        return new MarketEnvelope<>(marketId, phase, data, null, timestamp);
    }

    public static MarketEnvelope<Void> failed(String marketId, MarketPhase phase, MarketError error, Instant timestamp) {
        return new MarketEnvelope<>(marketId, phase, null, error, timestamp);
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record MarketError(
            String code, ErrorCategory category, String message, Map<String, Object> details, String path) {}
}
