package com.curvemarket.api;

import com.curvemarket.api.dto.response.MarketEnvelope;
import com.curvemarket.api.dto.response.MarketEnvelope.MarketError;
import com.curvemarket.domain.model.MarketParameters;
import com.curvemarket.engine.MarketEngine;
import com.curvemarket.exception.ErrorCode;
import java.time.Clock;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Stamps API payloads and errors with this market's id and current phase. */
@Component
public class MarketEnvelopes {

    private final MarketEngine marketEngine;
    private final String marketId;
    private final Clock clock;

    public MarketEnvelopes(MarketEngine marketEngine, MarketParameters marketParameters, Clock clock) {
        this.marketEngine = marketEngine;
        this.marketId = marketParameters.getMarketId();
        this.clock = clock;
    }

    public <T> MarketEnvelope<T> ok(T data) {
        return MarketEnvelope.ok(marketId, marketEngine.currentPhase().orElse(null), data, clock.instant());
    }

    public MarketEnvelope<Void> failed(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        MarketError error = new MarketError(errorCode.getCode(), errorCode.getCategory(), message, details, path);
        return MarketEnvelope.failed(marketId, marketEngine.currentPhase().orElse(null), error, clock.instant());
    }
}
