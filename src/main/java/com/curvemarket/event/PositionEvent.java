package com.curvemarket.event;

import com.curvemarket.domain.model.LeveragedPosition;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a leveraged position changes state.
 *
 * <p>{@code details} carries the amounts relevant to the event type, for example the
 * loan for {@link PositionEventType#LEVERAGE_ACTIVATED} or the payout, PnL and keeper
 * reward for {@link PositionEventType#LIQUIDATED}.
 */
public class PositionEvent extends ApplicationEvent {

    private final LeveragedPosition position;
    private final PositionEventType eventType;
    private final Map<String, Object> details;

    public PositionEvent(
            Object source, LeveragedPosition position, PositionEventType eventType, Map<String, Object> details) {
        super(source);
        this.position = position;
        this.eventType = eventType;
        this.details = details != null ? details : Map.of();
    }

    public LeveragedPosition getPosition() {
        return position;
    }

    public PositionEventType getEventType() {
        return eventType;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
