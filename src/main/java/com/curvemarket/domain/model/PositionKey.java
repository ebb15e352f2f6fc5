package com.curvemarket.domain.model;

import com.curvemarket.domain.enums.OutcomeSide;

/** A trader holds at most one leveraged position per side. */
public record PositionKey(String trader, OutcomeSide side) {}
