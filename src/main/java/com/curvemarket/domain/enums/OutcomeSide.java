package com.curvemarket.domain.enums;

public enum OutcomeSide {
    YES,
    NO;

    public OutcomeSide opposite() {
        return this == YES ? NO : YES;
    }

    public static OutcomeSide of(boolean isYes) {
        return isYes ? YES : NO;
    }

    public boolean isYes() {
        return this == YES;
    }
}
