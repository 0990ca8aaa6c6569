package com.volarb.domain.enums;

public enum SignalType {
    BUY,
    SELL,
    HOLD
}
