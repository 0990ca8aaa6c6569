package com.volarb.domain.enums;

/** Direction of an executed trade. */
public enum TradeAction {
    BUY,
    SELL;

    /** Returns the opposite side: BUY -> SELL, SELL -> BUY. Used when closing positions. */
    public TradeAction opposite() {
        return this == BUY ? SELL : BUY;
    }

    /** BUY for a positive quantity change, SELL for a negative one. */
    public static TradeAction forQuantityChange(double quantityChange) {
        return quantityChange >= 0 ? BUY : SELL;
    }
}
