package com.volarb.domain.enums;

/** Kind of tradeable instrument held by a position. */
public enum InstrumentType {
    EQUITY,
    EUROPEAN_OPTION,
    AMERICAN_OPTION
}
