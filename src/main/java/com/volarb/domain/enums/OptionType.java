package com.volarb.domain.enums;

/** Call or put right. The symbol code is used when building option identifiers. */
public enum OptionType {
    CALL("C"),
    PUT("P");

    private final String code;

    OptionType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
