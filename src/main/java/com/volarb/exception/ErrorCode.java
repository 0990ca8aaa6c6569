package com.volarb.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("Invalid argument or configuration"),
    INSUFFICIENT_DATA("Too few observations for the requested operation"),
    MISSING_DATA("No market data for a requested symbol"),
    INDEX_OUT_OF_RANGE("Position or element index out of range"),
    KEY_NOT_FOUND("Lookup key not present"),
    IO_ERROR("Market data or report file could not be read or written");

    private final String description;
}
