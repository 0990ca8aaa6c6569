package com.volarb.exception;

public class MissingDataException extends BaseException {

    public MissingDataException(String symbol) {
        super(ErrorCode.MISSING_DATA, "No market data available for symbol: " + symbol);
    }
}
