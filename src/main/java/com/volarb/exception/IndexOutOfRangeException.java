package com.volarb.exception;

import java.util.Map;

public class IndexOutOfRangeException extends BaseException {

    public IndexOutOfRangeException(String what, int index, int size) {
        super(
                ErrorCode.INDEX_OUT_OF_RANGE,
                String.format("%s index %d out of range [0, %d)", what, index, size),
                Map.of("index", index, "size", size));
    }
}
