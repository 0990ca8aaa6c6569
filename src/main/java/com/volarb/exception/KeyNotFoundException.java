package com.volarb.exception;

public class KeyNotFoundException extends BaseException {

    public KeyNotFoundException(String resourceType, String key) {
        super(ErrorCode.KEY_NOT_FOUND, String.format("%s not found for key: %s", resourceType, key));
    }
}
