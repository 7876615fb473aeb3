package com.pricehistory.common.exception;

public class InvalidArgumentException extends MarketDataException {

    public InvalidArgumentException(String message) {
        super(FailureKind.INVALID_ARGUMENT, message);
    }
}
