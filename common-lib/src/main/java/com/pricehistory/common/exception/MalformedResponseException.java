package com.pricehistory.common.exception;

public class MalformedResponseException extends MarketDataException {

    public MalformedResponseException(String message) {
        super(FailureKind.MALFORMED_RESPONSE, message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(FailureKind.MALFORMED_RESPONSE, message, cause);
    }
}
