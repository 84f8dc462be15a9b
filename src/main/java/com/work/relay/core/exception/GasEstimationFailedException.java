package com.work.relay.core.exception;

public class GasEstimationFailedException extends RelayException {

    public GasEstimationFailedException(String message) {
        super(RelayErrorCode.GAS_ESTIMATION_FAILED, "could not estimate gas", message);
    }

    public GasEstimationFailedException(String message, Throwable cause) {
        super(RelayErrorCode.GAS_ESTIMATION_FAILED, "could not estimate gas", message, cause);
    }
}
