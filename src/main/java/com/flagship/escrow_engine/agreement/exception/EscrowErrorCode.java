package com.flagship.escrow_engine.agreement.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Failure kinds of escrow operations, with their stable numeric codes.
 */
@Getter
@RequiredArgsConstructor
public enum EscrowErrorCode {
    NOT_AUTHORIZED(100),
    ALREADY_EXISTS(101),
    INVALID_STATUS(102),
    INSUFFICIENT_FUNDS(103),
    NOT_FOUND(104);

    private final int code;
}
