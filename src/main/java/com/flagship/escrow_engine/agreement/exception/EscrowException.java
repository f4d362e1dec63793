package com.flagship.escrow_engine.agreement.exception;

import com.flagship.escrow_engine.agreement.AgreementStatus;
import com.flagship.escrow_engine.ledger.Identity;
import com.flagship.escrow_engine.ledger.InsufficientFundsException;
import lombok.Getter;

/**
 * A rejected escrow operation. Nothing has been changed when this is thrown.
 */
@Getter
public class EscrowException extends RuntimeException {

    private final EscrowErrorCode errorCode;
    private final Long agreementId;

    public EscrowException(EscrowErrorCode errorCode, Long agreementId, String message) {
        super(message);
        this.errorCode = errorCode;
        this.agreementId = agreementId;
    }

    public EscrowException(EscrowErrorCode errorCode, Long agreementId, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.agreementId = agreementId;
    }

    public static EscrowException notFound(long agreementId) {
        return new EscrowException(EscrowErrorCode.NOT_FOUND, agreementId,
            "Agreement not found: " + agreementId);
    }

    public static EscrowException notAuthorized(long agreementId, Identity caller, String requiredRole) {
        return new EscrowException(EscrowErrorCode.NOT_AUTHORIZED, agreementId,
            String.format("%s is not the %s of agreement %d", caller, requiredRole, agreementId));
    }

    public static EscrowException invalidStatus(long agreementId, AgreementStatus actual, AgreementStatus required) {
        return new EscrowException(EscrowErrorCode.INVALID_STATUS, agreementId,
            String.format("Agreement %d is %s, expected %s", agreementId, actual, required));
    }

    public static EscrowException alreadyExists(long agreementId) {
        return new EscrowException(EscrowErrorCode.ALREADY_EXISTS, agreementId,
            "Agreement already exists: " + agreementId);
    }

    public static EscrowException insufficientFunds(long agreementId, InsufficientFundsException cause) {
        return new EscrowException(EscrowErrorCode.INSUFFICIENT_FUNDS, agreementId, cause.getMessage(), cause);
    }
}
