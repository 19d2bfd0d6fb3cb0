package com.namehub.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Precondition failure of a registry operation. Thrown before any state is written.
 */
@Getter
public class RegistryException extends RuntimeException {

    private final RegistryErrorCode code;

    public RegistryException(RegistryErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public HttpStatus getStatus() {
        return code.status();
    }

    public static RegistryException unauthorized(String detail) {
        return new RegistryException(RegistryErrorCode.UNAUTHORIZED, detail);
    }

    public static RegistryException invalidRange(String detail) {
        return new RegistryException(RegistryErrorCode.INVALID_RANGE, detail);
    }

    public static RegistryException alreadyActive(Long activeSeasonId) {
        return new RegistryException(
                RegistryErrorCode.ALREADY_ACTIVE,
                "Another season is already active: " + activeSeasonId
        );
    }

    public static RegistryException notDraft(Long seasonId) {
        return new RegistryException(RegistryErrorCode.NOT_DRAFT, "Season is not in draft: " + seasonId);
    }

    public static RegistryException notActive(Long seasonId) {
        return new RegistryException(RegistryErrorCode.NOT_ACTIVE, "Season is not active: " + seasonId);
    }

    public static RegistryException noActiveSeason() {
        return new RegistryException(RegistryErrorCode.NO_ACTIVE_SEASON, "No active season");
    }

    public static RegistryException seasonNotFound(Long seasonId) {
        return new RegistryException(RegistryErrorCode.SEASON_NOT_FOUND, "Season not found: " + seasonId);
    }

    public static RegistryException seasonNotOpen(Long seasonId) {
        return new RegistryException(
                RegistryErrorCode.SEASON_NOT_OPEN,
                "Season is not open for registration: " + seasonId
        );
    }

    public static RegistryException seasonFull(Long seasonId) {
        return new RegistryException(RegistryErrorCode.SEASON_FULL, "Season has no names left: " + seasonId);
    }

    public static RegistryException invalidName(String detail) {
        return new RegistryException(RegistryErrorCode.INVALID_NAME, detail);
    }

    public static RegistryException invalidNameLength(int minLength, int maxLength) {
        return new RegistryException(
                RegistryErrorCode.INVALID_NAME_LENGTH,
                "Name length must be between " + minLength + " and " + maxLength
        );
    }

    public static RegistryException nameTaken(String name) {
        return new RegistryException(RegistryErrorCode.NAME_TAKEN, "Name is already registered: " + name);
    }

    public static RegistryException nameNotFound(String name) {
        return new RegistryException(RegistryErrorCode.NAME_NOT_FOUND, "Name not found: " + name);
    }

    public static RegistryException alreadyRegistered(String owner) {
        return new RegistryException(
                RegistryErrorCode.ALREADY_REGISTERED,
                "Owner already holds a name: " + owner
        );
    }

    public static RegistryException replayedPayment(String blockReference) {
        return new RegistryException(
                RegistryErrorCode.REPLAYED_PAYMENT,
                "Ledger reference already used: " + blockReference
        );
    }

    public static RegistryException paymentNotVerified(String blockReference) {
        return new RegistryException(
                RegistryErrorCode.PAYMENT_NOT_VERIFIED,
                "Payment could not be verified: " + blockReference
        );
    }

    public static RegistryException lastAdmin(String principal) {
        return new RegistryException(
                RegistryErrorCode.LAST_ADMIN,
                "Cannot demote the last remaining admin: " + principal
        );
    }

    public static RegistryException invalidPrincipal(String detail) {
        return new RegistryException(RegistryErrorCode.INVALID_PRINCIPAL, detail);
    }
}
