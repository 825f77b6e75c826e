package net.gridcoord.core.error;

public enum ErrorCode {
    VALIDATION, NOT_FOUND, LEASE_MISMATCH, ALREADY_LEASED, UNAUTHORIZED
}
