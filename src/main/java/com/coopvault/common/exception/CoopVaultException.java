package com.coopvault.common.exception;

/**
 * Base exception for all coop vault exceptions.
 */
public class CoopVaultException extends RuntimeException {

    private final ErrorKind kind;

    public CoopVaultException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CoopVaultException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
