package com.example.battlearena.error;

/** A required read or write against the store failed. Safe to retry. */
public class PersistenceFailureException extends GameException {
    public PersistenceFailureException(Throwable cause) {
        super(GameErrorCode.PERSISTENCE_FAILURE, cause);
    }
}
