package com.ledger.engine.action;

/**
 * Failure of a single action. Never escapes {@link ActionExecutor}: it is turned into a
 * failed outcome and the transaction's whole action batch is rolled back.
 */
public class ActionExecutionException extends RuntimeException {

    public enum ErrorKind {
        /** The action's value is missing or malformed for its type. */
        VALIDATION,
        /** The action references an account that does not exist. */
        REFERENCE_NOT_FOUND,
        /** The transaction is not in a state the action can work on. */
        PRECONDITION
    }

    private final ErrorKind kind;

    public ActionExecutionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    static ActionExecutionException validation(String message) {
        return new ActionExecutionException(ErrorKind.VALIDATION, message);
    }

    static ActionExecutionException accountNotFound(String name) {
        return new ActionExecutionException(ErrorKind.REFERENCE_NOT_FOUND, "Account '" + name + "' not found");
    }

    static ActionExecutionException precondition(String message) {
        return new ActionExecutionException(ErrorKind.PRECONDITION, message);
    }
}
