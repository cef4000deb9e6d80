package org.opensase.upo.apply;

/**
 * Why an apply stopped.
 *
 * @param operationIndex index of the failing operation, or -1 when the target failed
 *                       before any operation ran
 */
public record ApplyError(int operationIndex, String message) {

    public static ApplyError beforeOperations(String message) {
        return new ApplyError(-1, message);
    }

    @Override
    public String toString() {
        return operationIndex < 0 ? message : "operation " + operationIndex + ": " + message;
    }
}
