package org.opensase.upo.intent;

/**
 * One problem found in an intent document.
 *
 * @param path location in the document, e.g. {@code egressRules[3].destination}
 */
public record ValidationIssue(String path, String message) {

    @Override
    public String toString() {
        return path + ": " + message;
    }
}
