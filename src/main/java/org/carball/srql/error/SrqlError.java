package org.carball.srql.error;

/**
 * Error value handed back to callers instead of an exception.
 *
 * @param kind    failure category
 * @param message user-displayable detail
 * @param offset  character offset in the raw query, or -1 when not tied to a position
 */
public record SrqlError(ErrorKind kind, String message, int offset) {

    public static SrqlError of(SrqlException e) {
        return new SrqlError(e.getKind(), e.getMessage(), e.getOffset());
    }

    public String displayMessage() {
        return offset >= 0
                ? String.format("%s at offset %d: %s", kind.getTitle(), offset, message)
                : String.format("%s: %s", kind.getTitle(), message);
    }
}
