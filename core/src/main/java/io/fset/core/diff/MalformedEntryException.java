package io.fset.core.diff;

/**
 * A diff entry (or bucket) that cannot be translated: missing anchor, wrong
 * value type, non-object where an object is required.
 * Fatal to the whole diff application.
 */
public class MalformedEntryException extends IllegalArgumentException {

    public MalformedEntryException(String message) {
        super(message);
    }
}
