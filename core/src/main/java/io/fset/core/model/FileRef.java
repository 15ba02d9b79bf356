package io.fset.core.model;

/** Minimal view of a persisted file: enough to attach children to it. */
public record FileRef(long id, String anchor) {
}
