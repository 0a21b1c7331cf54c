package org.jrename.conflicts.annotations;

/** Transient metadata about a span of a rewritten document. Lives for one rewrite pass of one document. */
public abstract class RenameAnnotation {}
