package com.spectrace.tg.engine;

/** Hierarchy position of a node after classification. */
public enum NodeRole {
    /** No parent, and at least one meaningful child. */
    ROOT,
    /** No parent and nothing but satellites below it. */
    ORPHAN,
    /** Has a parent through Implements, Refines or Validates. */
    CHILD,
    /** Assertions, results and remainder text: lexical content that is not classified. */
    STRUCTURAL
}
