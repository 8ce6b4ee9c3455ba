package com.spectrace.tg.io;

/** Content-type tag of a parsed fragment. */
public enum FragmentType {
    COMMENT, FIXTURE, REQUIREMENT, JOURNEY, CODE_REF, TEST_REF, TEST_RESULT, REMAINDER
}
