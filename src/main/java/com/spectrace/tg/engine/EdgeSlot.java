package com.spectrace.tg.engine;

/** An edge together with its positions in both endpoint lists, so it can be put back exactly. */
record EdgeSlot(Edge edge, int outIndex, int inIndex) {
}
