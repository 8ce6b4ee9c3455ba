package com.spectrace.tg.engine;

import com.spectrace.tg.api.Resolution;
import com.spectrace.tg.io.PendingLink;

/**
 * A pending link that did not resolve.
 *
 * @param link       the reference as parsed
 * @param resolution {@link Resolution#BROKEN}, or {@link Resolution#SUPPRESSED} when the file's
 *                   expected-broken-links budget covered it
 * @param reason     why it did not resolve
 */
public record BrokenReference(PendingLink link, Resolution resolution, String reason) {
}
