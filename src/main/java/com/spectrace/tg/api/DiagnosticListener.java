package com.spectrace.tg.api;

/**
 * Receives diagnostics as they are produced while parsing and building.
 *
 * Listeners run on the building thread. The build itself also collects every
 * diagnostic into its result, so a listener is only needed for streaming
 * consumers such as logging or progress output.
 */
public interface DiagnosticListener {

    /**
     * Called once per diagnostic, in the order the build emits them.
     *
     * @param diagnostic the finding
     */
    void onDiagnostic(Diagnostic diagnostic);

    /**
     * Called when a build pass finishes.
     *
     * @param pass        short pass name, such as "resolve" or "classify"
     * @param diagnostics number of diagnostics the pass produced
     */
    default void onPassComplete(String pass, int diagnostics) {
    }
}
