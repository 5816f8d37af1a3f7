package com.tracepulse.telemetry.processor;

/**
 * Textual form of a call's arguments.
 *
 * @param args   positional values, e.g. {@code [2, 3]}
 * @param kwargs the same values keyed by parameter name, e.g. {@code {a=2, b=3}}; null when names are unknown
 */
public record CapturedArgs(String args, String kwargs) {
}
