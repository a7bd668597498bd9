package io.pocwatchdog.ast;

/**
 * Sealed interface for a single firing descriptor produced by normalizing one schedule value.
 *
 * <ul>
 *   <li>{@link IntervalFiring} - "every 30 seconds"
 *   <li>{@link TimepointFiring} - "at 08:00"
 * </ul>
 */
public sealed interface Firing permits IntervalFiring, TimepointFiring {}
