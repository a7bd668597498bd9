package io.pocwatchdog.ast;

/**
 * Fires once a day at a wall-clock time.
 *
 * @param time the time of day
 */
public record TimepointFiring(TimeOfDay time) implements Firing {}
