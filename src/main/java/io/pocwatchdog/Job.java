package io.pocwatchdog;

/** The unit of work run on every trigger. Any return value is ignored. */
@FunctionalInterface
public interface Job {
  /**
   * Runs the job once.
   *
   * @throws Exception if the run fails; the failure is reported, never propagated
   */
  void run() throws Exception;
}
