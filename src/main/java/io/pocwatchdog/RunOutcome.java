package io.pocwatchdog;

import java.util.Objects;

/**
 * The result of one job invocation.
 *
 * <ul>
 *   <li>{@link Success} - the job returned normally
 *   <li>{@link Failure} - the job threw
 * </ul>
 */
public sealed interface RunOutcome permits RunOutcome.Success, RunOutcome.Failure {

  /** The job returned normally. */
  record Success() implements RunOutcome {}

  /**
   * The job threw.
   *
   * @param description the textual representation of the error
   * @param cause the error itself (may be null)
   */
  record Failure(String description, Throwable cause) implements RunOutcome {
    /** Validates non-null description. */
    public Failure {
      Objects.requireNonNull(description, "description");
    }
  }

  /**
   * Returns whether this outcome is a success.
   *
   * @return true for {@link Success}
   */
  default boolean succeeded() {
    return this instanceof Success;
  }

  /**
   * Runs a job and captures its outcome. Exceptions and errors thrown by the job never escape,
   * except a {@link VirtualMachineError}, which is rethrown.
   *
   * @param job the job to run
   * @return the outcome
   */
  static RunOutcome capture(Job job) {
    try {
      job.run();
      return new Success();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return new Failure(e.toString(), e);
    } catch (Exception e) {
      return new Failure(e.toString(), e);
    } catch (VirtualMachineError e) {
      throw e;
    } catch (Throwable t) {
      return new Failure(t.toString(), t);
    }
  }
}
