package io.pocwatchdog.loop;

import io.pocwatchdog.Job;
import io.pocwatchdog.RunOutcome;
import io.pocwatchdog.WatchdogException;
import io.pocwatchdog.ast.ScheduleData;
import io.pocwatchdog.display.Display;
import io.pocwatchdog.eval.Evaluator;
import io.pocwatchdog.eval.TickLedger;
import io.pocwatchdog.eval.WakePlan;
import io.pocwatchdog.notify.Notification;
import io.pocwatchdog.notify.NotificationConfig;
import io.pocwatchdog.notify.NotificationDispatcher;
import io.pocwatchdog.notify.NotificationPolicy;
import io.pocwatchdog.notify.SmtpSettings;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a job at the times of a resolved schedule, one invocation at a time.
 *
 * <p>Each cycle plans the next wake across all rules, sleeps until then, runs the job once for all
 * rules due at that instant, and notifies the outcome. Job failures and notification failures are
 * logged and never end the loop; only interrupting the thread does.
 *
 * <p>Not thread-safe: a loop is owned by the single thread that runs it.
 */
public final class ExecutionLoop {
  private static final Logger logger = LoggerFactory.getLogger(ExecutionLoop.class);

  private final ScheduleData schedule;
  private final Job job;
  private final NotificationConfig notifications;
  private final SmtpSettings smtp;
  private final NotificationDispatcher dispatcher;
  private final Clock clock;
  private final Sleeper sleeper;
  private final TickLedger ticks = new TickLedger();

  /**
   * Creates a loop.
   *
   * @param schedule the resolved schedule
   * @param job the job to run
   * @param notifications the notification config
   * @param smtp the resolved SMTP endpoint (may be null when notifications are disabled)
   * @param dispatcher the dispatcher used to send notifications
   * @param clock the wall clock; its zone defines "today"
   * @param sleeper the sleeper used to wait for the next wake
   */
  public ExecutionLoop(
      ScheduleData schedule,
      Job job,
      NotificationConfig notifications,
      SmtpSettings smtp,
      NotificationDispatcher dispatcher,
      Clock clock,
      Sleeper sleeper) {
    this.schedule = Objects.requireNonNull(schedule, "schedule");
    this.job = Objects.requireNonNull(job, "job");
    this.notifications = Objects.requireNonNull(notifications, "notifications");
    this.smtp = smtp;
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    if (notifications.enabled() && smtp == null) {
      throw new IllegalArgumentException("SMTP settings are required when notifications are on");
    }
  }

  /** Runs cycles until the thread is interrupted or no rule can fire again. */
  public void run() {
    logger.info("Watchdog started: {}", Display.render(schedule));
    try {
      while (!Thread.currentThread().isInterrupted()) {
        Cycle cycle = runCycle();
        if (cycle.kind() == Cycle.Kind.STOPPED) {
          logger.error(
              "Watchdog stopped: no rule of '{}' can fire again", Display.render(schedule));
          return;
        }
      }
      logger.info("Watchdog stopped: interrupted");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.info("Watchdog stopped: interrupted while waiting");
    }
  }

  /**
   * Runs one cycle: plan, wait, run the job if a due rule is honored, notify.
   *
   * @return what the cycle did
   * @throws InterruptedException if interrupted while waiting
   */
  public Cycle runCycle() throws InterruptedException {
    Optional<WakePlan> plan = Evaluator.plan(schedule, now(), ticks);
    if (plan.isEmpty()) {
      return Cycle.stopped();
    }

    ZonedDateTime wake = plan.get().wake();
    logger.debug("Next wake at {}", wake);
    sleeper.sleepUntil(wake.toInstant());

    ZonedDateTime woke = now();
    List<WakePlan.Candidate> due = plan.get().dueAt(woke);
    if (!Evaluator.honorDue(due, woke, ticks)) {
      logger.debug("Skipped tick at {}: day restriction not met", woke);
      return Cycle.skipped(woke);
    }

    logger.info("Running job at {} for [{}]", woke, describe(due));
    RunOutcome outcome = RunOutcome.capture(job);
    if (outcome instanceof RunOutcome.Failure failure) {
      logger.error("Job failed: {}", failure.description(), failure.cause());
    } else {
      logger.info("Job succeeded");
    }

    notifyOutcome(outcome);
    return Cycle.ran(woke, outcome);
  }

  private void notifyOutcome(RunOutcome outcome) {
    Optional<Notification> notification = NotificationPolicy.compose(outcome, notifications);
    if (notification.isEmpty()) {
      return;
    }
    try {
      dispatcher.send(notification.get(), notifications, smtp);
    } catch (WatchdogException e) {
      logger.warn("Notification not sent: {}", e.getMessage(), e);
    } catch (RuntimeException e) {
      logger.warn("Notification dispatcher failed unexpectedly", e);
    }
  }

  private ZonedDateTime now() {
    return ZonedDateTime.now(clock);
  }

  private static String describe(List<WakePlan.Candidate> due) {
    return due.stream()
        .map(c -> Display.renderRule(c.rule()))
        .distinct()
        .collect(Collectors.joining("; "));
  }
}
