package io.pocwatchdog;

import io.pocwatchdog.ast.ScheduleValue;
import io.pocwatchdog.config.WatchdogConfig;
import io.pocwatchdog.loop.Cycle;
import io.pocwatchdog.loop.ExecutionLoop;
import io.pocwatchdog.loop.Sleeper;
import io.pocwatchdog.loop.ThreadSleeper;
import io.pocwatchdog.notify.EmailDispatcher;
import io.pocwatchdog.notify.NotificationConfig;
import io.pocwatchdog.notify.NotificationDispatcher;
import io.pocwatchdog.notify.SmtpSettings;
import java.time.Clock;
import java.util.Optional;

/**
 * Runs a job on a schedule and emails the outcome.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Watchdog.builder()
 *     .job(() -> report.generate())
 *     .schedule(Map.of("mon", List.of("08:00", "12:00"), 15, 3600))
 *     .notifications(
 *         NotificationConfig.builder()
 *             .sender("ops@gmail.com")
 *             .password(secret)
 *             .recipients("team@example.com")
 *             .notifyFailure(true)
 *             .build())
 *     .build()
 *     .run();
 * }</pre>
 *
 * <p>All configuration errors surface from {@link Builder#build()} before any waiting begins.
 */
public final class Watchdog {
  private final Schedule schedule;
  private final NotificationConfig notifications;
  private final SmtpSettings smtp;
  private final ExecutionLoop loop;

  private Watchdog(Builder b, Schedule schedule, SmtpSettings smtp) {
    this.schedule = schedule;
    this.notifications = b.notifications;
    this.smtp = smtp;
    Clock clock = b.clock;
    Sleeper sleeper = b.sleeper != null ? b.sleeper : new ThreadSleeper(clock);
    NotificationDispatcher dispatcher = b.dispatcher != null ? b.dispatcher : new EmailDispatcher();
    this.loop =
        new ExecutionLoop(schedule.data(), b.job, notifications, smtp, dispatcher, clock, sleeper);
  }

  /**
   * Starts building a watchdog.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Validates the input and runs the job on the schedule until the thread is interrupted.
   *
   * @param job the job to run
   * @param schedule the schedule as a {@link ScheduleValue} or a plain value (number, {@code
   *     "HH:MM"} string, list or map)
   * @param notifications the notification config
   * @throws WatchdogException if the schedule or the notification config is invalid
   */
  public static void run(Job job, Object schedule, NotificationConfig notifications)
      throws WatchdogException {
    builder().job(job).schedule(schedule).notifications(notifications).build().run();
  }

  /** Runs the job on the schedule until the thread is interrupted. */
  public void run() {
    loop.run();
  }

  /**
   * Runs a single cycle: wait for the next trigger, run the job, notify.
   *
   * @return what the cycle did
   * @throws InterruptedException if interrupted while waiting
   */
  public Cycle runCycle() throws InterruptedException {
    return loop.runCycle();
  }

  /**
   * Returns the resolved schedule.
   *
   * @return the schedule
   */
  public Schedule schedule() {
    return schedule;
  }

  /**
   * Returns the notification config.
   *
   * @return the config
   */
  public NotificationConfig notifications() {
    return notifications;
  }

  /**
   * Returns the SMTP endpoint notifications are sent through.
   *
   * @return the endpoint, or empty when notifications are disabled
   */
  public Optional<SmtpSettings> smtp() {
    return Optional.ofNullable(smtp);
  }

  /** Builder for {@link Watchdog}. */
  public static final class Builder {
    private Job job;
    private ScheduleValue scheduleValue;
    private String scheduleJson;
    private NotificationConfig notifications = NotificationConfig.disabled();
    private Clock clock = Clock.systemDefaultZone();
    private Sleeper sleeper;
    private NotificationDispatcher dispatcher;

    private Builder() {}

    public Builder job(Job job) {
      this.job = job;
      return this;
    }

    /**
     * Sets the schedule.
     *
     * @param schedule a {@link ScheduleValue} or a plain value accepted by {@link
     *     ScheduleValue#of(Object)}
     * @return this builder
     */
    public Builder schedule(Object schedule) {
      this.scheduleValue = ScheduleValue.of(schedule);
      this.scheduleJson = null;
      return this;
    }

    /**
     * Sets the schedule from JSON text.
     *
     * @param json the JSON schedule, e.g. {@code {"mon": "08:00"}}
     * @return this builder
     */
    public Builder scheduleJson(String json) {
      this.scheduleJson = json;
      this.scheduleValue = null;
      return this;
    }

    /**
     * Sets the schedule and notifications from a loaded config.
     *
     * @param config the loaded config
     * @return this builder
     */
    public Builder config(WatchdogConfig config) {
      return schedule(config.schedule()).notifications(config.notifications());
    }

    public Builder notifications(NotificationConfig notifications) {
      this.notifications = notifications;
      return this;
    }

    /** Sets the wall clock; its zone defines local days. Defaults to the system clock. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Sets how the loop waits. Defaults to a {@link ThreadSleeper} on the clock. */
    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /** Sets how notifications are sent. Defaults to an {@link EmailDispatcher}. */
    public Builder dispatcher(NotificationDispatcher dispatcher) {
      this.dispatcher = dispatcher;
      return this;
    }

    /**
     * Validates the configuration and resolves the schedule.
     *
     * @return the watchdog, ready to run
     * @throws WatchdogException if the job is missing, the schedule is invalid, or notifications
     *     are enabled with incomplete credentials or an unsupported sender domain
     */
    public Watchdog build() throws WatchdogException {
      if (job == null) {
        throw WatchdogException.configuration("a job is required");
      }
      if (notifications == null) {
        throw WatchdogException.configuration("a notification config is required");
      }
      if (clock == null) {
        throw WatchdogException.configuration("a clock is required");
      }
      Schedule schedule;
      if (scheduleJson != null) {
        schedule = Schedule.parse(scheduleJson);
      } else if (scheduleValue != null) {
        schedule = Schedule.resolve(scheduleValue);
      } else {
        throw WatchdogException.invalidSchedule("a schedule is required", null);
      }
      SmtpSettings smtp = notifications.enabled() ? SmtpSettings.resolve(notifications) : null;
      return new Watchdog(this, schedule, smtp);
    }
  }
}
