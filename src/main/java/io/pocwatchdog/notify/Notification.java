package io.pocwatchdog.notify;

import java.nio.file.Path;
import java.util.List;

/**
 * A composed notification, ready to send.
 *
 * @param subject the subject
 * @param body the HTML body, placeholders already substituted
 * @param files files to attach
 * @param images images to embed inline
 */
public record Notification(String subject, String body, List<Path> files, List<Path> images) {
  /** Creates a new Notification with defensive copies. */
  public Notification {
    files = List.copyOf(files);
    images = List.copyOf(images);
  }
}
