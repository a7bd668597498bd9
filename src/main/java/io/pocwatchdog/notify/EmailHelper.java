package io.pocwatchdog.notify;

import jakarta.activation.DataHandler;
import jakarta.activation.FileDataSource;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMultipart;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Builds the MIME structure of notification emails. */
final class EmailHelper {
  private static final Logger logger = LoggerFactory.getLogger(EmailHelper.class);

  private EmailHelper() {}

  /**
   * Builds the message content.
   *
   * <p>The result is a {@code multipart/mixed} holding a {@code multipart/related} part (the HTML
   * body followed by inline images referenced as {@code cid:imageidN}) and then one part per
   * attached file. Missing files and images are skipped with a warning.
   *
   * @param body the HTML body
   * @param files files to attach
   * @param images images to embed inline
   * @return multipart ready to set in a MimeMessage
   * @throws MessagingException if a part cannot be built
   */
  static Multipart buildContent(String body, List<Path> files, List<Path> images)
      throws MessagingException {
    MimeMultipart related = new MimeMultipart("related");
    MimeBodyPart htmlPart = new MimeBodyPart();
    related.addBodyPart(htmlPart);

    StringBuilder imageTags = new StringBuilder();
    int imageId = 0;
    for (Path image : images) {
      if (!Files.isReadable(image)) {
        logger.warn("Skipping unreadable inline image {}", image);
        continue;
      }
      imageId++;
      String cid = "imageid" + imageId;
      MimeBodyPart imagePart = new MimeBodyPart();
      imagePart.setDataHandler(new DataHandler(new FileDataSource(image.toFile())));
      imagePart.setHeader("Content-ID", "<" + cid + ">");
      imagePart.setDisposition(MimeBodyPart.INLINE);
      related.addBodyPart(imagePart);
      imageTags
          .append("<p><img src=\"cid:")
          .append(cid)
          .append("\" alt=\"")
          .append(cid)
          .append("\"></p>");
    }

    String html =
        imageId == 0
            ? body
            : "<html><body><p>" + body + "</p>" + imageTags + "</body></html>";
    htmlPart.setContent(html, "text/html; charset=UTF-8");

    MimeBodyPart relatedPart = new MimeBodyPart();
    relatedPart.setContent(related);

    MimeMultipart mixed = new MimeMultipart("mixed");
    mixed.addBodyPart(relatedPart);

    for (Path file : files) {
      if (!Files.isReadable(file)) {
        logger.warn("Skipping unreadable attachment {}", file);
        continue;
      }
      MimeBodyPart attachment = new MimeBodyPart();
      attachment.setDataHandler(new DataHandler(new FileDataSource(file.toFile())));
      attachment.setFileName(file.getFileName().toString());
      attachment.setDisposition(MimeBodyPart.ATTACHMENT);
      mixed.addBodyPart(attachment);
    }

    return mixed;
  }
}
