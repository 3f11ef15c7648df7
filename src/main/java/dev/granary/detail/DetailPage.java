package dev.granary.detail;

import java.util.List;

/**
 * Extracted content of an announcement detail page.
 *
 * @param fullText main content text, whitespace collapsed
 * @param attachments attachment links, unique by URL, in page order
 * @param finalUrl URL after redirects
 */
public record DetailPage(String fullText, List<AttachmentLink> attachments, String finalUrl) {

  public DetailPage {
    attachments = List.copyOf(attachments);
  }
}
