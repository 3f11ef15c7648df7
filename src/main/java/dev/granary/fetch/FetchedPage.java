package dev.granary.fetch;

/**
 * HTML captured from an origin server.
 *
 * @param html the page markup, decoded to a string
 * @param finalUrl the URL the content was served from (after browser redirects)
 */
public record FetchedPage(String html, String finalUrl) {}
