package dev.granary.source;

/** How a source's pages are fetched. */
public enum AdapterType {
  /** Plain HTTP GET, unless the host is WAF-protected. */
  PLAIN,
  /** Always rendered through the shared browser. */
  BROWSER
}
