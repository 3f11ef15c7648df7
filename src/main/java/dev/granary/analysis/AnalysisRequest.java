package dev.granary.analysis;

/**
 * Request sent to the document analyzer.
 *
 * @param documentType role label such as {@code announcement}
 * @param base64Content document bytes, Base64-encoded
 * @param mimeType document MIME type
 */
public record AnalysisRequest(String documentType, String base64Content, String mimeType) {}
