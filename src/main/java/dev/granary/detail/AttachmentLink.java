package dev.granary.detail;

import dev.granary.catalog.AttachmentRole;
import dev.granary.catalog.AttachmentType;
import org.jspecify.annotations.Nullable;

/**
 * An attachment link found on a detail page, classified and judged by the selective storage
 * policy.
 *
 * @param fileName display file name
 * @param url absolute download URL
 * @param type file type from the name or URL extension
 * @param mimeType MIME type of {@code type}
 * @param role guessed purpose
 * @param sizeBytes size parsed from a hint next to the link, if any
 * @param shouldParse whether the file is worth storing and analyzing
 */
public record AttachmentLink(
    String fileName,
    String url,
    AttachmentType type,
    String mimeType,
    AttachmentRole role,
    @Nullable Long sizeBytes,
    boolean shouldParse) {}
