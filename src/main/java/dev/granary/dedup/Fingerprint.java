package dev.granary.dedup;

/**
 * Normalized identity of an announcement. Two announcements with equal fingerprints describe the
 * same program.
 *
 * @param normalizedName normalized title, prefixed with the program year when one is present
 * @param normalizedOrg normalized issuing organization, empty when unknown
 */
public record Fingerprint(String normalizedName, String normalizedOrg) {}
