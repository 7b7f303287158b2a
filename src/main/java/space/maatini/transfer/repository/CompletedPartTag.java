package space.maatini.transfer.repository;

/**
 * Entry of a multipart completion manifest: a 1-based part number and the tag the store returned for it.
 */
public record CompletedPartTag(int partNumber, String eTag) {
}
