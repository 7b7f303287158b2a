package space.maatini.transfer.repository;

import java.util.List;

/**
 * One page of a paginated listing.
 *
 * @param keys      object keys on this page
 * @param truncated whether the store holds more pages
 * @param nextToken continuation token for the next page, {@code null} on the last page
 */
public record ListPage(List<String> keys, boolean truncated, String nextToken) {

    public static ListPage last(List<String> keys) {
        return new ListPage(keys, false, null);
    }
}
