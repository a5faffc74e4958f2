package de.bsommerfeld.moltgraph.moltbook;

import com.fasterxml.jackson.databind.JsonNode;
import de.bsommerfeld.moltgraph.core.json.ApiResponse;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * One page of a paginated listing plus the paging envelope, when the server
 * sent one.
 *
 * @param items      raw items in server order
 * @param hasMore    {@code has_more}, empty when absent
 * @param nextOffset {@code next_offset}, empty when absent or not numeric
 */
public record ListingPage(List<JsonNode> items, Optional<Boolean> hasMore, OptionalInt nextOffset) {

    public static ListingPage of(ApiResponse response, String... itemKeys) {
        return new ListingPage(response.extractList(itemKeys), response.hasMore(), response.nextOffset());
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
