package de.bsommerfeld.moltgraph.moltbook.html;

import de.bsommerfeld.moltgraph.core.domain.XAccountRow;

import java.util.List;
import java.util.Optional;

/**
 * What a public agent page revealed.
 *
 * @param ownerXHandle  handle from the first x.com/twitter.com link, or
 *                      {@code null}
 * @param ownerXUrl     that link
 * @param similarAgents names linked under "Similar Agents", sorted, without
 *                      the page's own agent
 */
public record ProfilePageInfo(String ownerXHandle, String ownerXUrl, List<String> similarAgents) {

    public static ProfilePageInfo empty() {
        return new ProfilePageInfo(null, null, List.of());
    }

    public Optional<XAccountRow> ownerAccount() {
        return XAccountRow.ofHandle(ownerXHandle, ownerXUrl);
    }
}
