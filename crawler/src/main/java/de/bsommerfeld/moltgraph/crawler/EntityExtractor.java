package de.bsommerfeld.moltgraph.crawler;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.inject.Singleton;
import de.bsommerfeld.moltgraph.core.domain.CommentTree;
import de.bsommerfeld.moltgraph.core.domain.Embedded;
import de.bsommerfeld.moltgraph.core.domain.ModeratorRow;
import de.bsommerfeld.moltgraph.core.domain.PostRow;
import de.bsommerfeld.moltgraph.core.domain.SubmoltRow;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns raw listing items into rows and records the submolts and agents they
 * reference.
 */
@Singleton
public class EntityExtractor {

    /**
     * Post rows for every item with an id.
     */
    public List<PostRow> posts(List<JsonNode> items) {
        List<PostRow> rows = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            PostRow.from(item).ifPresent(rows::add);
        }
        return rows;
    }

    /**
     * Records each post's submolt and author.
     */
    public void collectFromPosts(List<JsonNode> items, DiscoveredEntities into) {
        for (JsonNode item : items) {
            Embedded.submolt(item).ifPresent(into::addSubmolt);
            Embedded.author(item).ifPresent(author -> into.addAgentName(author.name()));
        }
    }

    /**
     * Records every author of a reply tree, however deep.
     */
    public void collectFromComments(List<JsonNode> tree, DiscoveredEntities into) {
        CommentTree.authorNames(tree).forEach(into::addAgentName);
    }

    /**
     * Moderator rows from any of the observed wrapper shapes; entries without
     * an agent name are dropped.
     */
    public List<ModeratorRow> moderators(List<JsonNode> entries) {
        List<ModeratorRow> rows = new ArrayList<>(entries.size());
        for (JsonNode entry : entries) {
            Optional<ModeratorRow> row = ModeratorRow.from(entry);
            row.ifPresent(rows::add);
        }
        return rows;
    }

    /**
     * Field-wise merge: a field of {@code next} wins unless it is
     * {@code null}.
     */
    static SubmoltRow mergeSubmolts(SubmoltRow previous, SubmoltRow next) {
        return new SubmoltRow(
                next.name(),
                pick(next.submoltId(), previous.submoltId()),
                pick(next.displayName(), previous.displayName()),
                pick(next.description(), previous.description()),
                pick(next.avatarUrl(), previous.avatarUrl()),
                pick(next.bannerUrl(), previous.bannerUrl()),
                pick(next.bannerColor(), previous.bannerColor()),
                pick(next.themeColor(), previous.themeColor()),
                pick(next.subscriberCount(), previous.subscriberCount()),
                pick(next.postCount(), previous.postCount()),
                pick(next.createdAt(), previous.createdAt()),
                pick(next.updatedAt(), previous.updatedAt()));
    }

    private static <T> T pick(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }
}
