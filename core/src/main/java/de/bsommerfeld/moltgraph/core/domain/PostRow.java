package de.bsommerfeld.moltgraph.core.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Optional;

import static de.bsommerfeld.moltgraph.core.json.JsonFields.boolOrNull;
import static de.bsommerfeld.moltgraph.core.json.JsonFields.doubleOrNull;
import static de.bsommerfeld.moltgraph.core.json.JsonFields.instantOrNull;
import static de.bsommerfeld.moltgraph.core.json.JsonFields.longOrNull;
import static de.bsommerfeld.moltgraph.core.json.JsonFields.tagOrNull;
import static de.bsommerfeld.moltgraph.core.json.JsonFields.textOrNull;

/**
 * One observation of a post, including whatever author and submolt data was
 * embedded in it.
 *
 * <p>
 * {@code deleted}, {@code spam} and {@code verificationStatus} are passed
 * through as reported; the crawler attaches no meaning to them.
 *
 * @param id                 natural key
 * @param title              title
 * @param content            body text
 * @param url                link target for link posts
 * @param submoltName        name of the containing submolt
 * @param submoltId          id of the containing submolt, when embedded
 * @param type               {@code text} or {@code link}
 * @param score              net score
 * @param upvotes            upvotes
 * @param downvotes          downvotes
 * @param commentCount       comment count
 * @param hotScore           ranking score
 * @param pinned             pinned flag
 * @param locked             locked flag
 * @param deleted            opaque moderation tag
 * @param spam               opaque moderation tag
 * @param verificationStatus opaque moderation tag
 * @param createdAt          source-declared creation time
 * @param updatedAt          source-declared update time
 * @param author             embedded or named author, may be {@code null}
 * @param submolt            embedded or named submolt, may be {@code null}
 */
public record PostRow(
        String id,
        String title,
        String content,
        String url,
        String submoltName,
        String submoltId,
        String type,
        Long score,
        Long upvotes,
        Long downvotes,
        Long commentCount,
        Double hotScore,
        Boolean pinned,
        Boolean locked,
        String deleted,
        String spam,
        String verificationStatus,
        Instant createdAt,
        Instant updatedAt,
        AgentRow author,
        SubmoltRow submolt) {

    public static Optional<PostRow> from(JsonNode node) {
        String id = textOrNull(node, "id");
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        SubmoltRow submolt = Embedded.submolt(node).orElse(null);
        return Optional.of(new PostRow(
                id,
                textOrNull(node, "title"),
                textOrNull(node, "content"),
                textOrNull(node, "url"),
                submolt != null ? submolt.name() : null,
                submolt != null ? submolt.submoltId() : textOrNull(node, "submolt_id", "submoltId"),
                textOrNull(node, "type"),
                longOrNull(node, "score"),
                longOrNull(node, "upvotes"),
                longOrNull(node, "downvotes"),
                longOrNull(node, "commentCount", "comment_count"),
                doubleOrNull(node, "hotScore", "hot_score"),
                boolOrNull(node, "isPinned", "is_pinned"),
                boolOrNull(node, "isLocked", "is_locked"),
                tagOrNull(node, "isDeleted", "is_deleted"),
                tagOrNull(node, "isSpam", "is_spam"),
                textOrNull(node, "verificationStatus", "verification_status"),
                instantOrNull(node, "createdAt", "created_at"),
                instantOrNull(node, "updatedAt", "updated_at"),
                Embedded.author(node).orElse(null),
                submolt));
    }

    public Optional<String> authorName() {
        return Optional.ofNullable(author).map(AgentRow::name);
    }
}
