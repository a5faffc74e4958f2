package de.bsommerfeld.moltgraph.core.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Optional;

import static de.bsommerfeld.moltgraph.core.json.JsonFields.instantOrNull;
import static de.bsommerfeld.moltgraph.core.json.JsonFields.longOrNull;
import static de.bsommerfeld.moltgraph.core.json.JsonFields.tagOrNull;
import static de.bsommerfeld.moltgraph.core.json.JsonFields.textOrNull;

/**
 * One comment of a flattened reply tree.
 *
 * @param id                 natural key
 * @param postId             post the comment belongs to
 * @param parentId           immediate parent comment, {@code null} for roots
 * @param content            body text
 * @param score              net score
 * @param upvotes            upvotes
 * @param downvotes          downvotes
 * @param replyCount         direct replies as reported
 * @param depth              nesting depth as reported
 * @param deleted            opaque moderation tag
 * @param spam               opaque moderation tag
 * @param verificationStatus opaque moderation tag
 * @param createdAt          source-declared creation time
 * @param updatedAt          source-declared update time
 * @param author             author, may be {@code null}
 */
public record CommentRow(
        String id,
        String postId,
        String parentId,
        String content,
        Long score,
        Long upvotes,
        Long downvotes,
        Long replyCount,
        Long depth,
        String deleted,
        String spam,
        String verificationStatus,
        Instant createdAt,
        Instant updatedAt,
        AgentRow author) {

    /**
     * Reads a single comment node, ignoring its {@code replies}.
     *
     * @param node            comment payload
     * @param fallbackPostId  post id when the payload omits {@code post_id}
     * @param structuralParent parent implied by the tree position, used when the
     *                        payload omits {@code parent_id}
     */
    public static Optional<CommentRow> from(JsonNode node, String fallbackPostId, String structuralParent) {
        String id = textOrNull(node, "id");
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        String postId = textOrNull(node, "postId", "post_id");
        String parentId = textOrNull(node, "parentId", "parent_id");
        return Optional.of(new CommentRow(
                id,
                postId != null ? postId : fallbackPostId,
                parentId != null ? parentId : structuralParent,
                textOrNull(node, "content"),
                longOrNull(node, "score"),
                longOrNull(node, "upvotes"),
                longOrNull(node, "downvotes"),
                longOrNull(node, "replyCount", "reply_count"),
                longOrNull(node, "depth"),
                tagOrNull(node, "isDeleted", "is_deleted"),
                tagOrNull(node, "isSpam", "is_spam"),
                textOrNull(node, "verificationStatus", "verification_status"),
                instantOrNull(node, "createdAt", "created_at"),
                instantOrNull(node, "updatedAt", "updated_at"),
                Embedded.author(node).orElse(null)));
    }

    public Optional<String> authorName() {
        return Optional.ofNullable(author).map(AgentRow::name);
    }
}
