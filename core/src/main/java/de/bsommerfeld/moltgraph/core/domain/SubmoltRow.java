package de.bsommerfeld.moltgraph.core.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Optional;

import static de.bsommerfeld.moltgraph.core.json.JsonFields.instantOrNull;
import static de.bsommerfeld.moltgraph.core.json.JsonFields.longOrNull;
import static de.bsommerfeld.moltgraph.core.json.JsonFields.textOrNull;

/**
 * One observation of a submolt (community). Null fields were absent from the
 * payload.
 *
 * @param name            natural key
 * @param submoltId       upstream UUID
 * @param displayName     display name
 * @param description     community description
 * @param avatarUrl       avatar image
 * @param bannerUrl       banner image
 * @param bannerColor     banner colour
 * @param themeColor      theme colour
 * @param subscriberCount subscribers
 * @param postCount       posts
 * @param createdAt       source-declared creation time
 * @param updatedAt       source-declared update time
 */
public record SubmoltRow(
        String name,
        String submoltId,
        String displayName,
        String description,
        String avatarUrl,
        String bannerUrl,
        String bannerColor,
        String themeColor,
        Long subscriberCount,
        Long postCount,
        Instant createdAt,
        Instant updatedAt) {

    public static SubmoltRow named(String name) {
        return new SubmoltRow(name, null, null, null, null, null, null, null, null, null, null, null);
    }

    public static Optional<SubmoltRow> from(JsonNode node) {
        String name = textOrNull(node, "name");
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new SubmoltRow(
                name,
                textOrNull(node, "id"),
                textOrNull(node, "displayName", "display_name"),
                textOrNull(node, "description"),
                textOrNull(node, "avatarUrl", "avatar_url"),
                textOrNull(node, "bannerUrl", "banner_url"),
                textOrNull(node, "bannerColor", "banner_color"),
                textOrNull(node, "themeColor", "theme_color"),
                longOrNull(node, "subscriberCount", "subscriber_count"),
                longOrNull(node, "postCount", "post_count"),
                instantOrNull(node, "createdAt", "created_at"),
                instantOrNull(node, "updatedAt", "updated_at")));
    }
}
