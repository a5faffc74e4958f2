package de.bsommerfeld.moltgraph.core.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Optional;

import static de.bsommerfeld.moltgraph.core.json.JsonFields.boolOrNull;
import static de.bsommerfeld.moltgraph.core.json.JsonFields.instantOrNull;
import static de.bsommerfeld.moltgraph.core.json.JsonFields.longOrNull;
import static de.bsommerfeld.moltgraph.core.json.JsonFields.textOrNull;

/**
 * One observation of an agent. Every field except {@code name} may be
 * {@code null}, meaning "not part of this payload" rather than "cleared".
 *
 * @param name               natural key
 * @param agentId            upstream UUID
 * @param displayName        display name
 * @param description        profile text
 * @param avatarUrl          avatar image
 * @param status             account status as reported
 * @param karma              karma at observation time
 * @param followerCount      followers
 * @param followingCount     followees
 * @param claimed            whether a human claimed the agent
 * @param active             whether the agent is active
 * @param ownerTwitterId     owner's X/Twitter id, if disclosed
 * @param ownerTwitterHandle owner's X/Twitter handle, if disclosed
 * @param createdAt          source-declared creation time
 * @param claimedAt          claim time
 * @param lastActive         last activity
 * @param updatedAt          source-declared update time
 */
public record AgentRow(
        String name,
        String agentId,
        String displayName,
        String description,
        String avatarUrl,
        String status,
        Long karma,
        Long followerCount,
        Long followingCount,
        Boolean claimed,
        Boolean active,
        String ownerTwitterId,
        String ownerTwitterHandle,
        Instant createdAt,
        Instant claimedAt,
        Instant lastActive,
        Instant updatedAt) {

    /**
     * An agent known only by name, e.g. from {@code author_name}.
     */
    public static AgentRow named(String name) {
        return new AgentRow(name, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null);
    }

    /**
     * Reads an agent payload. Empty when the payload carries no usable name.
     */
    public static Optional<AgentRow> from(JsonNode node) {
        String name = textOrNull(node, "name", "agent_name", "username");
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new AgentRow(
                name,
                textOrNull(node, "id"),
                textOrNull(node, "displayName", "display_name"),
                textOrNull(node, "description"),
                textOrNull(node, "avatarUrl", "avatar_url"),
                textOrNull(node, "status"),
                longOrNull(node, "karma"),
                longOrNull(node, "followerCount", "follower_count"),
                longOrNull(node, "followingCount", "following_count"),
                boolOrNull(node, "isClaimed", "is_claimed"),
                boolOrNull(node, "isActive", "is_active"),
                textOrNull(node, "ownerTwitterId", "owner_twitter_id"),
                textOrNull(node, "ownerTwitterHandle", "owner_twitter_handle"),
                instantOrNull(node, "createdAt", "created_at"),
                instantOrNull(node, "claimedAt", "claimed_at"),
                instantOrNull(node, "lastActive", "last_active"),
                instantOrNull(node, "updatedAt", "updated_at")));
    }
}
