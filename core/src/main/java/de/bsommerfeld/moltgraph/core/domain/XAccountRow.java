package de.bsommerfeld.moltgraph.core.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;
import java.util.Optional;

import static de.bsommerfeld.moltgraph.core.json.JsonFields.boolOrNull;
import static de.bsommerfeld.moltgraph.core.json.JsonFields.longOrNull;
import static de.bsommerfeld.moltgraph.core.json.JsonFields.textOrNull;

/**
 * The X (Twitter) account an agent's owner links from the agent's profile.
 *
 * @param handle         natural key, stored without the leading {@code @}
 * @param url            profile URL
 * @param name           display name
 * @param bio            profile bio
 * @param avatarUrl      avatar image
 * @param followerCount  followers
 * @param followingCount followees
 * @param verified       verification badge
 */
public record XAccountRow(
        String handle,
        String url,
        String name,
        String bio,
        String avatarUrl,
        Long followerCount,
        Long followingCount,
        Boolean verified) {

    /**
     * A bare handle plus optional URL, as recovered from a profile link. Empty
     * for a blank handle.
     */
    public static Optional<XAccountRow> ofHandle(String handle, String url) {
        String normalized = normalizeHandle(handle);
        if (normalized == null) {
            return Optional.empty();
        }
        return Optional.of(new XAccountRow(normalized, url, null, null, null, null, null, null));
    }

    /**
     * Reads the {@code owner} object of an agent profile
     * ({@code x_handle}, {@code x_name}, {@code x_bio}, ...). Empty when no
     * handle is disclosed.
     */
    public static Optional<XAccountRow> fromOwner(JsonNode owner) {
        if (owner == null || !owner.isObject()) {
            return Optional.empty();
        }
        String handle = normalizeHandle(textOrNull(owner, "x_handle", "xHandle"));
        if (handle == null) {
            return Optional.empty();
        }
        String url = textOrNull(owner, "x_url", "xUrl");
        return Optional.of(new XAccountRow(
                handle,
                url != null ? url : "https://x.com/" + handle,
                textOrNull(owner, "x_name", "xName"),
                textOrNull(owner, "x_bio", "xBio"),
                textOrNull(owner, "x_avatar", "xAvatar"),
                longOrNull(owner, "x_follower_count", "xFollowerCount"),
                longOrNull(owner, "x_following_count", "xFollowingCount"),
                boolOrNull(owner, "x_verified", "xVerified")));
    }

    /** X handles are case-insensitive; the stored key is lower case without '@'. */
    public static String normalizeHandle(String handle) {
        if (handle == null) {
            return null;
        }
        String trimmed = handle.strip();
        while (trimmed.startsWith("@")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed.isEmpty() ? null : trimmed.toLowerCase(Locale.ROOT);
    }
}
