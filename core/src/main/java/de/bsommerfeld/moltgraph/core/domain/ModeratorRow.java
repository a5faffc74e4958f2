package de.bsommerfeld.moltgraph.core.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

import static de.bsommerfeld.moltgraph.core.json.JsonFields.textOrNull;

/**
 * One entry of a submolt's moderator list.
 *
 * <p>
 * Observed wrapper shapes, all accepted:
 * <ul>
 * <li>{@code {"name": "alice", "role": "owner"}}</li>
 * <li>{@code {"agent_name": "alice"}}</li>
 * <li>{@code {"agent": "alice"}}</li>
 * <li>{@code {"agent": {"name": "alice", ...}, "role": "moderator"}}</li>
 * </ul>
 * A missing role defaults to {@value #DEFAULT_ROLE}.
 *
 * @param name  agent name
 * @param role  moderation role
 * @param agent agent data carried by the wrapper, at least the name
 */
public record ModeratorRow(String name, String role, AgentRow agent) {

    public static final String DEFAULT_ROLE = "moderator";

    public static Optional<ModeratorRow> from(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        String role = textOrNull(node, "role");
        if (role == null || role.isBlank()) {
            role = DEFAULT_ROLE;
        }

        String displayName = textOrNull(node, "displayName", "display_name");
        JsonNode agentField = node.get("agent");

        AgentRow agent;
        if (textOrNull(node, "name") != null) {
            // the wrapper is itself an agent payload
            agent = AgentRow.from(node).orElse(null);
        } else {
            String agentName = textOrNull(node, "agent_name", "agentName");
            if (agentName == null && agentField != null && agentField.isTextual()) {
                agentName = agentField.asText();
            }
            if (agentName != null) {
                agent = agentName.isBlank() ? null : AgentRow.named(agentName);
            } else if (agentField instanceof ObjectNode embedded) {
                agent = AgentRow.from(embedded).orElse(null);
            } else {
                agent = null;
            }
        }
        if (agent == null) {
            return Optional.empty();
        }
        if (displayName != null && agent.displayName() == null) {
            agent = withDisplayName(agent, displayName);
        }
        return Optional.of(new ModeratorRow(agent.name(), role, agent));
    }

    private static AgentRow withDisplayName(AgentRow a, String displayName) {
        return new AgentRow(a.name(), a.agentId(), displayName, a.description(), a.avatarUrl(), a.status(),
                a.karma(), a.followerCount(), a.followingCount(), a.claimed(), a.active(),
                a.ownerTwitterId(), a.ownerTwitterHandle(), a.createdAt(), a.claimedAt(),
                a.lastActive(), a.updatedAt());
    }
}
