package de.bsommerfeld.moltgraph.core.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Walks a nested reply tree as returned by the comments endpoint or embedded
 * in a post detail. Replies hang off each comment under {@code replies}
 * (older payloads: {@code children}); depth is unbounded.
 *
 * <p>
 * The walk uses an explicit stack so arbitrarily deep threads cannot overflow
 * the call stack. Output order is pre-order (a parent always precedes its
 * replies), which lets the store resolve {@code REPLY_TO} targets written
 * earlier in the same batch.
 */
public final class CommentTree {

    private CommentTree() {
    }

    private record Frame(JsonNode node, String parentId) {
    }

    /**
     * Flattens the tree into one row per comment.
     *
     * @param roots      top-level comments
     * @param postId     post the tree belongs to, used when a comment omits it
     * @param rootParent parent id assigned to roots that do not declare one,
     *                   usually {@code null}
     */
    public static List<CommentRow> flatten(List<JsonNode> roots, String postId, String rootParent) {
        List<CommentRow> rows = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();
        pushReversed(stack, roots, rootParent);

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            JsonNode node = frame.node();
            if (node == null || !node.isObject()) {
                continue;
            }
            var row = CommentRow.from(node, postId, frame.parentId());
            // replies of an id-less comment are still walked, attached to the nearest known ancestor
            String childParent = row.map(CommentRow::id).orElse(frame.parentId());
            row.ifPresent(rows::add);
            pushReversed(stack, replies(node), childParent);
        }
        return rows;
    }

    /**
     * Author names across the whole tree, in pre-order, duplicates included.
     */
    public static List<String> authorNames(List<JsonNode> roots) {
        List<String> names = new ArrayList<>();
        Deque<JsonNode> stack = new ArrayDeque<>();
        for (int i = roots.size() - 1; i >= 0; i--) {
            stack.push(roots.get(i));
        }
        while (!stack.isEmpty()) {
            JsonNode node = stack.pop();
            if (node == null || !node.isObject()) {
                continue;
            }
            Embedded.author(node).map(AgentRow::name).ifPresent(names::add);
            List<JsonNode> replies = replies(node);
            for (int i = replies.size() - 1; i >= 0; i--) {
                stack.push(replies.get(i));
            }
        }
        return names;
    }

    private static void pushReversed(Deque<Frame> stack, List<JsonNode> nodes, String parentId) {
        for (int i = nodes.size() - 1; i >= 0; i--) {
            stack.push(new Frame(nodes.get(i), parentId));
        }
    }

    private static List<JsonNode> replies(JsonNode node) {
        JsonNode replies = node.get("replies");
        if (replies == null || !replies.isArray()) {
            replies = node.get("children");
        }
        if (replies == null || !replies.isArray()) {
            return List.of();
        }
        List<JsonNode> out = new ArrayList<>(replies.size());
        replies.forEach(out::add);
        return out;
    }
}
