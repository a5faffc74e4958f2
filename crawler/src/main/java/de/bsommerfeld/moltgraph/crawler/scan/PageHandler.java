package de.bsommerfeld.moltgraph.crawler.scan;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Processes the kept items of a page, typically by writing them to the
 * store. Runs before the page's checkpoint is saved.
 */
@FunctionalInterface
public interface PageHandler {

    void handle(List<JsonNode> items);
}
