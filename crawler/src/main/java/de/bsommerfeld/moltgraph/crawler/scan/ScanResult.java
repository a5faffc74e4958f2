package de.bsommerfeld.moltgraph.crawler.scan;

/**
 * Outcome of one view scan.
 *
 * @param viewKey  checkpoint key of the view
 * @param state    terminal state
 * @param pages    pages processed
 * @param items    items handed to the page handler
 * @param newIds   ids the run had not seen before
 * @param offset   offset the next page would have been requested at
 */
public record ScanResult(String viewKey, ScanState state, int pages, int items, int newIds, int offset) {
}
