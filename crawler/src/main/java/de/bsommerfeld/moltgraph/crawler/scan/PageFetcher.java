package de.bsommerfeld.moltgraph.crawler.scan;

import de.bsommerfeld.moltgraph.moltbook.ListingPage;
import de.bsommerfeld.moltgraph.moltbook.TransportException;

/**
 * Fetches one page of a listing.
 */
@FunctionalInterface
public interface PageFetcher {

    ListingPage fetch(int offset, int limit) throws TransportException;
}
