package de.bsommerfeld.moltgraph.moltbook.html;

import de.bsommerfeld.moltgraph.moltbook.TransportException;

/**
 * Reads the public HTML page of an agent. Best-effort: the page layout is not
 * an API and may change without notice.
 */
public interface ProfilePageScraper {

    /** Source tag for edges discovered through this scraper. */
    String SOURCE = "html_profile";

    ProfilePageInfo scrape(String agentName) throws TransportException;
}
