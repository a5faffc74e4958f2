package de.bsommerfeld.moltgraph.crawler.scan;

/**
 * Where a view scan ended. Every state but {@link #SCANNING} is terminal.
 */
public enum ScanState {

    SCANNING,

    /** Several pages in a row brought no id the run had not seen. */
    STALE_DETECTED,

    /** The server kept returning the same page. */
    REPEAT_DETECTED,

    /** Empty page, or the server declared there are no more. */
    EXHAUSTED,

    PAGE_CAP_REACHED,

    /** A page held only items at or before the cutoff. */
    CUTOFF_REACHED,

    /** A page could not be fetched. */
    FAILED;

    public boolean isTerminal() {
        return this != SCANNING;
    }
}
