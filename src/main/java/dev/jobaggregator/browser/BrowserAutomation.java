package dev.jobaggregator.browser;

/**
 * Entry point to the page-loading layer. Sessions are scoped: every session obtained here
 * must be closed, which returns its slot to the shared context pool.
 */
public interface BrowserAutomation {

    /**
     * Open a session for one source. Blocks while every browser context is in use.
     */
    BrowserSession openSession(String sourceId);
}
