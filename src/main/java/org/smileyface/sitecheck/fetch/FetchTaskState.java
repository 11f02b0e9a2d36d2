package org.smileyface.sitecheck.fetch;

/**
 * Lifecycle state of a PageFetchTask.
 */
public enum FetchTaskState {
    NEW,
    RUNNING,
    COMPLETED,
    FAILED
}
