package com.photomatic.core.session;

/**
 * What the user may do right now.
 */
public enum SessionState {
    /** Nothing loaded; only the initial load is possible. */
    START,
    /** A batch is being ingested; editing and export wait. */
    LOADING,
    /** At least one photo is loaded and selected. */
    EDITING,
    /** An export is in progress. */
    SAVING
}
