package com.oceanintel.argo.model;

/**
 * IDLE -> RUNNING -> {SUCCEEDED, FAILED}. SUCCEEDED and FAILED are resting states
 * that accept the next run just like IDLE.
 */
public enum RefreshState {
    IDLE,
    RUNNING,
    SUCCEEDED,
    FAILED;

    public boolean acceptsNewRun() {
        return this != RUNNING;
    }
}
