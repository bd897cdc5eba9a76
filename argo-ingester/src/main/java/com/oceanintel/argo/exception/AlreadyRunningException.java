package com.oceanintel.argo.exception;

import java.time.Instant;

public class AlreadyRunningException extends ArgoIngestException {

    private final Instant runningSince;

    public AlreadyRunningException(Instant runningSince) {
        super("A refresh is already running (started " + runningSince + ")");
        this.runningSince = runningSince;
    }

    public Instant getRunningSince() {
        return runningSince;
    }
}
