package com.oceanintel.argo.model;

public enum FetchFailureReason {
    NOT_FOUND,
    TIMEOUT,
    CONNECTION,
    HTTP_ERROR,
    IO_ERROR,
    INTERRUPTED
}
