package com.oceanintel.argo.model;

public enum RefreshTrigger {
    MANUAL,
    SCHEDULED,
    STARTUP
}
