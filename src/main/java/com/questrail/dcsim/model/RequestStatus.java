package com.questrail.dcsim.model;

public enum RequestStatus
{
    ARRIVED,
    ACCEPTED,
    REJECTED,
    STOPPED;

    /** True once an admission decision has been applied. */
    public boolean isDecided() {
        return this != ARRIVED;
    }
}
