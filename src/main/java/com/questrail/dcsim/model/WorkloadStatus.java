package com.questrail.dcsim.model;

public enum WorkloadStatus
{
    STOPPED,
    RUNNING
}
