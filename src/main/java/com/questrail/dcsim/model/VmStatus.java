package com.questrail.dcsim.model;

public enum VmStatus
{
    UNALLOCATED,
    ALLOCATED,
    DEALLOCATED
}
