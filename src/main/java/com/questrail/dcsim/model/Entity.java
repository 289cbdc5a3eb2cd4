package com.questrail.dcsim.model;

/**
 * Anything stored in an {@link EntityArena}.
 */
public interface Entity
{
    String id();
}
