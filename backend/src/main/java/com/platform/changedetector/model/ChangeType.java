package com.platform.changedetector.model;

/**
 * Kind of change synthesized from two consecutive snapshots.
 */
public enum ChangeType {
    ADDED,
    MODIFIED,
    DELETED
}
