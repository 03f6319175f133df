package com.fenceping.engine.model;

public enum ContainmentStatus {
    OUTSIDE,
    INSIDE,
    DWELLING
}
