package dev.univer.points.model;

public enum GroupStatus {
    ACTIVE,
    DELETED
}
