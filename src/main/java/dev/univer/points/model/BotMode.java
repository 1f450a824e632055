package dev.univer.points.model;

public enum BotMode {
    PUBLIC,
    MAINTENANCE
}
