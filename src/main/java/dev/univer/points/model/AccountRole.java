package dev.univer.points.model;

public enum AccountRole {
    TEACHER,
    STUDENT
}
