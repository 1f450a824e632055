package dev.univer.points.model;

public enum TxType {
    TRANSFER,
    ADD,
    SUBTRACT,
    MANUAL_EDIT
}
