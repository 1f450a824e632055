package dev.univer.points.service;

public record TransferBalances(int senderBalance, int recipientBalance) {
}
