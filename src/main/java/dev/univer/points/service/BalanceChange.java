package dev.univer.points.service;

public record BalanceChange(String accountId, String fullName, int oldBalance, int newBalance) {
    public int delta() {
        return newBalance - oldBalance;
    }
}
