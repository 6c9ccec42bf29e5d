package com.example.minigame.api;

public class InsufficientCoinsException extends RuntimeException {

  private final long balance;
  private final long required;

  public InsufficientCoinsException(String userId, long balance, long required) {
    super("insufficient coins: user=" + userId + " balance=" + balance + " required=" + required);
    this.balance = balance;
    this.required = required;
  }

  public long balance() {
    return balance;
  }

  public long required() {
    return required;
  }
}
