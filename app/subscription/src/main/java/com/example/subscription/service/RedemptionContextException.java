package com.example.subscription.service;

public class RedemptionContextException extends RuntimeException {

  public RedemptionContextException(String message) {
    super(message);
  }
}
