package com.example.subscription.service;

import java.time.Duration;

@FunctionalInterface
public interface BackoffSleeper {

  void sleep(Duration duration) throws InterruptedException;
}
