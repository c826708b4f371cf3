package com.example.txretry.core;

/** Receives every {@link AttemptRecord} as soon as its attempt ends. Called on the run's thread. */
@FunctionalInterface
public interface AttemptListener {

  void onAttempt(AttemptRecord record);

  static AttemptListener none() {
    return record -> {};
  }
}
