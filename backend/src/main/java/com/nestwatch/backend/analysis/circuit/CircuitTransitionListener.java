package com.nestwatch.backend.analysis.circuit;

@FunctionalInterface
public interface CircuitTransitionListener {

  void onTransition(String provider, CircuitState from, CircuitState to);

  static CircuitTransitionListener noOp() {
    return (provider, from, to) -> {};
  }
}
