package com.remindme.backend.guard.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/** Last known state of a named circuit, written on every transition. */
@Entity
@Table(name = "llm_circuit_state")
public class CircuitStateSnapshot {

  @Id
  @Column(name = "name", length = 64)
  private String name;

  @Enumerated(EnumType.STRING)
  @Column(name = "state", nullable = false, length = 16)
  private CircuitState state;

  @Column(name = "changed_at", nullable = false)
  private Instant changedAt;

  protected CircuitStateSnapshot() {}

  public CircuitStateSnapshot(String name, CircuitState state, Instant changedAt) {
    this.name = name;
    this.state = state;
    this.changedAt = changedAt;
  }

  public void update(CircuitState state, Instant changedAt) {
    this.state = state;
    this.changedAt = changedAt;
  }

  public String getName() {
    return name;
  }

  public CircuitState getState() {
    return state;
  }

  public Instant getChangedAt() {
    return changedAt;
  }
}
