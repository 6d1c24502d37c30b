package com.remindme.backend.guard.persistence;

import com.remindme.backend.guard.domain.CircuitStateSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CircuitStateRepository extends JpaRepository<CircuitStateSnapshot, String> {}
