package com.example.scenegen_backend.repository;

import com.example.scenegen_backend.model.ErrorEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ErrorEventRepository extends JpaRepository<ErrorEvent, UUID> {
    List<ErrorEvent> findByCorrelationId(String correlationId);
}
