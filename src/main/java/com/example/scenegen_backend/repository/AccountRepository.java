package com.example.scenegen_backend.repository;

import com.example.scenegen_backend.model.Account;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface AccountRepository extends JpaRepository<Account, UUID> {
    Optional<Account> findByApiTokenHash(String apiTokenHash);

    Optional<Account> findByExternalSubject(String externalSubject);
}
