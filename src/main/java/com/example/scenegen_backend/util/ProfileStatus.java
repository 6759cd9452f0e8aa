package com.example.scenegen_backend.util;

public enum ProfileStatus {
    PENDING,
    APPROVED,
    REJECTED
}
