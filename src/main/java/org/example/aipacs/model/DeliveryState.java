package org.example.aipacs.model;

public enum DeliveryState {
    PENDING,
    SENT,
    FAILED
}
