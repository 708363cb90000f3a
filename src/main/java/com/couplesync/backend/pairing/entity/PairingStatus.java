package com.couplesync.backend.pairing.entity;

public enum PairingStatus {
    PENDING,
    ACCEPTED,
    REJECTED
}
