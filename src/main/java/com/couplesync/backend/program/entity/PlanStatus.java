package com.couplesync.backend.program.entity;

public enum PlanStatus {
    GENERATING,
    READY,
    FAILED
}
