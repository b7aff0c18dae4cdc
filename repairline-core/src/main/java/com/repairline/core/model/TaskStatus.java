package com.repairline.core.model;

public enum TaskStatus {
    COMPLETED,
    FAILED
}
