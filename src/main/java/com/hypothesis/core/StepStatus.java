package com.hypothesis.core;

public enum StepStatus {
    SUCCEEDED,
    FAILED
}
