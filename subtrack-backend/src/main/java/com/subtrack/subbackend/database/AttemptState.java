package com.subtrack.subbackend.database;

public enum AttemptState {
    CONSTRUCTING,
    CHECKING_LIVENESS,
    SUCCEEDED,
    EXHAUSTED
}
