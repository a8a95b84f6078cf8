package com.legendplatform.common.model;

public enum OutcomeStatus {
    SUCCESS,
    FAILURE,
    TIMEOUT
}
