package com.privacygraph.common.model;

public enum UpdateOutcome {
    UPDATED,
    NOT_FOUND,
    FAILED
}
