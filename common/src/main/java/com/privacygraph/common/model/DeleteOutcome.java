package com.privacygraph.common.model;

public enum DeleteOutcome {
    DELETED,
    NOT_FOUND,
    FAILED
}
