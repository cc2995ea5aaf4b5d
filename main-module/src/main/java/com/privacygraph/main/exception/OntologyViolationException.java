package com.privacygraph.main.exception;

import java.util.List;

public class OntologyViolationException extends RuntimeException {

    private final List<String> violations;

    public OntologyViolationException(List<String> violations) {
        super(String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
