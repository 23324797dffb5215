package com.ryuqq.recordgraph.testkit.fixture;

/**
 * Role of a {@link Person}; persisted by name.
 */
public enum Role {
    ENGINEER,
    MANAGER,
    DESIGNER
}
