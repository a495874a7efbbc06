package com.taodividends.backend.model;

/**
 * Direction of a trade. NONE is only ever recorded on a task whose sentiment was neutral;
 * stake transactions are always STAKE or UNSTAKE.
 */
public enum StakeDirection {
    STAKE,
    UNSTAKE,
    NONE;

    public String pathSegment() {
        return switch (this) {
            case STAKE -> "stake";
            case UNSTAKE -> "unstake";
            case NONE -> throw new IllegalStateException("No chain operation for direction NONE");
        };
    }
}
