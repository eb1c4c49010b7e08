package com.delta.jobharvest.crawl.identity;

import com.delta.jobharvest.crawl.model.Classification;

public enum OutcomeSeverity {
    NONE(0),
    TRANSPORT(1),
    SOFT_BLOCK(1),
    HARD_BLOCK(3);

    private final int errorWeight;

    OutcomeSeverity(int errorWeight) {
        this.errorWeight = errorWeight;
    }

    public int errorWeight() {
        return errorWeight;
    }

    public static OutcomeSeverity of(Classification classification) {
        if (classification == null) {
            return NONE;
        }
        return switch (classification) {
            case OK -> NONE;
            case TRANSPORT_ERROR -> TRANSPORT;
            case SOFT_BLOCK -> SOFT_BLOCK;
            case HARD_BLOCK -> HARD_BLOCK;
        };
    }
}
