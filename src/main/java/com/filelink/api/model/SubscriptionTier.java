package com.filelink.api.model;

public enum SubscriptionTier {
    TRIAL,
    BASIC,
    PREMIUM;

    public boolean isPaid() {
        return this != TRIAL;
    }
}
