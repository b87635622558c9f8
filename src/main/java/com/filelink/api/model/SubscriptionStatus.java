package com.filelink.api.model;

/**
 * Derived marker written back by the subscription gate whenever it re-evaluates a user.
 */
public enum SubscriptionStatus {
    ACTIVE,
    EXPIRED
}
