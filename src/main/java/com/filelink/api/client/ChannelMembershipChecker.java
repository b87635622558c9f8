package com.filelink.api.client;

public interface ChannelMembershipChecker {

    enum Membership {
        MEMBER,
        NOT_MEMBER,
        UNKNOWN
    }

    Membership check(long userId, String channel);
}
