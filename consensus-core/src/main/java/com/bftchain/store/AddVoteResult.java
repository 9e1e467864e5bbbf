package com.bftchain.store;

public enum AddVoteResult {
    ACCEPTED,
    REPLACED,
    REJECTED
}
