package com.mailsync.service;

public record UpsertResult(Action action, long id) {

    public enum Action {
        INSERTED,
        UPDATED
    }

    public boolean isInserted() {
        return action == Action.INSERTED;
    }
}
