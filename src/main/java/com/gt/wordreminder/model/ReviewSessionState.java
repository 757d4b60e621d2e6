package com.gt.wordreminder.model;

// Only InProgress and AwaitingAnswer are ever stored. Complete and Abandoned are reported to callers
// once the session row is gone.
public enum ReviewSessionState {
    InProgress,
    AwaitingAnswer,
    Complete,
    Abandoned;

    public boolean isPersisted() {
        return this == InProgress || this == AwaitingAnswer;
    }
}
