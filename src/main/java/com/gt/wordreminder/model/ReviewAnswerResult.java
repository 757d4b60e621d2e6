package com.gt.wordreminder.model;

public record ReviewAnswerResult(Card updatedCard,
                                 int reviewedCount,
                                 int totalCount,
                                 ReviewSessionState state) {

    public boolean isComplete() {
        return state == ReviewSessionState.Complete;
    }
}
