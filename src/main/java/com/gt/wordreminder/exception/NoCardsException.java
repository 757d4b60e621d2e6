package com.gt.wordreminder.exception;

// Thrown when an owner has no cards to build a review or quiz from
public class NoCardsException extends NotFoundException {

    public NoCardsException(String errMsg) {
        super(errMsg);
    }
}
