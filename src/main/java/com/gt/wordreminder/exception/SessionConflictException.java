package com.gt.wordreminder.exception;

public class SessionConflictException extends RuntimeException {

    public SessionConflictException(String errMsg)  {
        super(errMsg);
    }

    public SessionConflictException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
