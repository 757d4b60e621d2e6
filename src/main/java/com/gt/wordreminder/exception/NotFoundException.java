package com.gt.wordreminder.exception;

public class NotFoundException extends RuntimeException {

    public NotFoundException(String errMsg)  {
        super(errMsg);
    }

    public NotFoundException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
