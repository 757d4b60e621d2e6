package com.gt.wordreminder.exception;

public class ValidationException extends RuntimeException {

    public ValidationException(String errMsg)  {
        super(errMsg);
    }

    public ValidationException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
