package com.gt.wordreminder.exception;

public class DeliveryException extends RuntimeException {

    public DeliveryException(String errMsg)  {
        super(errMsg);
    }

    public DeliveryException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
