package com.gt.wordreminder.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when a user acts on a session that belongs to someone else
@ResponseStatus(value = HttpStatus.FORBIDDEN)
public class UserAccessException extends RuntimeException {

    public UserAccessException(String msg) {
        super(msg);
    }

    public UserAccessException(String msg, Exception ex) {
        super(msg, ex);
    }
}
