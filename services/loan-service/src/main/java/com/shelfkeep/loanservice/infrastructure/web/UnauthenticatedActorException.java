package com.shelfkeep.loanservice.infrastructure.web;

/** The request carries no usable verified actor. Mapped to 401. */
public class UnauthenticatedActorException extends RuntimeException {

    public UnauthenticatedActorException(String message) {
        super(message);
    }

    public UnauthenticatedActorException(String message, Throwable cause) {
        super(message, cause);
    }
}
