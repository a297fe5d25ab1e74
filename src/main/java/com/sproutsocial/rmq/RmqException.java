package com.sproutsocial.rmq;

public class RmqException extends RuntimeException {

    public RmqException(String message) {
        super(message);
    }

    public RmqException(String message, Throwable cause) {
        super(message, cause);
    }

}
