package com.example.taskreminder.exception;

import lombok.Getter;

/**
 * Exception for invalid task state transition
 */
@Getter
public class InvalidTaskStateException extends RuntimeException {

    private final String taskCode;
    private final String currentState;
    private final String requestedState;

    public InvalidTaskStateException(String taskCode, String currentState, String requestedState) {
        super(String.format("Cannot transition task %s from %s to %s", taskCode, currentState, requestedState));
        this.taskCode = taskCode;
        this.currentState = currentState;
        this.requestedState = requestedState;
    }
}
