package com.example.taskreminder.exception;

import lombok.Getter;

/**
 * Exception for participant not found
 */
@Getter
public class ParticipantNotFoundException extends RuntimeException {

    private final Long participantId;

    public ParticipantNotFoundException(Long participantId) {
        super("Participant not found: " + participantId);
        this.participantId = participantId;
    }
}
