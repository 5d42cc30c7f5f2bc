package com.example.taskreminder.service;

import com.example.taskreminder.domain.entity.Participant;
import com.example.taskreminder.domain.repository.ParticipantRepository;
import com.example.taskreminder.dto.ParticipantResponse;
import com.example.taskreminder.dto.RegisterParticipantRequest;
import com.example.taskreminder.exception.ParticipantNotFoundException;
import com.example.taskreminder.mapper.TaskMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Registration and reminder preferences of chat participants
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ParticipantService {

    private final ParticipantRepository participantRepository;
    private final TaskMapper taskMapper;

    /**
     * Create the participant, or refresh the handle and display name of an
     * existing one. The opt-in flag of an existing participant is kept.
     */
    @Transactional
    public ParticipantResponse register(RegisterParticipantRequest request) {
        var participant = participantRepository.findById(request.getId())
                .map(existing -> {
                    existing.setHandle(request.getHandle());
                    existing.setDisplayName(request.getDisplayName());
                    return existing;
                })
                .orElseGet(() -> Participant.builder()
                        .id(request.getId())
                        .handle(request.getHandle())
                        .displayName(request.getDisplayName())
                        .build());

        participant = participantRepository.save(participant);
        log.info("Registered participant {} ({})", participant.getId(), participant.getHandle());

        return taskMapper.toParticipantResponse(participant);
    }

    @Transactional(readOnly = true)
    public ParticipantResponse getParticipant(Long id) {
        return taskMapper.toParticipantResponse(findById(id));
    }

    @Transactional(readOnly = true)
    public Page<ParticipantResponse> listParticipants(Pageable pageable) {
        return participantRepository.findAll(pageable).map(taskMapper::toParticipantResponse);
    }

    /**
     * Turn reminder mentions on or off for a participant across all tasks
     */
    @Transactional
    public ParticipantResponse setRemindersEnabled(Long id, boolean enabled) {
        var participant = findById(id);
        participant.setRemindersEnabled(enabled);
        participant = participantRepository.save(participant);

        log.info("Participant {} reminders {}", id, enabled ? "enabled" : "disabled");
        return taskMapper.toParticipantResponse(participant);
    }

    private Participant findById(Long id) {
        return participantRepository.findById(id).orElseThrow(() -> new ParticipantNotFoundException(id));
    }
}
