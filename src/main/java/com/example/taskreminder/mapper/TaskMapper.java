package com.example.taskreminder.mapper;

import com.example.taskreminder.domain.entity.Participant;
import com.example.taskreminder.domain.entity.Reminder;
import com.example.taskreminder.domain.entity.Task;
import com.example.taskreminder.dto.ParticipantResponse;
import com.example.taskreminder.dto.ReminderResponse;
import com.example.taskreminder.dto.TaskResponse;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

import java.util.Collection;
import java.util.List;

/**
 * MapStruct mapper for converting between entities and DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface TaskMapper {

    /**
     * Convert Task entity to TaskResponse DTO
     */
    TaskResponse toResponse(Task task);

    List<TaskResponse> toResponseList(List<Task> tasks);

    ReminderResponse toReminderResponse(Reminder reminder);

    List<ReminderResponse> toReminderResponses(Collection<Reminder> reminders);

    ParticipantResponse toParticipantResponse(Participant participant);

    List<ParticipantResponse> toParticipantResponses(Collection<Participant> participants);
}
