package com.example.taskreminder.domain.repository;

import com.example.taskreminder.domain.entity.Participant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for Participant entity.
 */
@Repository
public interface ParticipantRepository extends JpaRepository<Participant, Long> {
}
