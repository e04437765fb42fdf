package com.demo.messaging.repository;

import com.demo.messaging.domain.Conversation;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for Conversation entities
 */
@Repository
public interface ConversationRepository extends JpaRepository<Conversation, String> {

    /**
     * Find conversation by normalized participant pair
     */
    Optional<Conversation> findByParticipantAIdAndParticipantBId(String participantAId, String participantBId);

    /**
     * Load and row-lock a conversation for the rest of the current transaction.
     * Appends and read transitions on one conversation serialize here.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Conversation c WHERE c.id = :id")
    Optional<Conversation> lockById(@Param("id") String id);

    /**
     * First page of a user's conversations, most recent activity first
     */
    @Query("SELECT c FROM Conversation c " +
           "WHERE (c.participantAId = :userId OR c.participantBId = :userId) " +
           "ORDER BY c.updatedAt DESC, c.id DESC")
    List<Conversation> findRecentForUser(@Param("userId") String userId, Pageable pageable);

    /**
     * Next page after the (updatedAt, id) position of the previous page's last row
     */
    @Query("SELECT c FROM Conversation c " +
           "WHERE (c.participantAId = :userId OR c.participantBId = :userId) " +
           "AND (c.updatedAt < :updatedAt OR (c.updatedAt = :updatedAt AND c.id < :id)) " +
           "ORDER BY c.updatedAt DESC, c.id DESC")
    List<Conversation> findRecentForUserBefore(
        @Param("userId") String userId,
        @Param("updatedAt") Instant updatedAt,
        @Param("id") String id,
        Pageable pageable
    );
}
