package com.demo.messaging.repository;

import com.demo.messaging.domain.Message;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for the append-only message log
 */
@Repository
public interface MessageRepository extends JpaRepository<Message, String> {

    /**
     * Idempotency lookup
     */
    Optional<Message> findByConversationIdAndSenderIdAndIdempotencyKey(
        String conversationId, String senderId, String idempotencyKey);

    /**
     * Conditional bulk read transition. Rows already read are untouched, so
     * concurrent or repeated calls never count a message twice.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Message m SET m.readAt = :readAt " +
           "WHERE m.conversationId = :conversationId " +
           "AND m.senderId <> :readerId " +
           "AND m.readAt IS NULL")
    int markRead(
        @Param("conversationId") String conversationId,
        @Param("readerId") String readerId,
        @Param("readAt") Instant readAt
    );

    /**
     * Live unread count across all of a user's conversations
     */
    long countByRecipientIdAndReadAtIsNull(String recipientId);

    /**
     * Unread count per conversation for the given conversations
     */
    @Query("SELECT m.conversationId, COUNT(m) FROM Message m " +
           "WHERE m.recipientId = :userId " +
           "AND m.readAt IS NULL " +
           "AND m.conversationId IN :conversationIds " +
           "GROUP BY m.conversationId")
    List<Object[]> countUnreadByConversation(
        @Param("userId") String userId,
        @Param("conversationIds") Collection<String> conversationIds
    );

    Optional<Message> findFirstByConversationIdOrderByCreatedAtDescIdDesc(String conversationId);

    List<Message> findByConversationIdOrderByCreatedAtDescIdDesc(String conversationId, Pageable pageable);

    long countByConversationId(String conversationId);
}
