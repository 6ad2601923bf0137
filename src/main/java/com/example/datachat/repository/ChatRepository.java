package com.example.datachat.repository;

import com.example.datachat.model.dto.ChatSummaryDto;
import com.example.datachat.model.entity.Chat;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ChatRepository extends JpaRepository<Chat, String> {

    Optional<Chat> findByIdAndProject_Id(String id, String projectId);

    Optional<Chat> findFirstByProject_IdOrderByCreatedAtDesc(String projectId);

    @Query("""
        select new com.example.datachat.model.dto.ChatSummaryDto(
            c.id,
            c.title,
            c.createdAt,
            c.lastActivityAt,
            count(m.id),
            max(m.createdAt)
        )
        from Chat c
        left join com.example.datachat.model.entity.ChatMessage m
            on m.chat = c
        where c.project.id = :projectId
        group by c.id, c.title, c.createdAt, c.lastActivityAt
        order by c.lastActivityAt desc
    """)
    List<ChatSummaryDto> listSummaries(@Param("projectId") String projectId);
}
