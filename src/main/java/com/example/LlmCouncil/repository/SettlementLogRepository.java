package com.example.LlmCouncil.repository;

import com.example.LlmCouncil.model.SettlementLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SettlementLogRepository extends JpaRepository<SettlementLog, Long> {

    List<SettlementLog> findByConversationIdOrderByCreatedAtAsc(String conversationId);
}
