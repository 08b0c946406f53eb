package com.example.LlmCouncil.service;

import com.example.LlmCouncil.model.Exchange;
import com.example.LlmCouncil.model.PaymentRecord;
import com.example.LlmCouncil.model.SettlementLog;
import com.example.LlmCouncil.repository.SettlementLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Audit trail of settled exchanges in the relational database.
 */
@Service
@RequiredArgsConstructor
public class SettlementLogService {

    private static final Logger log = LoggerFactory.getLogger(SettlementLogService.class);

    private final SettlementLogRepository settlementLogRepository;
    private final ObjectMapper objectMapper;

    public void recordSettlement(String conversationId, Exchange exchange) {
        if (!exchange.isSettled()) {
            throw new IllegalArgumentException("Exchange " + exchange.id() + " is not settled");
        }
        SettlementLog entry = new SettlementLog();
        entry.setConversationId(conversationId);
        entry.setExchangeId(exchange.id());
        entry.setChairmanModel(exchange.evaluation().chairmanModel());
        entry.setQuestion(exchange.question());
        entry.setAnswer(exchange.evaluation().aggregatedAnswer());
        entry.setValueBasisUsd(exchange.settlement().valueBasisUsd());
        entry.setChairmanNetEarningsUsd(exchange.settlement().chairmanNetEarningsUsd());
        entry.setPaymentsJson(serializePayments(exchange.settlement().payments()));

        settlementLogRepository.save(entry);
    }

    public List<SettlementLog> history(String conversationId) {
        return settlementLogRepository.findByConversationIdOrderByCreatedAtAsc(conversationId);
    }

    private String serializePayments(List<PaymentRecord> payments) {
        if (payments == null || payments.isEmpty()) {
            return "[]";
        }
        try {
            return objectMapper.writeValueAsString(payments);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize payments for settlement log", e);
            return "[]";
        }
    }
}
