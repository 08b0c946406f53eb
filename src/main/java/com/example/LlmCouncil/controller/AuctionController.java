package com.example.LlmCouncil.controller;

import com.example.LlmCouncil.model.AuctionResult;
import com.example.LlmCouncil.model.MessageRequest;
import com.example.LlmCouncil.service.TokenAuctionService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Tag(name = "auction")
@RestController
@RequestMapping("/api/auction")
@RequiredArgsConstructor
public class AuctionController {

    private final TokenAuctionService tokenAuctionService;

    /**
     * Runs only the token auction for a prompt, without starting a conversation.
     *  Request example:
     *    POST /api/auction/quotes
     *    { "content": "xxx" }
     */
    @PostMapping("/quotes")
    public Map<String, Object> quotes(@RequestBody MessageRequest request) {
        AuctionResult auction = tokenAuctionService.runAuction(request.resolveContent()).rounded();
        return Map.of(
                "quotes", auction.quotes(),
                "bidders", auction.bidders(),
                "failedQuoters", auction.failedQuoters(),
                "totalEstimatedCost", auction.totalEstimatedCost()
        );
    }
}
