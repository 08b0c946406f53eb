package com.example.LlmCouncil.service;

import com.example.LlmCouncil.config.CouncilProperties;
import com.example.LlmCouncil.model.AuctionResult;
import com.example.LlmCouncil.model.ChairmanDecision;
import com.example.LlmCouncil.model.FinalClaim;
import com.example.LlmCouncil.model.FinalClaimRound;
import com.example.LlmCouncil.model.PaymentRecord;
import com.example.LlmCouncil.model.Quote;
import com.example.LlmCouncil.model.SelfEvaluation;
import com.example.LlmCouncil.model.SelfEvaluationRound;
import com.example.LlmCouncil.model.Settlement;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic settlement of the chairman's decisions against the bidders' final claims.
 * <p>
 * With C the chairman's decision and F the bidder's claim:
 * <pre>
 * C &lt; F : penalty = rate * (F - C); chairman pays F + penalty, bidder receives C - penalty
 * C &gt;= F: chairman pays = bidder receives = (C + F) / 2
 * </pre>
 * Percentages become USD through the value basis fixed by the auction.
 */
@Service
@RequiredArgsConstructor
public class PaymentSettlement {

    private static final Logger log = LoggerFactory.getLogger(PaymentSettlement.class);

    private final CouncilProperties properties;

    public Settlement settle(AuctionResult auction, ChairmanDecision decision,
                             SelfEvaluationRound selfEvaluations, FinalClaimRound claims) {
        double valueBasis = auction.valueBasisUsd();
        double penaltyRate = properties.settlement().penaltyRate();

        List<PaymentRecord> payments = new ArrayList<>(claims.claims().size());
        double totalChairmanUsd = 0.0;
        double totalReceivesMcc = 0.0;

        for (FinalClaim claim : claims.claims()) {
            double c = decision.decisionFor(claim.modelId());
            double f = claim.finalMcc();
            Split split = split(c, f, penaltyRate);

            double bidderUsd = split.bidderReceives() / 100.0 * valueBasis;
            double chairmanUsd = split.chairmanPays() / 100.0 * valueBasis;
            double quotedCost = auction.quoteFor(claim.modelId()).map(Quote::estimatedCost).orElse(0.0);
            Double selfMcc = selfEvaluations == null ? null
                    : selfEvaluations.evaluationOf(claim.modelId()).map(SelfEvaluation::selfMcc).orElse(null);

            payments.add(new PaymentRecord(claim.modelId(), c, f, selfMcc, split.chairmanPays(), split.bidderReceives(),
                    bidderUsd, chairmanUsd, quotedCost, bidderUsd - quotedCost));
            totalChairmanUsd += chairmanUsd;
            totalReceivesMcc += split.bidderReceives();
        }

        Settlement settlement = new Settlement(List.copyOf(payments), valueBasis, totalChairmanUsd,
                valueBasis - totalChairmanUsd, totalReceivesMcc, 100.0 - totalReceivesMcc);
        log.info("Settled {} bidders: chairman pays {} USD of {} USD basis",
                payments.size(),
                String.format(Locale.US, "%.4f", totalChairmanUsd),
                String.format(Locale.US, "%.4f", valueBasis));
        return settlement;
    }

    /**
     * Apply the branch rule to one bidder.
     *
     * @param decisionMcc chairman's final decision C
     * @param claimMcc    bidder's final claim F
     * @param penaltyRate share of the gap charged when C &lt; F
     */
    public static Split split(double decisionMcc, double claimMcc, double penaltyRate) {
        if (decisionMcc < claimMcc) {
            double penalty = penaltyRate * (claimMcc - decisionMcc);
            return new Split(claimMcc + penalty, decisionMcc - penalty);
        }
        double mid = (decisionMcc + claimMcc) / 2.0;
        return new Split(mid, mid);
    }

    public record Split(double chairmanPays, double bidderReceives) {
    }
}
