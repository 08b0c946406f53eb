package com.example.LlmCouncil.service;

import com.example.LlmCouncil.config.CouncilProperties;
import com.example.LlmCouncil.model.CandidateModel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Pricing catalog backed by the {@code council.catalog} list.
 * Duplicate model ids keep their first entry; entries without an id are skipped.
 */
@Service
@RequiredArgsConstructor
public class ConfiguredPricingCatalog implements PricingCatalog {

    private final CouncilProperties properties;

    @Override
    public List<CandidateModel> listCandidates() {
        Set<String> seen = new LinkedHashSet<>();
        List<CandidateModel> candidates = new ArrayList<>();
        for (CandidateModel candidate : properties.catalog()) {
            if (candidate == null || candidate.modelId() == null || candidate.modelId().isBlank()) {
                continue;
            }
            if (seen.add(candidate.modelId())) {
                candidates.add(candidate);
            }
        }
        return List.copyOf(candidates);
    }
}
