package com.example.LlmCouncil.service;

import com.example.LlmCouncil.config.CouncilProperties;
import com.example.LlmCouncil.model.CandidateModel;

import java.util.List;

final class TestProperties {

    static final String CHAIRMAN = "test/chairman";

    private TestProperties() {
    }

    static CouncilProperties withCatalog(List<CandidateModel> catalog) {
        return new CouncilProperties(
                null,
                null,
                new CouncilProperties.Chairman(CHAIRMAN, null, null),
                null,
                null,
                new CouncilProperties.Title(false, null, null),
                CouncilProperties.Store.MEMORY,
                catalog);
    }

    static CouncilProperties withContractValue(List<CandidateModel> catalog, double contractValueUsd) {
        return new CouncilProperties(
                null,
                null,
                new CouncilProperties.Chairman(CHAIRMAN, null, null),
                new CouncilProperties.Settlement(null, contractValueUsd),
                null,
                new CouncilProperties.Title(false, null, null),
                CouncilProperties.Store.MEMORY,
                catalog);
    }
}
