package com.example.LlmCouncil.service;

import com.example.LlmCouncil.model.CandidateModel;

import java.util.List;

/**
 * Source of the models allowed to bid and their per-token prices.
 */
public interface PricingCatalog {

    List<CandidateModel> listCandidates();
}
