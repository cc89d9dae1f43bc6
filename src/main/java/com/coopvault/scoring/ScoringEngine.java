package com.coopvault.scoring;

import com.coopvault.coopconfig.CoopConfigSnapshot;

/**
 * Scores a proposal against the cooperative's charter goals and decides whether it
 * may advance.
 *
 * Implementations range from deterministic rules to model-backed agents. From the
 * caller's point of view the call is a pure function of its inputs.
 */
public interface ScoringEngine {

    /**
     * @throws ScoringEngineException if the engine is unavailable or fails
     */
    Evaluation evaluate(ProposalSubmission submission, CoopConfigSnapshot config);

    String getEngineVersion();
}
