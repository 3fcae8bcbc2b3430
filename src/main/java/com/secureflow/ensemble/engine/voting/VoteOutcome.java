package com.secureflow.ensemble.engine.voting;

import lombok.Value;

@Value
public class VoteOutcome {
    double score;
    double confidence;
}
