package com.example.aurawatch.model;

import lombok.Value;

import java.time.Duration;

/**
 * Result of one poll iteration: the state for the next one and how long to wait.
 */
@Value
public class IterationOutcome {
    PollState nextState;
    EpochWindow window;
    long latestSlot;
    Duration sleep;
}
