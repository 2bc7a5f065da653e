package com.example.aurawatch.model;

import lombok.Value;

import java.time.Instant;

@Value
public class PlannedSlot {
    long slot;
    Instant plannedTime;
}
