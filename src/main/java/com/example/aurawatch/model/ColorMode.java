package com.example.aurawatch.model;

public enum ColorMode {
    AUTO,
    ALWAYS,
    NEVER
}
