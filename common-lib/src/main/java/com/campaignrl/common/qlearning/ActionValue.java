package com.campaignrl.common.qlearning;

/** An action paired with its current Q-value. */
public record ActionValue(String action, double value) {}
