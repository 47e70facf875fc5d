package com.campaignrl.rlengine.persistence.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One learned strategy per normalized context.
 *
 * actionStats : JSON-serialised {@code Map<String, ActionStats>}
 * qValues     : JSON-serialised {@code Map<String, Double>} (row copy at save time)
 */
@Data
@NoArgsConstructor
@Table("rl_strategies")
public class StrategyRecord {

    @Id
    private String context;

    private String bestAction;

    private double bestQValue;

    private long totalExperiences;

    private double confidence;

    private String actionStats;

    private String qValues;

    private String algorithmVersion;

    private LocalDateTime createdAt;

    private LocalDateTime lastUpdated;
}
