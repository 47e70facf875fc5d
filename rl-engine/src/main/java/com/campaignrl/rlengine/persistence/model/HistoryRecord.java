package com.campaignrl.rlengine.persistence.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Archived experience: PROCESSED, DROPPED_OVERFLOW or DROPPED_VALIDATION.
 *
 * metadata : JSON-serialised {@code Map<String, Object>}
 */
@Data
@NoArgsConstructor
@Table("rl_experience_history")
public class HistoryRecord {

    @Id
    private String experienceId;

    private String context;

    private String action;

    private double reward;

    private String status;

    private String metadata;

    private LocalDateTime createdAt;

    private LocalDateTime processedAt;
}
