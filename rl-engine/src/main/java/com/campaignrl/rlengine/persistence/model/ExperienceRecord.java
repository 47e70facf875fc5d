package com.campaignrl.rlengine.persistence.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Mirror of the active (pending) buffer. Rows move to {@code rl_experience_history}
 * once their experience is processed or dropped.
 *
 * metadata : JSON-serialised {@code Map<String, Object>}
 */
@Data
@NoArgsConstructor
@Table("rl_experiences")
public class ExperienceRecord {

    @Id
    private String experienceId;

    private String context;

    private String action;

    private double reward;

    private String status;

    private String metadata;

    private LocalDateTime createdAt;
}
