package com.campaignrl.rlengine.persistence.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/** One (context, action) cell of the Q-table. Unique on (context, action). */
@Data
@NoArgsConstructor
@Table("rl_q_values")
public class QValueRecord {

    @Id
    private Long id;

    private String context;

    private String action;

    private double qValue;

    private LocalDateTime updatedAt;
}
