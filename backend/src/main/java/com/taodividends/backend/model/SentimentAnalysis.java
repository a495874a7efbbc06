package com.taodividends.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "sentiment_analyses")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SentimentAnalysis {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "task_id", length = 64)
    private String taskId;

    @Column(nullable = false)
    private Integer netuid;

    @Column(nullable = false, length = 64)
    private String hotkey;

    // Normalised to [-1, 1].
    @Column(nullable = false)
    private Double score;

    @Column(name = "raw_score", nullable = false)
    private Integer rawScore;

    @Column(name = "posts_count", nullable = false)
    private Integer postsCount;

    @Enumerated(EnumType.STRING)
    @Column(length = 32)
    private StakeDirection direction;

    @Column(precision = 38, scale = 9)
    private BigDecimal amount;

    // Posts as they were sent to the scorer.
    @Column(name = "posts_text", length = 8000)
    private String postsText;

    @Column(name = "analyzed_at", nullable = false)
    private Instant analyzedAt;
}
