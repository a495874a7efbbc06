package com.taodividends.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;

@Entity
@Table(name = "dividend_history")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DividendRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Integer netuid;

    @Column(nullable = false, length = 64)
    private String hotkey;

    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger dividend;

    @Column(nullable = false, length = 32)
    private String source;

    @Column(name = "observed_at", nullable = false)
    private Instant observedAt;
}
