package com.taodividends.backend.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StakeRequest {

    @NotNull
    @DecimalMin(value = "0", inclusive = false, message = "amount must be positive")
    @Digits(integer = 29, fraction = 9)
    private BigDecimal amount;

    @Min(0)
    private Integer netuid;

    private String hotkey;
}
