package com.example.battlearena.model.dto;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class StatAllocationRequest {
    @Min(0)
    private int strength;

    @Min(0)
    private int vitality;
}
