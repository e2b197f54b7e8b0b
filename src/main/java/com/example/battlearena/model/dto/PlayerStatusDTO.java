package com.example.battlearena.model.dto;

import com.example.battlearena.model.domain.ProgressionRecord;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlayerStatusDTO {
    private String username;
    private long coins;
    private ProgressionRecord progression;
}
