package com.example.battlearena.model.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OpponentTemplate {
    private String name;
    private int power;
    private int health;
}
