package com.example.battlearena.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NotificationDTO {

    public enum Type {
        LEVEL_UP,
        INFO
    }

    private Type type;
    private String message;
    private Integer level;
}
