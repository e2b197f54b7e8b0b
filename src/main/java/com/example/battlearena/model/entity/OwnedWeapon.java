package com.example.battlearena.model.entity;

import com.example.battlearena.model.domain.Rarity;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "owned_weapons", indexes = @Index(columnList = "ownerId"))
@Data
@NoArgsConstructor
public class OwnedWeapon {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long ownerId;

    @Column(nullable = false)
    private String name;

    private String description;

    @Column(nullable = false)
    private int attackBonus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Rarity rarity;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime acquiredAt;

    public OwnedWeapon(Long ownerId, String name, String description, int attackBonus, Rarity rarity) {
        this.ownerId = ownerId;
        this.name = name;
        this.description = description;
        this.attackBonus = attackBonus;
        this.rarity = rarity;
    }
}
