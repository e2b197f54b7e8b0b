package com.example.battlearena.model.entity;

import com.example.battlearena.model.domain.Rarity;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "owned_collectibles", indexes = @Index(columnList = "ownerId"))
@Data
@NoArgsConstructor
public class OwnedCollectible {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long ownerId;

    @Column(nullable = false)
    private String name; // template key

    private String ability;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Rarity rarity;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime acquiredAt;

    public OwnedCollectible(Long ownerId, String name, String ability, Rarity rarity) {
        this.ownerId = ownerId;
        this.name = name;
        this.ability = ability;
        this.rarity = rarity;
    }
}
