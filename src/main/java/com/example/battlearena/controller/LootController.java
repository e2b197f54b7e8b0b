package com.example.battlearena.controller;

import com.example.battlearena.model.domain.User;
import com.example.battlearena.model.dto.LootResultDTO;
import com.example.battlearena.service.LootService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/loot")
public class LootController {

    private final LootService lootService;

    public LootController(LootService lootService) {
        this.lootService = lootService;
    }

    @PostMapping("/character")
    public ResponseEntity<LootResultDTO> rollCharacter(@AuthenticationPrincipal User user) {
        return ResponseEntity.ok(lootService.rollCharacter(user.getId()));
    }

    @PostMapping("/weapon")
    public ResponseEntity<LootResultDTO> rollWeapon(@AuthenticationPrincipal User user) {
        return ResponseEntity.ok(lootService.rollWeapon(user.getId()));
    }
}
