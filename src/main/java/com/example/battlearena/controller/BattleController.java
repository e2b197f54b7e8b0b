package com.example.battlearena.controller;

import com.example.battlearena.model.domain.User;
import com.example.battlearena.model.dto.BattleUpdateDTO;
import com.example.battlearena.service.BattleService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/battle")
public class BattleController {

    private final BattleService battleService;

    public BattleController(BattleService battleService) {
        this.battleService = battleService;
    }

    @GetMapping("/active")
    public ResponseEntity<BattleUpdateDTO> getActiveBattle(@AuthenticationPrincipal User user) {
        if (user == null) {
            return ResponseEntity.status(401).build();
        }
        BattleUpdateDTO battle = battleService.findActiveBattle(user.getId());
        if (battle != null) {
            return ResponseEntity.ok(battle);
        } else {
            return ResponseEntity.noContent().build();
        }
    }
}
