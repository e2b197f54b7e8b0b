package com.example.battlearena.controller;

import com.example.battlearena.model.domain.PlayerBuild;
import com.example.battlearena.model.domain.ProgressionRecord;
import com.example.battlearena.model.domain.User;
import com.example.battlearena.model.dto.InventoryDTO;
import com.example.battlearena.model.dto.PlayerStatusDTO;
import com.example.battlearena.model.dto.StatAllocationRequest;
import com.example.battlearena.service.PlayerProfileService;
import com.example.battlearena.service.ProgressionService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/player")
public class PlayerController {

    private final PlayerProfileService profileService;
    private final ProgressionService progressionService;

    public PlayerController(PlayerProfileService profileService, ProgressionService progressionService) {
        this.profileService = profileService;
        this.progressionService = progressionService;
    }

    @GetMapping("/build")
    public ResponseEntity<PlayerBuild> getBuild(@AuthenticationPrincipal User user) {
        return ResponseEntity.ok(profileService.computeBuild(user.getId()));
    }

    @GetMapping("/status")
    public ResponseEntity<PlayerStatusDTO> getStatus(@AuthenticationPrincipal User user) {
        return ResponseEntity.ok(profileService.getStatus(user.getId()));
    }

    @PostMapping("/status/allocate")
    public ResponseEntity<ProgressionRecord> allocate(@AuthenticationPrincipal User user,
            @Valid @RequestBody StatAllocationRequest request) {
        return ResponseEntity.ok(progressionService.allocateStats(user.getId(), request.getStrength(),
                request.getVitality()));
    }

    @GetMapping("/inventory")
    public ResponseEntity<InventoryDTO> getInventory(@AuthenticationPrincipal User user) {
        return ResponseEntity.ok(profileService.getInventory(user.getId()));
    }
}
