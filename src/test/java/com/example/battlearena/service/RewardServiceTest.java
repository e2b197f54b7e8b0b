package com.example.battlearena.service;

import com.example.battlearena.config.GameRules;
import com.example.battlearena.error.PlayerNotFoundException;
import com.example.battlearena.model.domain.User;
import com.example.battlearena.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class RewardServiceTest {

    @Mock
    private UserRepository userRepository;
    @Mock
    private ProgressionService progressionService;

    private RewardService rewardService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        rewardService = new RewardService(userRepository, progressionService, new GameRules());
    }

    @Test
    void testPveWinGrantsCoinsAndXp() {
        when(progressionService.gainXp(1L, 50)).thenReturn(List.of(2));
        when(userRepository.addCoins(1L, 50)).thenReturn(1);

        RewardService.Settlement settlement = rewardService.settlePveWin(1L);

        assertEquals(50, settlement.getCoinsDelta());
        assertEquals(50, settlement.getXpGained());
        assertEquals(List.of(2), settlement.getLevelsReached());
        verify(userRepository).addCoins(1L, 50);
    }

    @Test
    void testPveWinForVanishedPlayer() {
        when(progressionService.gainXp(1L, 50)).thenReturn(Collections.emptyList());
        when(userRepository.addCoins(1L, 50)).thenReturn(0);

        assertThrows(PlayerNotFoundException.class, () -> rewardService.settlePveWin(1L));
    }

    @Test
    void testPveLossIsClampedAtZero() {
        User poor = new User("hero", "secret", 10);
        when(userRepository.findById(1L)).thenReturn(Optional.of(poor));

        RewardService.Settlement settlement = rewardService.settlePveLoss(1L);

        assertEquals(-10, settlement.getCoinsDelta());
        assertEquals(0, settlement.getXpGained());
        verify(userRepository).deductCoinsClamped(1L, 25);
        verifyNoInteractions(progressionService);
    }

    @Test
    void testPveLossTakesFullPenalty() {
        when(userRepository.findById(1L)).thenReturn(Optional.of(new User("hero", "secret", 300)));

        assertEquals(-25, rewardService.settlePveLoss(1L).getCoinsDelta());
    }

    @Test
    void testPvpWinGrantsXpOnlyByDefault() {
        when(progressionService.gainXp(1L, 75)).thenReturn(Collections.emptyList());

        RewardService.Settlement settlement = rewardService.settlePvpWin(1L);

        assertEquals(0, settlement.getCoinsDelta());
        assertEquals(75, settlement.getXpGained());
        verify(userRepository, never()).addCoins(anyLong(), anyLong());
    }
}
