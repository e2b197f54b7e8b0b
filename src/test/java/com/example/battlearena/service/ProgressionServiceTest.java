package com.example.battlearena.service;

import com.example.battlearena.error.InvalidInputException;
import com.example.battlearena.error.NotEnoughStatPointsException;
import com.example.battlearena.error.PlayerNotFoundException;
import com.example.battlearena.logic.ProgressionCalculator;
import com.example.battlearena.model.domain.ProgressionRecord;
import com.example.battlearena.model.domain.User;
import com.example.battlearena.model.dto.NotificationDTO;
import com.example.battlearena.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ProgressionServiceTest {

    @Mock
    private UserRepository userRepository;
    @Mock
    private BattleNotifier notifier;

    private ProgressionService progressionService;
    private User user;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        progressionService = new ProgressionService(userRepository, new ProgressionCalculator(), notifier);
        user = new User("hero", "secret", 100);
        user.setId(1L);
        when(userRepository.findById(1L)).thenReturn(Optional.of(user));
        when(userRepository.existsById(1L)).thenReturn(true);
    }

    @Test
    void testGainXpSavesOnceForSeveralLevels() {
        List<Integer> levels = progressionService.gainXp(1L, 432);

        assertEquals(List.of(2, 3), levels);
        assertEquals(3, user.getProgression().getLevel());
        assertEquals(10, user.getProgression().getStatPoints());
        verify(userRepository, times(1)).save(user);
        verifyNoInteractions(notifier);
    }

    @Test
    void testGainXpForUnknownPlayer() {
        assertThrows(PlayerNotFoundException.class, () -> progressionService.gainXp(9L, 50));
        verify(userRepository, never()).save(any());
    }

    @Test
    void testAnnounceSendsOneNotificationPerLevel() {
        progressionService.announceLevelUps(1L, List.of(2, 3));

        ArgumentCaptor<NotificationDTO> sent = ArgumentCaptor.forClass(NotificationDTO.class);
        verify(notifier, times(2)).notification(eq(1L), sent.capture());
        assertEquals(NotificationDTO.Type.LEVEL_UP, sent.getAllValues().get(0).getType());
        assertEquals(2, sent.getAllValues().get(0).getLevel());
        assertEquals(3, sent.getAllValues().get(1).getLevel());
        assertTrue(sent.getAllValues().get(1).getMessage().contains("level 3"));
    }

    @Test
    void testAllocateReturnsUpdatedRecord() {
        when(userRepository.allocateStats(1L, 2, 1)).thenAnswer(invocation -> {
            ProgressionRecord record = user.getProgression();
            record.setStrength(2);
            record.setVitality(1);
            record.setStatPoints(2);
            return 1;
        });

        ProgressionRecord result = progressionService.allocateStats(1L, 2, 1);

        assertEquals(2, result.getStrength());
        assertEquals(1, result.getVitality());
        assertEquals(2, result.getStatPoints());
        assertNotSame(user.getProgression(), result);
    }

    @Test
    void testAllocateMoreThanAvailable() {
        when(userRepository.allocateStats(1L, 4, 2)).thenReturn(0);

        assertThrows(NotEnoughStatPointsException.class, () -> progressionService.allocateStats(1L, 4, 2));
    }

    @Test
    void testAllocateForUnknownPlayer() {
        when(userRepository.allocateStats(9L, 1, 0)).thenReturn(0);

        assertThrows(PlayerNotFoundException.class, () -> progressionService.allocateStats(9L, 1, 0));
    }

    @Test
    void testAllocateRejectsNegativeOrEmptyRequests() {
        assertThrows(InvalidInputException.class, () -> progressionService.allocateStats(1L, -1, 3));
        assertThrows(InvalidInputException.class, () -> progressionService.allocateStats(1L, 0, 0));
        verify(userRepository, never()).allocateStats(anyLong(), anyInt(), anyInt());
    }
}
