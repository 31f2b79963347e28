package com.queryhub.domain.job;

import com.queryhub.domain.error.ConfigurationException;
import com.queryhub.domain.model.IssuedBy;
import com.queryhub.domain.model.MtuResult;
import com.queryhub.domain.service.CredentialStore;
import com.queryhub.domain.service.MtuService;
import com.queryhub.infrastructure.persistence.entity.MtuTrackingEntity;
import com.queryhub.infrastructure.persistence.repository.MtuTrackingRepository;
import com.queryhub.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MtuTrackingJobTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 1);

    @Mock
    private CredentialStore credentialStore;

    @Mock
    private MtuService mtuService;

    @Mock
    private MtuTrackingRepository trackingRepository;

    private MtuTrackingJob job;

    @BeforeEach
    void setUp() {
        job = new MtuTrackingJob(credentialStore, mtuService, trackingRepository,
                MutableClock.startingAt("2026-03-01T02:00:00Z"));
        ReflectionTestUtils.setField(job, "perWorkspaceTimeoutSeconds", 5L);
    }

    @Test
    void testTrackAll_FailingWorkspaceDoesNotStopOthers() {
        // Given
        when(credentialStore.activeWorkspaces("posthog")).thenReturn(List.of("ws-1", "ws-2", "ws-3"));
        when(mtuService.calculate("ws-1", IssuedBy.MACHINE, true)).thenReturn(Mono.just(mtu("ws-1", 10)));
        when(mtuService.calculate("ws-2", IssuedBy.MACHINE, true))
                .thenReturn(Mono.error(new ConfigurationException("PostHog integration is disabled")));
        when(mtuService.calculate("ws-3", IssuedBy.MACHINE, true)).thenReturn(Mono.just(mtu("ws-3", 30)));
        when(trackingRepository.findByWorkspaceIdAndTrackingDate(anyString(), eq(TODAY))).thenReturn(Optional.empty());

        // When
        job.trackAll();

        // Then
        ArgumentCaptor<MtuTrackingEntity> saved = ArgumentCaptor.forClass(MtuTrackingEntity.class);
        verify(trackingRepository, times(2)).save(saved.capture());
        assertEquals("ws-1", saved.getAllValues().get(0).getWorkspaceId());
        assertEquals(30, saved.getAllValues().get(1).getMtuCount());
    }

    @Test
    void testTrack_UpdatesExistingSnapshot() {
        // Given
        MtuTrackingEntity existing = MtuTrackingEntity.builder()
                .workspaceId("ws-1")
                .trackingDate(TODAY)
                .mtuCount(5)
                .source("primary")
                .build();
        when(mtuService.calculate("ws-1", IssuedBy.MACHINE, true)).thenReturn(Mono.just(mtu("ws-1", 12)));
        when(trackingRepository.findByWorkspaceIdAndTrackingDate("ws-1", TODAY)).thenReturn(Optional.of(existing));

        // When
        boolean recorded = job.track("ws-1");

        // Then
        assertTrue(recorded);
        verify(trackingRepository).save(existing);
        assertEquals(12, existing.getMtuCount());
        assertEquals("fallback_complete", existing.getSource());
        assertNotNull(existing.getUpdatedAt());
    }

    private static MtuResult mtu(String workspaceId, long count) {
        return MtuResult.builder()
                .workspaceId(workspaceId)
                .mtuCount(count)
                .source("fallback_complete")
                .trackedDate(TODAY)
                .build();
    }
}
