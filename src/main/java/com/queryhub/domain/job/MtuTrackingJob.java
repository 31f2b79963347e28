package com.queryhub.domain.job;

import com.queryhub.domain.model.IssuedBy;
import com.queryhub.domain.model.MtuResult;
import com.queryhub.domain.model.PostHogConfig;
import com.queryhub.domain.service.CredentialStore;
import com.queryhub.domain.service.MtuService;
import com.queryhub.infrastructure.persistence.entity.MtuTrackingEntity;
import com.queryhub.infrastructure.persistence.repository.MtuTrackingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Daily MTU snapshot for every workspace with an active PostHog integration.
 *
 * Workspaces are processed one at a time; a failing workspace is logged and
 * skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MtuTrackingJob {

    private final CredentialStore credentialStore;
    private final MtuService mtuService;
    private final MtuTrackingRepository trackingRepository;
    private final Clock clock;

    @Value("${app.billing.mtu-timeout-seconds:120}")
    private long perWorkspaceTimeoutSeconds;

    @Scheduled(cron = "${app.billing.mtu-cron:0 0 2 * * *}")
    public void trackAll() {
        List<String> workspaces = credentialStore.activeWorkspaces(PostHogConfig.NAME);
        log.info("MTU tracking started for {} workspaces", workspaces.size());

        int succeeded = 0;
        for (String workspaceId : workspaces) {
            if (track(workspaceId)) {
                succeeded++;
            }
        }

        log.info("MTU tracking finished: {}/{} workspaces recorded", succeeded, workspaces.size());
    }

    boolean track(String workspaceId) {
        try {
            MtuResult result = mtuService.calculate(workspaceId, IssuedBy.MACHINE, true)
                    .block(Duration.ofSeconds(perWorkspaceTimeoutSeconds));
            if (result == null) {
                log.warn("MTU calculation for workspace {} returned nothing", workspaceId);
                return false;
            }

            MtuTrackingEntity row = trackingRepository
                    .findByWorkspaceIdAndTrackingDate(workspaceId, result.getTrackedDate())
                    .orElseGet(() -> MtuTrackingEntity.builder()
                            .workspaceId(workspaceId)
                            .trackingDate(result.getTrackedDate())
                            .build());
            row.setMtuCount(result.getMtuCount());
            row.setSource(result.getSource());
            row.setUpdatedAt(clock.instant());
            trackingRepository.save(row);
            return true;

        } catch (Exception e) {
            log.error("MTU tracking failed for workspace {}: {}", workspaceId, e.getMessage());
            return false;
        }
    }
}
