package ru.oparin.avatarpool.scheduled;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import ru.oparin.avatarpool.config.properties.AvatarProperties;
import ru.oparin.avatarpool.model.dto.ReconciliationReport;
import ru.oparin.avatarpool.service.AvatarService;

import java.time.Duration;

import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AvatarMaintenanceSchedulerTest {

    @Mock
    private AvatarService avatarService;

    private AvatarProperties properties;
    private AvatarMaintenanceScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new AvatarProperties();
        properties.getMaintenance().setStartupDelay(Duration.ofMillis(10));
        scheduler = new AvatarMaintenanceScheduler(avatarService, properties);
    }

    @Test
    void onApplicationReady_RunsValidateThenCollectOrphans() {
        when(avatarService.validate()).thenReturn(Mono.just(new ReconciliationReport(1, 0)));
        when(avatarService.collectOrphans()).thenReturn(Mono.just(3));

        scheduler.onApplicationReady();

        verify(avatarService, timeout(2000)).validate();
        verify(avatarService, timeout(2000)).collectOrphans();
    }

    @Test
    void onApplicationReady_WhenDisabled_DoesNothing() {
        properties.getMaintenance().setStartupEnabled(false);

        scheduler.onApplicationReady();

        verifyNoInteractions(avatarService);
    }

    @Test
    void shutdown_BeforeDelayElapses_CancelsStartupMaintenance() throws InterruptedException {
        properties.getMaintenance().setStartupDelay(Duration.ofMillis(200));

        scheduler.onApplicationReady();
        scheduler.shutdown();
        Thread.sleep(400);

        verifyNoInteractions(avatarService);
    }

    @Test
    void cleanupOrphanedProfileImages_WhenFails_DoesNotPropagate() {
        when(avatarService.collectOrphans()).thenReturn(Mono.error(new IllegalStateException("disk is gone")));

        scheduler.cleanupOrphanedProfileImages();

        verify(avatarService).collectOrphans();
    }
}
