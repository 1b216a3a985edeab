package ru.oparin.avatarpool.scheduled;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import ru.oparin.avatarpool.config.properties.AvatarProperties;
import ru.oparin.avatarpool.service.AvatarService;

import java.time.Duration;

/**
 * Планировщик обслуживания аватаров: сверка при старте и регулярная очистка
 * осиротевших изображений профиля.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AvatarMaintenanceScheduler {

    private final AvatarService avatarService;
    private final AvatarProperties avatarProperties;

    private volatile Disposable startupMaintenance;

    /**
     * Сверка и очистка после старта приложения, с задержкой из настроек.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        AvatarProperties.Maintenance maintenance = avatarProperties.getMaintenance();
        if (!maintenance.isStartupEnabled()) {
            log.info("Стартовая сверка аватаров отключена");
            return;
        }

        Duration delay = maintenance.getStartupDelay();
        log.info("Сверка аватаров запланирована через {} с", delay.toSeconds());
        startupMaintenance = Mono.delay(delay)
                .then(Mono.defer(avatarService::validate))
                .then(Mono.defer(avatarService::collectOrphans))
                .subscribe(
                        deleted -> log.info("Стартовое обслуживание аватаров завершено"),
                        error -> log.error("Ошибка при стартовом обслуживании аватаров", error));
    }

    /**
     * Очистка осиротевших изображений профиля по расписанию, по умолчанию каждый день в 03:30.
     */
    @Scheduled(cron = "${avatar.maintenance.orphan-cleanup-cron:0 30 3 * * ?}")
    public void cleanupOrphanedProfileImages() {
        log.info("Очистка осиротевших изображений профиля...");
        try {
            Integer deleted = avatarService.collectOrphans().block();
            log.info("Очистка изображений профиля завершена. Удалено файлов: {}", deleted);
        } catch (Exception e) {
            log.error("Ошибка при очистке изображений профиля", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        Disposable maintenance = startupMaintenance;
        if (maintenance != null && !maintenance.isDisposed()) {
            log.info("Остановка незавершенного стартового обслуживания аватаров");
            maintenance.dispose();
        }
    }
}
