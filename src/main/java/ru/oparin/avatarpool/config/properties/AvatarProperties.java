package ru.oparin.avatarpool.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Настройки хранилища аватаров.
 * Загружаются из application.yml с префиксом avatar.
 */
@Getter
@Setter
@Validated
@Configuration
@ConfigurationProperties(prefix = "avatar")
public class AvatarProperties {

    /**
     * Директория с файлами общего пула аватаров.
     */
    @NotBlank
    private String poolDir;

    /**
     * Корень личных директорий пользователей, в которые копируются изображения профиля.
     */
    @NotBlank
    private String usersDir;

    /**
     * Максимальный размер загружаемого аватара в байтах.
     */
    @Positive
    private long maxFileSize = 5L * 1024 * 1024;

    @Valid
    @NotNull
    private Maintenance maintenance = new Maintenance();

    /**
     * Настройки сверки и очистки осиротевших файлов.
     */
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Maintenance {

        /**
         * Запускать ли сверку при старте приложения.
         */
        private boolean startupEnabled = true;

        /**
         * Задержка перед стартовой сверкой, чтобы остальная система успела подняться.
         */
        @NotNull
        private Duration startupDelay = Duration.ofSeconds(5);

        /**
         * Расписание периодической очистки осиротевших изображений профиля.
         */
        @NotBlank
        private String orphanCleanupCron = "0 30 3 * * ?";
    }
}
