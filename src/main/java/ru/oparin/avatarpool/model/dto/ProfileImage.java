package ru.oparin.avatarpool.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * Изображение профиля, скопированное из пула в личную директорию пользователя.
 */
@Data
@Builder
@AllArgsConstructor
public class ProfileImage {
    private Long userId;
    private String avatarId;
    private Path path;
}
