package ru.oparin.avatarpool.model.entity;

import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Сущность пользователя системы.
 * Таблица принадлежит подсистеме учетных записей, сервис аватаров только читает пользователя
 * и меняет путь к его изображению профиля.
 */
@Table(value = "user", schema = "avatarpool")
@Getter
@Setter
@EqualsAndHashCode
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {

    /**
     * Уникальный идентификатор пользователя.
     * Автоматически генерируется базой данных и никогда не переиспользуется.
     */
    @Id
    private Long id;

    /**
     * Имя пользователя, используется только в логах.
     */
    private String username;

    /**
     * Абсолютный путь к текущему изображению профиля.
     * null - изображение не задано.
     */
    private String profileImagePath;

    @CreatedDate
    private LocalDateTime createdAt;

    @LastModifiedDate
    private LocalDateTime updatedAt;
}
