package ru.oparin.avatarpool.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Запись об аватаре в общем пуле.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AvatarInfo {

    /**
     * Случайный идентификатор, не меняется за время жизни записи.
     */
    private String id;

    /**
     * Отображаемое имя - имя исходного файла без расширения. Может повторяться.
     */
    private String name;

    /**
     * Имя файла в директории пула: идентификатор + расширение.
     */
    private String storedFilename;

    private LocalDateTime createdAt;
}
