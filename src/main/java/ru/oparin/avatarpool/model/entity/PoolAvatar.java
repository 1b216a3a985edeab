package ru.oparin.avatarpool.model.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Запись об аватаре общего пула.
 * Сам файл лежит в директории пула под именем {@link #storedFilename}.
 */
@Table(value = "avatar", schema = "avatarpool")
@Getter
@Setter
@EqualsAndHashCode
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PoolAvatar {

    /**
     * Случайный UUID, присваивается при загрузке.
     */
    @Id
    private String id;

    /**
     * Имя исходного файла без расширения.
     */
    private String name;

    private String storedFilename;

    /**
     * Время добавления в пул, по нему же определяется порядок списка.
     */
    private LocalDateTime createdAt;
}
