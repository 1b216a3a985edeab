package ru.oparin.avatarpool.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Выбор пользователя: какой аватар из пула он назначил себе.
 * Ссылка на аватар не проверяется при записи, ее валидирует сверка.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AvatarBinding {
    private Long userId;
    private String avatarId;
}
