package ru.oparin.avatarpool.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Категории ошибок ядра аватаров.
 * Код статуса - подсказка для транспортного слоя, само ядро его не использует.
 */
@Getter
@RequiredArgsConstructor
public enum AvatarErrorType {

    NOT_FOUND(404),
    VALIDATION(400),
    IO_FAILURE(500),
    INVARIANT(500);

    private final int statusHint;
}
