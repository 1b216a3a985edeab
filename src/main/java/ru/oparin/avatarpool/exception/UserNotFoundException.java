package ru.oparin.avatarpool.exception;

import lombok.Getter;

@Getter
public class UserNotFoundException extends AvatarException {
    private final Long userId;

    public UserNotFoundException(Long userId) {
        super(AvatarErrorType.NOT_FOUND, "Пользователь не найден: " + userId);
        this.userId = userId;
    }
}
