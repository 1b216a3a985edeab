package ru.oparin.avatarpool.exception;

import lombok.Getter;

@Getter
public class AvatarNotFoundException extends AvatarException {
    private final String avatarId;

    public AvatarNotFoundException(String avatarId) {
        super(AvatarErrorType.NOT_FOUND, "Аватар не найден: " + avatarId);
        this.avatarId = avatarId;
    }
}
