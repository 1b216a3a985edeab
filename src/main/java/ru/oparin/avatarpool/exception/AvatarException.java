package ru.oparin.avatarpool.exception;

import lombok.Getter;

@Getter
public class AvatarException extends RuntimeException {
    private final AvatarErrorType type;

    public AvatarException(AvatarErrorType type, String message) {
        super(message);
        this.type = type;
    }

    public AvatarException(AvatarErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }
}
