package ru.oparin.avatarpool.exception;

public class AvatarInvariantException extends AvatarException {

    public AvatarInvariantException(String message) {
        super(AvatarErrorType.INVARIANT, message);
    }
}
