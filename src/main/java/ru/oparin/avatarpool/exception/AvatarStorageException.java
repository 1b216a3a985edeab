package ru.oparin.avatarpool.exception;

/**
 * Ошибка записи, копирования или удаления на диске.
 */
public class AvatarStorageException extends AvatarException {

    public AvatarStorageException(String message, Throwable cause) {
        super(AvatarErrorType.IO_FAILURE, message, cause);
    }
}
