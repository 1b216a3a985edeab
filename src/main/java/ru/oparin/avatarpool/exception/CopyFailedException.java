package ru.oparin.avatarpool.exception;

/**
 * Не удалось скопировать аватар из пула в директорию пользователя.
 * К моменту выброса на диске не осталось никаких следов попытки.
 */
public class CopyFailedException extends AvatarStorageException {

    public CopyFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
