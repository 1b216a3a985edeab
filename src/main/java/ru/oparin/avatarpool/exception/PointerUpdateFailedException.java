package ru.oparin.avatarpool.exception;

/**
 * Не удалось сохранить новый путь к изображению профиля у пользователя.
 * Скопированный файл к моменту выброса уже удален.
 */
public class PointerUpdateFailedException extends AvatarStorageException {

    public PointerUpdateFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
