package ru.oparin.avatarpool.exception;

/**
 * Загружаемый файл не прошел проверку (расширение, размер, пустое содержимое).
 */
public class AvatarValidationException extends AvatarException {

    public AvatarValidationException(String message) {
        super(AvatarErrorType.VALIDATION, message);
    }
}
