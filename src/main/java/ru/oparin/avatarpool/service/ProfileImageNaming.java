package ru.oparin.avatarpool.service;

import org.springframework.stereotype.Component;
import ru.oparin.avatarpool.config.properties.AvatarProperties;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Имена и расположение изображений профиля в личных директориях пользователей.
 * <p>
 * Имя файла: {@code profile_avatar_{avatarId}_{token}{ext}}. Токен нужен только для того,
 * чтобы у каждой привязки был новый URL и клиенты не показывали старую картинку из кеша.
 */
@Component
public class ProfileImageNaming {

    /**
     * Все файлы с этим префиксом в директории пользователя считаются изображениями профиля.
     */
    public static final String PROFILE_FILE_PREFIX = "profile_";

    private static final String AVATAR_FILE_PREFIX = PROFILE_FILE_PREFIX + "avatar_";

    private final Path usersRoot;
    private final AtomicLong lastToken = new AtomicLong();

    public ProfileImageNaming(AvatarProperties avatarProperties) {
        this.usersRoot = Paths.get(avatarProperties.getUsersDir()).toAbsolutePath().normalize();
    }

    public Path userDirectory(Long userId) {
        return usersRoot.resolve(String.valueOf(userId));
    }

    /**
     * Построить путь для новой копии аватара.
     * Путь никогда не совпадает с текущим изображением пользователя.
     *
     * @param userId       ID пользователя
     * @param avatarId     ID аватара из пула
     * @param extension    расширение файла аватара вместе с точкой
     * @param previousPath текущий путь к изображению профиля или null
     * @return новый путь внутри директории пользователя
     */
    public Path newProfileImagePath(Long userId, String avatarId, String extension, String previousPath) {
        Path directory = userDirectory(userId);
        Path candidate;
        do {
            candidate = directory.resolve(AVATAR_FILE_PREFIX + avatarId + "_" + nextToken() + extension);
        } while (previousPath != null && candidate.toString().equals(previousPath));
        return candidate;
    }

    /**
     * Следующий токен уникальности: текущее время в миллисекундах,
     * но всегда строго больше предыдущего выданного значения.
     */
    public long nextToken() {
        long now = System.currentTimeMillis();
        return lastToken.updateAndGet(previous -> Math.max(previous + 1, now));
    }

    public boolean isProfileImageFile(Path file) {
        Path fileName = file.getFileName();
        return fileName != null && fileName.toString().startsWith(PROFILE_FILE_PREFIX);
    }

    /**
     * Проверить, что файл лежит прямо в директории пользователя.
     * Удалять файлы вне этой директории сервис не должен.
     */
    public boolean isInsideUserDirectory(Long userId, Path file) {
        Path normalized = file.toAbsolutePath().normalize();
        return userDirectory(userId).equals(normalized.getParent());
    }
}
