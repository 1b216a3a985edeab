package ru.oparin.avatarpool.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.oparin.avatarpool.exception.CopyFailedException;
import ru.oparin.avatarpool.exception.PointerUpdateFailedException;
import ru.oparin.avatarpool.exception.UserNotFoundException;
import ru.oparin.avatarpool.model.dto.ProfileImage;
import ru.oparin.avatarpool.model.dto.ResolvedAvatar;
import ru.oparin.avatarpool.model.entity.User;
import ru.oparin.avatarpool.util.ImageFileUtil;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * Назначение аватара из пула в качестве изображения профиля пользователя.
 * <p>
 * Привязка выполняется по шагам, каждый из которых - точка фиксации:
 * <ol>
 *   <li>найти аватар в пуле и пользователя;</li>
 *   <li>запомнить текущий путь к изображению профиля;</li>
 *   <li>скопировать аватар под новым, никогда не повторяющимся именем;</li>
 *   <li>сохранить новый путь у пользователя, при ошибке удалить скопированный файл;</li>
 *   <li>удалить прежний файл (ошибка не фатальна, файл подберет очистка);</li>
 *   <li>записать привязку.</li>
 * </ol>
 * Операции одного пользователя выполняются под его блокировкой.
 * <p>
 * Удаляется только файл, на который указывал пользователь. Прочие файлы profile_* в его директории,
 * оставшиеся от прежних сбоев, привязка не трогает: их удаляет очистка осиротевших изображений
 * ({@link AvatarReconciliationService#collectOrphans()}).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileImageBinder {

    private static final int COPY_BUFFER_SIZE = 8192;

    private final AvatarPoolStore avatarPoolStore;
    private final AvatarBindingStore avatarBindingStore;
    private final UserDirectory userDirectory;
    private final ProfileImageNaming profileImageNaming;
    private final AvatarLocks avatarLocks;

    /**
     * Назначить пользователю аватар из пула.
     *
     * @param userId   ID пользователя
     * @param avatarId ID аватара
     * @return скопированное изображение профиля
     * @throws ru.oparin.avatarpool.exception.AvatarNotFoundException если аватара нет в пуле
     * @throws UserNotFoundException                                  если пользователь не найден
     * @throws CopyFailedException                                    если не удалось скопировать файл
     * @throws PointerUpdateFailedException                           если не удалось сохранить пользователя
     */
    public ProfileImage bind(Long userId, String avatarId) {
        return avatarLocks.withUserLock(userId, () -> bindLocked(userId, avatarId));
    }

    /**
     * Убрать у пользователя изображение профиля и привязку. Пул не меняется.
     *
     * @throws UserNotFoundException        если пользователь не найден
     * @throws PointerUpdateFailedException если не удалось сохранить пользователя
     */
    public void unbind(Long userId) {
        avatarLocks.withUserLock(userId, () -> {
            unbindLocked(userId);
            return null;
        });
    }

    private ProfileImage bindLocked(Long userId, String avatarId) {
        log.info("Назначение аватара {} пользователю {}", avatarId, userId);

        ResolvedAvatar avatar = avatarPoolStore.resolve(avatarId);
        User user = findUserOrThrow(userId);

        String previousPath = blankToNull(user.getProfileImagePath());
        String extension = ImageFileUtil.extractExtension(avatar.getFilePath().getFileName().toString());
        Path target = profileImageNaming.newProfileImagePath(userId, avatarId, extension, previousPath);

        copyAvatar(avatar.getFilePath(), target);
        commitProfileImagePath(user, target, previousPath);
        deletePreviousImage(userId, previousPath, target);

        avatarBindingStore.set(userId, avatarId);

        log.info("Аватар {} назначен пользователю {} ({}), изображение профиля: {}",
                avatarId, user.getUsername(), userId, target);
        return ProfileImage.builder()
                .userId(userId)
                .avatarId(avatarId)
                .path(target)
                .build();
    }

    private void unbindLocked(Long userId) {
        User user = findUserOrThrow(userId);
        String previousPath = blankToNull(user.getProfileImagePath());

        if (previousPath != null) {
            user.setProfileImagePath(null);
            try {
                userDirectory.persistUser(user);
            } catch (RuntimeException e) {
                user.setProfileImagePath(previousPath);
                log.error("Не удалось сбросить изображение профиля пользователя {}", userId, e);
                throw new PointerUpdateFailedException("Не удалось сбросить изображение профиля: " + e.getMessage(), e);
            }
            deletePreviousImage(userId, previousPath, null);
        }

        avatarBindingStore.clear(userId);
        log.info("Аватар пользователя {} ({}) снят", user.getUsername(), userId);
    }

    private User findUserOrThrow(Long userId) {
        return userDirectory.getUser(userId)
                .orElseThrow(() -> {
                    log.error("Пользователь не найден: {}", userId);
                    return new UserNotFoundException(userId);
                });
    }

    private void copyAvatar(Path source, Path target) {
        try {
            Files.createDirectories(target.getParent());
            try (InputStream in = Files.newInputStream(source);
                 OutputStream out = Files.newOutputStream(target,
                         StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                byte[] buffer = new byte[COPY_BUFFER_SIZE];
                int read;
                while ((read = in.read(buffer)) != -1) {
                    if (Thread.currentThread().isInterrupted()) {
                        throw new InterruptedIOException("Копирование прервано");
                    }
                    out.write(buffer, 0, read);
                }
            }
            log.debug("Аватар скопирован: {} -> {}", source, target);
        } catch (IOException e) {
            deleteQuietly(target, "частичная копия аватара");
            log.error("Ошибка при копировании аватара {} в {}", source, target, e);
            throw new CopyFailedException("Ошибка при копировании аватара: " + e.getMessage(), e);
        }
    }

    private void commitProfileImagePath(User user, Path target, String previousPath) {
        user.setProfileImagePath(target.toString());
        try {
            userDirectory.persistUser(user);
        } catch (RuntimeException e) {
            user.setProfileImagePath(previousPath);
            log.error("Не удалось сохранить новое изображение профиля пользователя {}", user.getId(), e);
            deleteQuietly(target, "копия после неудачного обновления пользователя");
            throw new PointerUpdateFailedException("Не удалось обновить изображение профиля: " + e.getMessage(), e);
        }
    }

    private void deletePreviousImage(Long userId, String previousPath, Path currentPath) {
        if (previousPath == null) {
            return;
        }
        Optional<Path> previous = toPath(previousPath);
        if (previous.isEmpty() || previous.get().equals(currentPath)) {
            return;
        }

        Path file = previous.get();
        if (!profileImageNaming.isInsideUserDirectory(userId, file)) {
            log.warn("Прежнее изображение профиля {} находится вне директории пользователя {}, не удаляем", file, userId);
            return;
        }

        try {
            if (Files.deleteIfExists(file)) {
                log.info("Удалено прежнее изображение профиля: {}", file);
            } else {
                log.info("Прежнее изображение профиля не найдено для удаления: {}", file);
            }
        } catch (IOException e) {
            log.warn("Не удалось удалить прежнее изображение профиля {}, файл удалит очистка", file, e);
        }
    }

    private static Optional<Path> toPath(String value) {
        try {
            return Optional.of(Paths.get(value).toAbsolutePath().normalize());
        } catch (InvalidPathException e) {
            log.warn("Некорректный путь к изображению профиля: {}", value);
            return Optional.empty();
        }
    }

    private static void deleteQuietly(Path path, String description) {
        try {
            if (Files.deleteIfExists(path)) {
                log.info("Удален файл ({}): {}", description, path);
            }
        } catch (IOException e) {
            log.warn("Не удалось удалить файл ({}): {}", description, path, e);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
