package ru.oparin.avatarpool.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.oparin.avatarpool.exception.AvatarException;
import ru.oparin.avatarpool.exception.AvatarNotFoundException;
import ru.oparin.avatarpool.model.dto.AvatarBinding;
import ru.oparin.avatarpool.model.dto.ReconciliationReport;
import ru.oparin.avatarpool.model.entity.User;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.channels.ClosedByInterruptException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Сверка привязок аватаров и очистка осиротевших изображений профиля.
 * <p>
 * Обе операции выполняются под эксклюзивной блокировкой: пока они идут, привязки,
 * отвязки и удаления из пула ждут.
 * Ошибка по одному пользователю логируется и не прерывает обработку остальных.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvatarReconciliationService {

    private final AvatarPoolStore avatarPoolStore;
    private final AvatarBindingStore avatarBindingStore;
    private final ProfileImageBinder profileImageBinder;
    private final UserDirectory userDirectory;
    private final ProfileImageNaming profileImageNaming;
    private final AvatarLocks avatarLocks;

    /**
     * Проверить все привязки и восстановить пропавшие изображения профиля.
     * Невосстановимые привязки удаляются одним запросом в конце прохода.
     * <p>
     * Если аватара уже нет в пуле или пользователь не найден, привязка удаляется.
     * Указатель на изображение профиля при этом сбрасывается, только если файл по нему
     * не читается: уже скопированное изображение остается у пользователя и после
     * удаления аватара из пула.
     * <p>
     * При отмене проход останавливается с {@link CancellationException}, и ничего из
     * накопленного не удаляется. Следующий проход проверит эти привязки заново.
     *
     * @return количество восстановленных и удаленных привязок
     */
    public ReconciliationReport validate() {
        return avatarLocks.withExclusiveAccess(this::validateLocked);
    }

    /**
     * Удалить из директорий пользователей файлы profile_*, на которые не указывает
     * текущее изображение профиля.
     *
     * @return количество удаленных файлов
     */
    public int collectOrphans() {
        return avatarLocks.withExclusiveAccess(this::collectOrphansLocked);
    }

    private ReconciliationReport validateLocked() {
        List<AvatarBinding> bindings = avatarBindingStore.list();
        if (bindings.isEmpty()) {
            log.info("Нет привязок аватаров для проверки");
            return new ReconciliationReport(0, 0);
        }

        int repairedCount = 0;
        List<Long> bindingsToRemove = new ArrayList<>();
        for (AvatarBinding binding : bindings) {
            checkCancelled();
            try {
                switch (validateBinding(binding)) {
                    case REPAIRED -> repairedCount++;
                    case REMOVED -> bindingsToRemove.add(binding.getUserId());
                    default -> {
                    }
                }
            } catch (CancellationException e) {
                log.warn("Проверка аватаров прервана, невалидные привязки не удалены: {}", bindingsToRemove.size());
                throw e;
            } catch (RuntimeException e) {
                rethrowIfCancelled(e);
                log.error("Ошибка при проверке аватара пользователя {}", binding.getUserId(), e);
            }
        }

        if (!bindingsToRemove.isEmpty()) {
            avatarBindingStore.removeAll(bindingsToRemove);
            log.info("Удалено невалидных привязок аватаров: {}", bindingsToRemove.size());
        }

        log.info("Проверка аватаров завершена. Восстановлено: {}, удалено невалидных: {}",
                repairedCount, bindingsToRemove.size());
        return new ReconciliationReport(repairedCount, bindingsToRemove.size());
    }

    private BindingState validateBinding(AvatarBinding binding) {
        Long userId = binding.getUserId();
        String avatarId = binding.getAvatarId();

        Optional<User> found = userDirectory.getUser(userId);
        if (found.isEmpty()) {
            log.warn("Пользователь не найден для привязки аватара: {}", userId);
            return BindingState.REMOVED;
        }
        User user = found.get();
        boolean profileImageExists = isReadableFile(user.getProfileImagePath());

        if (!isInPool(avatarId)) {
            log.error("Невозможно проверить аватар пользователя {}: аватара {} больше нет в пуле",
                    user.getUsername(), avatarId);
            if (!profileImageExists) {
                clearProfileImagePath(user);
            }
            return BindingState.REMOVED;
        }

        if (profileImageExists) {
            log.debug("Аватар пользователя {} в порядке", user.getUsername());
            return BindingState.CONSISTENT;
        }

        log.warn("Изображение профиля пользователя {} отсутствует (ожидалось: {}). Пытаемся восстановить...",
                user.getUsername(), user.getProfileImagePath());
        try {
            profileImageBinder.bind(userId, avatarId);
            log.info("Аватар пользователя {} успешно восстановлен", user.getUsername());
            return BindingState.REPAIRED;
        } catch (AvatarException e) {
            rethrowIfCancelled(e);
            log.error("Не удалось восстановить аватар пользователя {}: {}", user.getUsername(), e.getMessage());
            userDirectory.getUser(userId).ifPresent(this::clearProfileImagePath);
            return BindingState.REMOVED;
        }
    }

    private boolean isInPool(String avatarId) {
        try {
            avatarPoolStore.resolve(avatarId);
            return true;
        } catch (AvatarNotFoundException e) {
            return false;
        }
    }

    private void clearProfileImagePath(User user) {
        String previousPath = user.getProfileImagePath();
        if (previousPath == null) {
            return;
        }
        user.setProfileImagePath(null);
        try {
            userDirectory.persistUser(user);
            log.info("Сброшена ссылка на изображение профиля пользователя {}", user.getUsername());
        } catch (RuntimeException e) {
            user.setProfileImagePath(previousPath);
            log.warn("Не удалось сбросить ссылку на изображение профиля пользователя {}", user.getId(), e);
        }
    }

    private int collectOrphansLocked() {
        List<User> users;
        try {
            users = userDirectory.listUsers();
        } catch (RuntimeException e) {
            log.error("Ошибка при получении списка пользователей для очистки изображений профиля", e);
            return 0;
        }

        int deletedCount = 0;
        for (User user : users) {
            checkCancelled();
            try {
                deletedCount += collectUserOrphans(user);
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                rethrowIfCancelled(e);
                log.error("Ошибка при очистке изображений профиля пользователя {}", user.getId(), e);
            }
        }

        log.info("Удалено осиротевших изображений профиля: {}", deletedCount);
        return deletedCount;
    }

    private int collectUserOrphans(User user) {
        Path userDirectoryPath = profileImageNaming.userDirectory(user.getId());
        if (!Files.isDirectory(userDirectoryPath)) {
            return 0;
        }

        Path currentPath = toPath(user.getProfileImagePath()).orElse(null);
        List<Path> profileFiles;
        try (Stream<Path> paths = Files.list(userDirectoryPath)) {
            profileFiles = paths
                    .filter(Files::isRegularFile)
                    .filter(profileImageNaming::isProfileImageFile)
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.error("Ошибка при чтении директории: {}", userDirectoryPath, e);
            return 0;
        }

        int deletedCount = 0;
        for (Path file : profileFiles) {
            checkCancelled();
            if (file.toAbsolutePath().normalize().equals(currentPath)) {
                continue;
            }
            try {
                Files.delete(file);
                deletedCount++;
                log.debug("Удалено осиротевшее изображение профиля: {}", file);
            } catch (IOException e) {
                log.warn("Не удалось удалить осиротевший файл: {}", file, e);
            }
        }
        return deletedCount;
    }

    private static boolean isReadableFile(String value) {
        return toPath(value)
                .map(path -> Files.isRegularFile(path) && Files.isReadable(path))
                .orElse(false);
    }

    private static Optional<Path> toPath(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Paths.get(value).toAbsolutePath().normalize());
        } catch (InvalidPathException e) {
            log.warn("Некорректный путь к изображению профиля: {}", value);
            return Optional.empty();
        }
    }

    /**
     * Ошибка, вызванная прерыванием потока, - это отмена: привязку и указатель пользователя она не меняет.
     */
    private static void rethrowIfCancelled(RuntimeException error) {
        if (Thread.currentThread().isInterrupted() || isCausedByInterrupt(error)) {
            CancellationException cancellation = new CancellationException("Обслуживание аватаров прервано");
            cancellation.initCause(error);
            throw cancellation;
        }
    }

    private static boolean isCausedByInterrupt(Throwable error) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof InterruptedException
                    || cause instanceof InterruptedIOException
                    || cause instanceof ClosedByInterruptException) {
                return true;
            }
        }
        return false;
    }

    private static void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Обслуживание аватаров прервано");
        }
    }

    private enum BindingState {
        CONSISTENT,
        REPAIRED,
        REMOVED
    }
}
