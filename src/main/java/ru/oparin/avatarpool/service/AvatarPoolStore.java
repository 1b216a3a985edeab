package ru.oparin.avatarpool.service;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.stereotype.Service;
import ru.oparin.avatarpool.config.properties.AvatarProperties;
import ru.oparin.avatarpool.exception.AvatarInvariantException;
import ru.oparin.avatarpool.exception.AvatarNotFoundException;
import ru.oparin.avatarpool.exception.AvatarStorageException;
import ru.oparin.avatarpool.exception.AvatarValidationException;
import ru.oparin.avatarpool.mapper.AvatarMapper;
import ru.oparin.avatarpool.model.dto.AvatarInfo;
import ru.oparin.avatarpool.model.dto.ResolvedAvatar;
import ru.oparin.avatarpool.model.entity.PoolAvatar;
import ru.oparin.avatarpool.repository.PoolAvatarRepository;
import ru.oparin.avatarpool.util.ImageFileUtil;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

import static ru.oparin.avatarpool.config.DatabaseConfig.BLOCK_TIMEOUT;
import static ru.oparin.avatarpool.config.DatabaseConfig.withRetry;

/**
 * Хранилище общего пула аватаров.
 * <p>
 * Файлы лежат в директории пула под именем {@code {id}{ext}}, записи - в таблице {@code avatar}.
 * Добавление и удаление выполняются под одной блокировкой записи.
 * <p>
 * При добавлении файл всегда пишется раньше записи в таблице, поэтому запись без файла
 * появиться не может.
 */
@Slf4j
@Service
public class AvatarPoolStore {

    private final Path poolDirectory;
    private final long maxFileSize;
    private final PoolAvatarRepository poolAvatarRepository;
    private final R2dbcEntityTemplate r2dbcEntityTemplate;
    private final AvatarMapper avatarMapper;
    private final List<AvatarRemovalListener> removalListeners;

    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile boolean initialized;

    public AvatarPoolStore(AvatarProperties avatarProperties,
                           PoolAvatarRepository poolAvatarRepository,
                           R2dbcEntityTemplate r2dbcEntityTemplate,
                           AvatarMapper avatarMapper,
                           List<AvatarRemovalListener> removalListeners) {
        this.poolDirectory = Paths.get(avatarProperties.getPoolDir()).toAbsolutePath().normalize();
        this.maxFileSize = avatarProperties.getMaxFileSize();
        this.poolAvatarRepository = poolAvatarRepository;
        this.r2dbcEntityTemplate = r2dbcEntityTemplate;
        this.avatarMapper = avatarMapper;
        this.removalListeners = List.copyOf(removalListeners);
    }

    /**
     * Создать директорию пула.
     */
    @PostConstruct
    public void init() {
        try {
            Files.createDirectories(poolDirectory);
            initialized = true;
            log.info("Директория пула аватаров: {}", poolDirectory);
        } catch (IOException e) {
            log.error("Не удалось создать директорию пула аватаров {}", poolDirectory, e);
            throw new AvatarStorageException("Не удалось инициализировать пул аватаров", e);
        }
    }

    public Path getPoolDirectory() {
        return poolDirectory;
    }

    /**
     * Добавить аватар в пул.
     *
     * @param originalFilename исходное имя загруженного файла
     * @param content          содержимое файла
     * @return созданная запись
     * @throws AvatarValidationException если файл не изображение, пустой или слишком большой
     * @throws AvatarStorageException    если не удалось записать файл или запись в таблицу
     */
    public AvatarInfo add(String originalFilename, byte[] content) {
        ensureInitialized();
        String extension = validate(originalFilename, content);

        String avatarId = UUID.randomUUID().toString();
        String storedFilename = avatarId + extension;
        Path filePath = poolDirectory.resolve(storedFilename);

        writeLock.lock();
        try {
            try {
                Files.write(filePath, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            } catch (IOException e) {
                deleteQuietly(filePath);
                log.error("Ошибка при сохранении аватара {} по пути {}", originalFilename, filePath, e);
                throw new AvatarStorageException("Ошибка при сохранении аватара: " + e.getMessage(), e);
            }

            AvatarInfo avatarInfo = AvatarInfo.builder()
                    .id(avatarId)
                    .name(ImageFileUtil.extractBaseName(originalFilename))
                    .storedFilename(storedFilename)
                    .createdAt(LocalDateTime.now().truncatedTo(ChronoUnit.MICROS))
                    .build();
            try {
                withRetry(r2dbcEntityTemplate.insert(avatarMapper.toPoolAvatar(avatarInfo))).block(BLOCK_TIMEOUT);
            } catch (RuntimeException e) {
                deleteQuietly(filePath);
                log.error("Ошибка при сохранении записи аватара {}", avatarId, e);
                throw new AvatarStorageException("Ошибка при сохранении записи аватара: " + e.getMessage(), e);
            }

            log.info("Аватар добавлен в пул: {} ({}), размер {} байт", avatarInfo.getName(), avatarId, content.length);
            return avatarInfo;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Удалить аватар из пула.
     * Изображения профиля, уже скопированные пользователям, не трогаются.
     *
     * @param avatarId ID аватара
     * @return false, если такого аватара нет
     * @throws AvatarStorageException если не удалось удалить файл или запись
     */
    public boolean remove(String avatarId) {
        ensureInitialized();
        writeLock.lock();
        try {
            AvatarInfo avatarInfo = find(avatarId).orElse(null);
            if (avatarInfo == null) {
                log.warn("Аватар не найден для удаления: {}", avatarId);
                return false;
            }

            Path filePath = poolDirectory.resolve(avatarInfo.getStoredFilename());
            try {
                if (Files.deleteIfExists(filePath)) {
                    log.info("Файл аватара удален: {}", filePath);
                } else {
                    log.warn("Файл аватара {} уже отсутствует, удаляем только запись", filePath);
                }
            } catch (IOException e) {
                log.error("Ошибка при удалении файла аватара: {}", filePath, e);
                throw new AvatarStorageException("Ошибка при удалении файла аватара: " + e.getMessage(), e);
            }

            try {
                withRetry(poolAvatarRepository.deleteById(avatarId)).block(BLOCK_TIMEOUT);
            } catch (RuntimeException e) {
                // запись без файла resolve уже не отдает, повторное удаление ее уберет
                log.error("Ошибка при удалении записи аватара {}", avatarId, e);
                throw new AvatarStorageException("Ошибка при удалении записи аватара: " + e.getMessage(), e);
            }
            log.info("Аватар удален из пула: {} ({})", avatarInfo.getName(), avatarId);

            notifyRemoved(avatarId);
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Получить путь к файлу аватара и его MIME-тип.
     *
     * @throws AvatarNotFoundException если записи нет или файл пропал с диска
     */
    public ResolvedAvatar resolve(String avatarId) {
        AvatarInfo avatarInfo = find(avatarId).orElseThrow(() -> new AvatarNotFoundException(avatarId));
        Path filePath = poolDirectory.resolve(avatarInfo.getStoredFilename());
        if (!Files.isRegularFile(filePath)) {
            log.warn("Запись аватара {} есть, но файл {} отсутствует", avatarId, filePath);
            throw new AvatarNotFoundException(avatarId);
        }
        return ResolvedAvatar.builder()
                .avatarId(avatarId)
                .filePath(filePath)
                .mimeType(ImageFileUtil.mimeTypeOf(avatarInfo.getStoredFilename()))
                .build();
    }

    public Optional<AvatarInfo> find(String avatarId) {
        ensureInitialized();
        if (avatarId == null) {
            return Optional.empty();
        }
        try {
            return withRetry(poolAvatarRepository.findById(avatarId))
                    .map(avatarMapper::toAvatarInfo)
                    .blockOptional(BLOCK_TIMEOUT);
        } catch (RuntimeException e) {
            log.error("Ошибка при чтении записи аватара {}", avatarId, e);
            throw new AvatarStorageException("Ошибка при чтении записи аватара: " + e.getMessage(), e);
        }
    }

    /**
     * Все аватары пула в порядке добавления.
     */
    public List<AvatarInfo> list() {
        ensureInitialized();
        try {
            List<AvatarInfo> avatars = withRetry(poolAvatarRepository.findAllInInsertionOrder()
                    .map(avatarMapper::toAvatarInfo)
                    .collectList())
                    .block(BLOCK_TIMEOUT);
            return avatars != null ? avatars : List.of();
        } catch (RuntimeException e) {
            log.error("Ошибка при чтении списка пула", e);
            throw new AvatarStorageException("Ошибка при чтении списка пула: " + e.getMessage(), e);
        }
    }

    private String validate(String originalFilename, byte[] content) {
        if (originalFilename == null || originalFilename.isBlank()) {
            throw new AvatarValidationException("Имя файла не может быть пустым");
        }

        String extension = ImageFileUtil.extractExtension(originalFilename);
        if (!ImageFileUtil.isAllowedExtension(extension)) {
            log.warn("Попытка загрузить аватар с недопустимым расширением: {}", originalFilename);
            throw new AvatarValidationException("Разрешены только изображения: JPG, JPEG, PNG, GIF, WEBP");
        }

        if (content == null || content.length == 0) {
            throw new AvatarValidationException("Файл не может быть пустым");
        }

        if (content.length > maxFileSize) {
            log.warn("Аватар {} слишком большой: {} байт", originalFilename, content.length);
            throw new AvatarValidationException("Файл слишком большой (максимум " + maxFileSize / (1024 * 1024) + "MB)");
        }
        return extension;
    }

    private void notifyRemoved(String avatarId) {
        for (AvatarRemovalListener listener : removalListeners) {
            try {
                listener.onAvatarRemoved(avatarId);
            } catch (RuntimeException e) {
                // привязки к удаленному аватару снимет сверка
                log.error("Ошибка при обработке удаления аватара {} в {}", avatarId, listener.getClass().getSimpleName(), e);
            }
        }
    }

    private void ensureInitialized() {
        if (!initialized) {
            log.error("Пул аватаров используется до инициализации");
            throw new AvatarInvariantException("Пул аватаров не инициализирован");
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Не удалось удалить частично записанный файл: {}", path, e);
        }
    }
}
