package ru.oparin.avatarpool.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.relational.core.query.Criteria;
import org.springframework.data.relational.core.query.Query;
import org.springframework.data.relational.core.query.Update;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.avatarpool.exception.AvatarStorageException;
import ru.oparin.avatarpool.mapper.AvatarMapper;
import ru.oparin.avatarpool.model.dto.AvatarBinding;
import ru.oparin.avatarpool.model.entity.UserAvatarBinding;
import ru.oparin.avatarpool.repository.UserAvatarBindingRepository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static ru.oparin.avatarpool.config.DatabaseConfig.BLOCK_TIMEOUT;
import static ru.oparin.avatarpool.config.DatabaseConfig.withRetry;

/**
 * Хранилище привязок пользователь → аватар в таблице {@code avatar_binding}.
 * <p>
 * На каждого пользователя не более одной привязки (первичный ключ - userId).
 * Каждый метод возвращается только после того, как изменение записано в базу.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvatarBindingStore implements AvatarRemovalListener {

    private final UserAvatarBindingRepository userAvatarBindingRepository;
    private final R2dbcEntityTemplate r2dbcEntityTemplate;
    private final AvatarMapper avatarMapper;

    public Optional<String> get(Long userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return execute("чтении привязки пользователя " + userId,
                userAvatarBindingRepository.findById(userId).map(UserAvatarBinding::getAvatarId));
    }

    /**
     * Привязать аватар к пользователю, заменив прежнюю привязку.
     */
    public void set(Long userId, String avatarId) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(avatarId, "avatarId");
        LocalDateTime now = LocalDateTime.now();

        // Сначала пытаемся обновить существующую запись
        Mono<Long> upsert = r2dbcEntityTemplate.update(UserAvatarBinding.class)
                .matching(Query.query(Criteria.where("userId").is(userId)))
                .apply(Update.update("avatarId", avatarId).set("updatedAt", now))
                .flatMap(rowsUpdated -> {
                    if (rowsUpdated > 0) {
                        return Mono.just(rowsUpdated);
                    }
                    UserAvatarBinding binding = UserAvatarBinding.builder()
                            .userId(userId)
                            .avatarId(avatarId)
                            .updatedAt(now)
                            .build();
                    return r2dbcEntityTemplate.insert(UserAvatarBinding.class)
                            .using(binding)
                            .thenReturn(1L);
                });
        execute("сохранении привязки пользователя " + userId, upsert);
        log.info("Пользователю {} привязан аватар {}", userId, avatarId);
    }

    public void clear(Long userId) {
        execute("снятии привязки пользователя " + userId,
                userAvatarBindingRepository.deleteById(userId).thenReturn(true));
        log.info("Привязка аватара пользователя {} снята", userId);
    }

    /**
     * Снять все привязки к аватару.
     *
     * @return количество снятых привязок
     */
    public int clearAllFor(String avatarId) {
        int removed = toCount(execute("снятии привязок к аватару " + avatarId,
                userAvatarBindingRepository.deleteByAvatarId(avatarId)));
        if (removed > 0) {
            log.info("Снято привязок к аватару {}: {}", avatarId, removed);
        }
        return removed;
    }

    /**
     * Удалить привязки нескольких пользователей одним запросом.
     *
     * @return количество удаленных привязок
     */
    public int removeAll(Collection<Long> userIds) {
        if (userIds.isEmpty()) {
            return 0;
        }
        return toCount(execute("удалении привязок аватаров",
                userAvatarBindingRepository.deleteByUserIdIn(userIds)));
    }

    public List<AvatarBinding> list() {
        return execute("чтении привязок аватаров",
                userAvatarBindingRepository.findAllOrderByUserId()
                        .map(avatarMapper::toAvatarBinding)
                        .collectList())
                .orElse(List.of());
    }

    @Override
    public void onAvatarRemoved(String avatarId) {
        int cleared = clearAllFor(avatarId);
        if (cleared > 0) {
            log.warn("Аватар {} удален из пула, у {} пользователя(ей) снята привязка. " +
                    "Их изображения профиля остаются без изменений", avatarId, cleared);
        }
    }

    private <T> Optional<T> execute(String action, Mono<T> operation) {
        try {
            return withRetry(operation).blockOptional(BLOCK_TIMEOUT);
        } catch (RuntimeException e) {
            log.error("Ошибка при {}", action, e);
            throw new AvatarStorageException("Ошибка при " + action + ": " + e.getMessage(), e);
        }
    }

    private static int toCount(Optional<Long> rows) {
        return rows.map(Long::intValue).orElse(0);
    }
}
