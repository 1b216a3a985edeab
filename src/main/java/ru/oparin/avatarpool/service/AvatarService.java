package ru.oparin.avatarpool.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import ru.oparin.avatarpool.exception.AvatarNotFoundException;
import ru.oparin.avatarpool.model.dto.AvatarInfo;
import ru.oparin.avatarpool.model.dto.ProfileImage;
import ru.oparin.avatarpool.model.dto.ReconciliationReport;
import ru.oparin.avatarpool.model.dto.ResolvedAvatar;

import java.util.concurrent.Callable;

/**
 * Реактивный фасад над хранилищами аватаров.
 * <p>
 * Все операции блокирующие (файлы, блокировки, ожидание базы), поэтому выполняются
 * на boundedElastic. Отмена подписки прерывает поток: копирование и обход директорий
 * это замечают и останавливаются.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvatarService {

    private final AvatarPoolStore avatarPoolStore;
    private final AvatarBindingStore avatarBindingStore;
    private final ProfileImageBinder profileImageBinder;
    private final AvatarReconciliationService avatarReconciliationService;
    private final AvatarLocks avatarLocks;

    public Flux<AvatarInfo> listAvatars() {
        return blocking(avatarPoolStore::list).flatMapMany(Flux::fromIterable);
    }

    /**
     * Загрузить новый аватар в пул.
     *
     * @param originalFilename исходное имя файла
     * @param content          содержимое файла
     * @return Mono с записью о созданном аватаре
     */
    public Mono<AvatarInfo> addAvatar(String originalFilename, byte[] content) {
        return blocking(() -> avatarPoolStore.add(originalFilename, content));
    }

    /**
     * Удалить аватар из пула. Привязки к нему снимаются,
     * изображения профиля пользователей остаются.
     *
     * @return Mono с false, если аватара не было
     */
    public Mono<Boolean> removeAvatar(String avatarId) {
        return blocking(() -> avatarLocks.withSharedAccess(() -> avatarPoolStore.remove(avatarId)));
    }

    public Mono<ResolvedAvatar> resolve(String avatarId) {
        return blocking(() -> avatarPoolStore.resolve(avatarId));
    }

    public Mono<ProfileImage> bind(Long userId, String avatarId) {
        return blocking(() -> profileImageBinder.bind(userId, avatarId));
    }

    public Mono<Void> unbind(Long userId) {
        return blocking(() -> {
            profileImageBinder.unbind(userId);
            return null;
        }).then();
    }

    /**
     * ID аватара, привязанного к пользователю.
     *
     * @return Mono с ID аватара или пустой Mono, если привязки нет
     */
    public Mono<String> getBinding(Long userId) {
        return blocking(() -> avatarBindingStore.get(userId).orElse(null));
    }

    /**
     * Файл аватара из пула, привязанного к пользователю.
     *
     * @return Mono с файлом аватара или пустой Mono, если привязки нет;
     * ошибка {@link AvatarNotFoundException}, если аватар уже удален из пула
     */
    public Mono<ResolvedAvatar> resolveUserAvatar(Long userId) {
        return getBinding(userId)
                .flatMap(this::resolve)
                .doOnError(AvatarNotFoundException.class,
                        e -> log.warn("Привязанный аватар пользователя {} недоступен: {}", userId, e.getMessage()));
    }

    public Mono<ReconciliationReport> validate() {
        return blocking(avatarReconciliationService::validate);
    }

    public Mono<Integer> collectOrphans() {
        return blocking(avatarReconciliationService::collectOrphans);
    }

    private static <T> Mono<T> blocking(Callable<T> action) {
        return Mono.fromCallable(action).subscribeOn(Schedulers.boundedElastic());
    }
}
