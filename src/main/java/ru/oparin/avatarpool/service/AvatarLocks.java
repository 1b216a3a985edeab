package ru.oparin.avatarpool.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Блокировки операций над аватарами.
 * <ul>
 *   <li>операции одного пользователя выполняются строго по очереди, разных пользователей - параллельно;</li>
 *   <li>сверка и очистка берут блокировку обслуживания эксклюзивно, остальные операции - совместно.</li>
 * </ul>
 * Все блокировки реентерабельны: сверка может вызывать привязку, уже владея эксклюзивной блокировкой.
 * Порядок захвата всегда: обслуживание, затем пользователь.
 * <p>
 * Блокировка пользователя живет, пока ее кто-то держит или ждет, и затем удаляется из таблицы.
 */
@Component
public class AvatarLocks {

    private final ReentrantReadWriteLock maintenanceLock = new ReentrantReadWriteLock();
    private final ConcurrentMap<Long, UserLock> userLocks = new ConcurrentHashMap<>();

    public <T> T withUserLock(Long userId, Supplier<T> action) {
        return withSharedAccess(() -> {
            UserLock userLock = acquire(userId);
            try {
                return locked(userLock.lock, action);
            } finally {
                release(userId);
            }
        });
    }

    public <T> T withSharedAccess(Supplier<T> action) {
        return locked(maintenanceLock.readLock(), action);
    }

    public <T> T withExclusiveAccess(Supplier<T> action) {
        return locked(maintenanceLock.writeLock(), action);
    }

    /**
     * Количество пользователей, чьи блокировки сейчас кем-то используются.
     */
    int activeUserLocks() {
        return userLocks.size();
    }

    private UserLock acquire(Long userId) {
        return userLocks.compute(userId, (id, existing) -> {
            UserLock userLock = existing != null ? existing : new UserLock();
            userLock.users++;
            return userLock;
        });
    }

    private void release(Long userId) {
        userLocks.computeIfPresent(userId, (id, userLock) -> --userLock.users == 0 ? null : userLock);
    }

    private static <T> T locked(Lock lock, Supplier<T> action) {
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Операция отменена в ожидании блокировки");
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Блокировка пользователя и число потоков, которые ее держат или ждут.
     * Счетчик меняется только внутри compute по ключу пользователя.
     */
    private static final class UserLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
