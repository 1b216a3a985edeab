package ru.oparin.avatarpool.support;

import reactor.core.Exceptions;
import ru.oparin.avatarpool.model.entity.User;
import ru.oparin.avatarpool.service.UserDirectory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory identity collaborator. Returns copies, so a caller sees its own changes
 * only after {@link #persistUser(User)} succeeds.
 */
public class InMemoryUserDirectory implements UserDirectory {

    private final Map<Long, User> users = new ConcurrentHashMap<>();
    private final AtomicInteger failingPersists = new AtomicInteger();
    private final AtomicBoolean interruptNextPersist = new AtomicBoolean();

    public User addUser(Long id, String username) {
        User user = User.builder().id(id).username(username).build();
        users.put(id, copy(user));
        return user;
    }

    public void setProfileImagePath(Long id, String path) {
        users.get(id).setProfileImagePath(path);
    }

    public String profileImagePath(Long id) {
        return users.get(id).getProfileImagePath();
    }

    public void removeUser(Long id) {
        users.remove(id);
    }

    /**
     * The next {@code count} calls to {@link #persistUser(User)} fail.
     */
    public void failNextPersists(int count) {
        failingPersists.set(count);
    }

    /**
     * The next {@link #persistUser(User)} behaves like a blocking database call on a thread
     * whose subscription was cancelled: it interrupts the caller and fails.
     */
    public void interruptNextPersist() {
        interruptNextPersist.set(true);
    }

    @Override
    public Optional<User> getUser(Long userId) {
        return Optional.ofNullable(users.get(userId)).map(InMemoryUserDirectory::copy);
    }

    @Override
    public List<User> listUsers() {
        List<User> result = new ArrayList<>();
        users.values().forEach(user -> result.add(copy(user)));
        return result;
    }

    @Override
    public void persistUser(User user) {
        if (interruptNextPersist.getAndSet(false)) {
            Thread.currentThread().interrupt();
            throw Exceptions.propagate(new InterruptedException());
        }
        if (failingPersists.getAndUpdate(left -> Math.max(0, left - 1)) > 0) {
            throw new IllegalStateException("Database is unavailable");
        }
        users.put(user.getId(), copy(user));
    }

    private static User copy(User user) {
        return User.builder()
                .id(user.getId())
                .username(user.getUsername())
                .profileImagePath(user.getProfileImagePath())
                .createdAt(user.getCreatedAt())
                .updatedAt(user.getUpdatedAt())
                .build();
    }
}
