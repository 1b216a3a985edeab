package ru.oparin.avatarpool.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.oparin.avatarpool.model.entity.User;
import ru.oparin.avatarpool.repository.UserRepository;

import java.util.List;
import java.util.Optional;

import static ru.oparin.avatarpool.config.DatabaseConfig.BLOCK_TIMEOUT;
import static ru.oparin.avatarpool.config.DatabaseConfig.withRetry;

/**
 * Доступ к пользователям через R2DBC.
 * Ядро аватаров работает синхронно, поэтому здесь реактивные вызовы дожидаются результата.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class R2dbcUserDirectory implements UserDirectory {

    private final UserRepository userRepository;

    @Override
    public Optional<User> getUser(Long userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return withRetry(userRepository.findById(userId)).blockOptional(BLOCK_TIMEOUT);
    }

    @Override
    public List<User> listUsers() {
        List<User> users = withRetry(userRepository.findAll().collectList()).block(BLOCK_TIMEOUT);
        return users != null ? users : List.of();
    }

    @Override
    public void persistUser(User user) {
        withRetry(userRepository.save(user)).block(BLOCK_TIMEOUT);
        log.debug("Пользователь {} сохранен, изображение профиля: {}", user.getId(), user.getProfileImagePath());
    }
}
