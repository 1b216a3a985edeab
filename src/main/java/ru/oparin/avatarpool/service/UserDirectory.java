package ru.oparin.avatarpool.service;

import ru.oparin.avatarpool.model.entity.User;

import java.util.List;
import java.util.Optional;

/**
 * Подсистема учетных записей, которой принадлежит указатель на изображение профиля.
 * Вызовы блокирующие и выполняются на потоках boundedElastic.
 */
public interface UserDirectory {

    Optional<User> getUser(Long userId);

    List<User> listUsers();

    /**
     * Сохранить пользователя вместе с путем к изображению профиля.
     *
     * @throws RuntimeException если сохранить не удалось
     */
    void persistUser(User user);
}
