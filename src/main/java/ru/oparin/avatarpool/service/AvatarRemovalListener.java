package ru.oparin.avatarpool.service;

/**
 * Получает уведомление после удаления аватара из пула.
 */
@FunctionalInterface
public interface AvatarRemovalListener {

    void onAvatarRemoved(String avatarId);
}
