package ru.oparin.avatarpool.mapper;

import org.springframework.stereotype.Component;
import ru.oparin.avatarpool.model.dto.AvatarBinding;
import ru.oparin.avatarpool.model.dto.AvatarInfo;
import ru.oparin.avatarpool.model.entity.PoolAvatar;
import ru.oparin.avatarpool.model.entity.UserAvatarBinding;

/**
 * Преобразование сущностей пула и привязок в DTO.
 */
@Component
public class AvatarMapper {

    public AvatarInfo toAvatarInfo(PoolAvatar avatar) {
        if (avatar == null) {
            return null;
        }
        return AvatarInfo.builder()
                .id(avatar.getId())
                .name(avatar.getName())
                .storedFilename(avatar.getStoredFilename())
                .createdAt(avatar.getCreatedAt())
                .build();
    }

    public PoolAvatar toPoolAvatar(AvatarInfo avatarInfo) {
        return PoolAvatar.builder()
                .id(avatarInfo.getId())
                .name(avatarInfo.getName())
                .storedFilename(avatarInfo.getStoredFilename())
                .createdAt(avatarInfo.getCreatedAt())
                .build();
    }

    public AvatarBinding toAvatarBinding(UserAvatarBinding binding) {
        if (binding == null) {
            return null;
        }
        return new AvatarBinding(binding.getUserId(), binding.getAvatarId());
    }
}
