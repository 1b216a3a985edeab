package ru.oparin.avatarpool.model.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Привязка аватара из пула к пользователю.
 */
@Table(value = "avatar_binding", schema = "avatarpool")
@Getter
@Setter
@EqualsAndHashCode
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserAvatarBinding {

    /**
     * Идентификатор пользователя.
     * Используется как первичный ключ: у пользователя не больше одной привязки.
     */
    @Id
    private Long userId;

    /**
     * ID аватара в пуле. Внешним ключом не является: аватар может быть удален раньше привязки.
     */
    private String avatarId;

    private LocalDateTime updatedAt;
}
