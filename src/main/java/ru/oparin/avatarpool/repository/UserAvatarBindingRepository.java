package ru.oparin.avatarpool.repository;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.avatarpool.model.entity.UserAvatarBinding;

import java.util.Collection;

@Repository
public interface UserAvatarBindingRepository extends R2dbcRepository<UserAvatarBinding, Long> {

    @Query("SELECT * FROM avatarpool.avatar_binding ORDER BY user_id")
    Flux<UserAvatarBinding> findAllOrderByUserId();

    @Modifying
    @Query("DELETE FROM avatarpool.avatar_binding WHERE avatar_id = :avatarId")
    Mono<Long> deleteByAvatarId(String avatarId);

    @Modifying
    @Query("DELETE FROM avatarpool.avatar_binding WHERE user_id IN (:userIds)")
    Mono<Long> deleteByUserIdIn(Collection<Long> userIds);
}
