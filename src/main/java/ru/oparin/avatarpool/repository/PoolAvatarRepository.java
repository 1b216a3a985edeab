package ru.oparin.avatarpool.repository;

import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import ru.oparin.avatarpool.model.entity.PoolAvatar;

@Repository
public interface PoolAvatarRepository extends R2dbcRepository<PoolAvatar, String> {

    @Query("SELECT * FROM avatarpool.avatar ORDER BY created_at, id")
    Flux<PoolAvatar> findAllInInsertionOrder();
}
