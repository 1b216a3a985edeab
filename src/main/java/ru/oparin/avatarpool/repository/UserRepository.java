package ru.oparin.avatarpool.repository;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import ru.oparin.avatarpool.model.entity.User;

public interface UserRepository extends ReactiveCrudRepository<User, Long> {
}
