package ru.oparin.avatarpool.config;

import io.r2dbc.spi.R2dbcTransientException;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.r2dbc.config.EnableR2dbcAuditing;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;

@Configuration
@EnableR2dbcAuditing
public class DatabaseConfig {

    /**
     * Сколько синхронный код ждет ответа базы, включая повторы.
     */
    public static final Duration BLOCK_TIMEOUT = Duration.ofSeconds(30);

    /**
     * Обертка для Mono с retry логикой при потере связи с БД
     */
    public static <T> Mono<T> withRetry(Mono<T> mono) {
        return mono.retryWhen(Retry.backoff(3, Duration.ofSeconds(1))
                .maxBackoff(Duration.ofSeconds(5))
                .jitter(0.1)
                .filter(DatabaseConfig::isConnectionFailure));
    }

    private static boolean isConnectionFailure(Throwable error) {
        return error instanceof R2dbcTransientException
                || error instanceof TransientDataAccessException
                || error instanceof DataAccessResourceFailureException;
    }
}
