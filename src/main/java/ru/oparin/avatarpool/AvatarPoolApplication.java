package ru.oparin.avatarpool;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableR2dbcRepositories(basePackages = "ru.oparin.avatarpool.repository")
@EnableScheduling
@SpringBootApplication
public class AvatarPoolApplication {

    public static void main(String[] args) {
        SpringApplication.run(AvatarPoolApplication.class, args);
    }
}
