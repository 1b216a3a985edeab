package ru.oparin.avatarpool.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.avatarpool.model.entity.User;
import ru.oparin.avatarpool.repository.UserRepository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class R2dbcUserDirectoryTest {

    @Mock
    private UserRepository userRepository;

    @InjectMocks
    private R2dbcUserDirectory userDirectory;

    @Test
    void getUser_WhenFound_ReturnsUser() {
        User user = User.builder().id(1L).username("alice").build();
        when(userRepository.findById(1L)).thenReturn(Mono.just(user));

        assertThat(userDirectory.getUser(1L)).contains(user);
    }

    @Test
    void getUser_WhenMissing_ReturnsEmpty() {
        when(userRepository.findById(2L)).thenReturn(Mono.empty());

        assertThat(userDirectory.getUser(2L)).isEmpty();
    }

    @Test
    void getUser_WhenIdNull_DoesNotQuery() {
        assertThat(userDirectory.getUser(null)).isEmpty();
        verifyNoInteractions(userRepository);
    }

    @Test
    void listUsers_CollectsAllUsers() {
        User alice = User.builder().id(1L).username("alice").build();
        User bob = User.builder().id(2L).username("bob").build();
        when(userRepository.findAll()).thenReturn(Flux.just(alice, bob));

        assertThat(userDirectory.listUsers()).containsExactly(alice, bob);
    }

    @Test
    void persistUser_SavesUser() {
        User user = User.builder().id(1L).username("alice").profileImagePath("/data/users/1/profile_avatar_a_1.png").build();
        when(userRepository.save(any(User.class))).thenReturn(Mono.just(user));

        userDirectory.persistUser(user);

        verify(userRepository).save(user);
    }
}
