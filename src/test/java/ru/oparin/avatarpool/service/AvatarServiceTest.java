package ru.oparin.avatarpool.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;
import ru.oparin.avatarpool.exception.AvatarNotFoundException;
import ru.oparin.avatarpool.exception.AvatarValidationException;
import ru.oparin.avatarpool.exception.UserNotFoundException;
import ru.oparin.avatarpool.model.dto.AvatarInfo;
import ru.oparin.avatarpool.model.dto.ProfileImage;
import ru.oparin.avatarpool.support.AvatarTestContext;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class AvatarServiceTest {

    private static final byte[] IMAGE = "image".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path tempDir;

    private AvatarTestContext context;
    private AvatarService service;

    @BeforeEach
    void setUp() {
        context = new AvatarTestContext(tempDir);
        context.userDirectory.addUser(1L, "alice");
        context.userDirectory.addUser(2L, "bob");
        service = context.avatarService;
    }

    @Test
    void addAndListAvatars_PreservesInsertionOrder() {
        AvatarInfo first = service.addAvatar("a.png", IMAGE).block();
        AvatarInfo second = service.addAvatar("b.png", IMAGE).block();

        StepVerifier.create(service.listAvatars())
                .expectNext(first, second)
                .verifyComplete();
    }

    @Test
    void addAvatar_WhenInvalid_EmitsValidationError() {
        StepVerifier.create(service.addAvatar("notes.txt", IMAGE))
                .expectError(AvatarValidationException.class)
                .verify();
    }

    @Test
    void bindThenGetBinding_ReturnsAvatar() {
        AvatarInfo avatar = service.addAvatar("a.png", IMAGE).block();

        StepVerifier.create(service.bind(1L, avatar.getId()).then(service.getBinding(1L)))
                .expectNext(avatar.getId())
                .verifyComplete();
    }

    @Test
    void getBinding_WhenAbsent_CompletesEmpty() {
        StepVerifier.create(service.getBinding(1L)).verifyComplete();
    }

    @Test
    void bind_WhenUserUnknown_EmitsNotFound() {
        AvatarInfo avatar = service.addAvatar("a.png", IMAGE).block();

        StepVerifier.create(service.bind(99L, avatar.getId()))
                .expectError(UserNotFoundException.class)
                .verify();
    }

    @Test
    void unbind_ClearsBinding() {
        AvatarInfo avatar = service.addAvatar("a.png", IMAGE).block();
        service.bind(1L, avatar.getId()).block();

        StepVerifier.create(service.unbind(1L).then(service.getBinding(1L)))
                .verifyComplete();
    }

    @Test
    void removeAvatar_ClearsBindingsButKeepsProfileImages() throws IOException {
        AvatarInfo removed = service.addAvatar("a.png", IMAGE).block();
        AvatarInfo kept = service.addAvatar("b.png", IMAGE).block();
        ProfileImage aliceImage = service.bind(1L, removed.getId()).block();
        ProfileImage bobImage = service.bind(2L, kept.getId()).block();

        StepVerifier.create(service.removeAvatar(removed.getId()))
                .expectNext(true)
                .verifyComplete();

        assertThat(context.bindingStore.get(1L)).isEmpty();
        assertThat(context.bindingStore.get(2L)).hasValue(kept.getId());
        assertThat(aliceImage.getPath()).exists();
        assertThat(context.userDirectory.profileImagePath(1L)).isEqualTo(aliceImage.getPath().toString());
        assertThat(Files.readAllBytes(bobImage.getPath())).isEqualTo(IMAGE);
        StepVerifier.create(service.resolve(removed.getId()))
                .expectError(AvatarNotFoundException.class)
                .verify();
    }

    @Test
    void removeAvatar_WhenUnknown_EmitsFalse() {
        StepVerifier.create(service.removeAvatar("missing"))
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    void resolveUserAvatar_ReturnsBoundPoolFile() {
        AvatarInfo avatar = service.addAvatar("a.webp", IMAGE).block();
        service.bind(1L, avatar.getId()).block();

        StepVerifier.create(service.resolveUserAvatar(1L))
                .assertNext(resolved -> {
                    assertThat(resolved.getAvatarId()).isEqualTo(avatar.getId());
                    assertThat(resolved.getMimeType()).isEqualTo("image/webp");
                })
                .verifyComplete();
    }

    @Test
    void resolveUserAvatar_WhenNoBinding_CompletesEmpty() {
        StepVerifier.create(service.resolveUserAvatar(2L)).verifyComplete();
    }

    @Test
    void validateAndCollectOrphans_RunOnDemand() {
        AvatarInfo avatar = service.addAvatar("a.png", IMAGE).block();
        service.bind(1L, avatar.getId()).block();
        context.bindingStore.set(2L, "gone");

        StepVerifier.create(service.validate())
                .assertNext(report -> {
                    assertThat(report.getRepairedCount()).isZero();
                    assertThat(report.getRemovedCount()).isEqualTo(1);
                })
                .verifyComplete();
        StepVerifier.create(service.collectOrphans())
                .expectNext(0)
                .verifyComplete();
    }
}
