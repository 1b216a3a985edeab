package ru.oparin.avatarpool.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.oparin.avatarpool.support.AvatarTestContext;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ProfileImageNamingTest {

    @TempDir
    Path tempDir;

    private ProfileImageNaming naming;

    @BeforeEach
    void setUp() {
        naming = new ProfileImageNaming(AvatarTestContext.properties(tempDir));
    }

    @Test
    void nextToken_IsStrictlyIncreasing() {
        long previous = naming.nextToken();
        for (int i = 0; i < 1000; i++) {
            long next = naming.nextToken();
            assertThat(next).isGreaterThan(previous);
            previous = next;
        }
    }

    @Test
    void newProfileImagePath_UsesProfileAvatarPatternInUserDirectory() {
        Path path = naming.newProfileImagePath(7L, "abc", ".png", null);

        assertThat(path.getParent()).isEqualTo(naming.userDirectory(7L));
        assertThat(path.getFileName().toString()).matches("profile_avatar_abc_\\d+\\.png");
        assertThat(naming.isProfileImageFile(path)).isTrue();
    }

    @Test
    void newProfileImagePath_NeverRepeats() {
        Set<Path> paths = new HashSet<>();
        String previous = null;
        for (int i = 0; i < 100; i++) {
            Path path = naming.newProfileImagePath(1L, "same", ".jpg", previous);
            assertThat(path.toString()).isNotEqualTo(previous);
            paths.add(path);
            previous = path.toString();
        }
        assertThat(paths).hasSize(100);
    }

    @Test
    void isInsideUserDirectory_RejectsOtherDirectories() {
        Path userDirectory = naming.userDirectory(1L);

        assertThat(naming.isInsideUserDirectory(1L, userDirectory.resolve("profile_x.png"))).isTrue();
        assertThat(naming.isInsideUserDirectory(1L, userDirectory.resolve("../2/profile_x.png"))).isFalse();
        assertThat(naming.isInsideUserDirectory(1L, userDirectory.resolve("nested/profile_x.png"))).isFalse();
        assertThat(naming.isInsideUserDirectory(2L, userDirectory.resolve("profile_x.png"))).isFalse();
    }

    @Test
    void isProfileImageFile_MatchesPrefixOnly() {
        assertThat(naming.isProfileImageFile(Path.of("profile_custom.png"))).isTrue();
        assertThat(naming.isProfileImageFile(Path.of("avatar.png"))).isFalse();
    }
}
