package ru.oparin.avatarpool.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

@Data
@Builder
@AllArgsConstructor
public class ResolvedAvatar {
    private String avatarId;
    private Path filePath;
    private String mimeType;
}
