package ru.oparin.avatarpool.util;

import lombok.experimental.UtilityClass;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Утилиты для имен файлов изображений: расширения и MIME-типы.
 */
@UtilityClass
public class ImageFileUtil {

    public static final String DEFAULT_MIME_TYPE = "application/octet-stream";

    /**
     * Разрешенные расширения для изображений
     */
    public static final Set<String> ALLOWED_EXTENSIONS = Set.of(".jpg", ".jpeg", ".png", ".gif", ".webp");

    private static final Map<String, String> MIME_TYPES = Map.of(
            ".jpg", "image/jpeg",
            ".jpeg", "image/jpeg",
            ".png", "image/png",
            ".gif", "image/gif",
            ".webp", "image/webp"
    );

    /**
     * Получить расширение файла в нижнем регистре вместе с точкой.
     *
     * @param filename имя файла
     * @return расширение, например ".png", или пустая строка если расширения нет
     */
    public static String extractExtension(String filename) {
        if (filename == null) {
            return "";
        }
        String name = stripDirectories(filename);
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }

    /**
     * Получить имя файла без директорий и расширения.
     */
    public static String extractBaseName(String filename) {
        if (filename == null) {
            return "";
        }
        String name = stripDirectories(filename);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public static boolean isAllowedExtension(String extension) {
        return extension != null && ALLOWED_EXTENSIONS.contains(extension.toLowerCase(Locale.ROOT));
    }

    /**
     * Определить MIME-тип по расширению файла.
     * Для неизвестных расширений возвращается application/octet-stream.
     */
    public static String mimeTypeOf(String filename) {
        return MIME_TYPES.getOrDefault(extractExtension(filename), DEFAULT_MIME_TYPE);
    }

    private static String stripDirectories(String filename) {
        String normalized = filename.replace("\\", "/");
        return normalized.substring(normalized.lastIndexOf('/') + 1);
    }
}
