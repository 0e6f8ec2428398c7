package com.examify.common.constants;

import java.util.Locale;
import java.util.Set;

public final class FileTypes {
    public static final Set<String> MATERIAL_EXTENSIONS = Set.of(
        "pdf", "docx", "pptx", "txt", "md"
    );

    public static final Set<String> PDF_TYPES = Set.of("pdf");
    public static final Set<String> WORD_TYPES = Set.of("docx");
    public static final Set<String> PRESENTATION_TYPES = Set.of("pptx");
    public static final Set<String> TEXT_TYPES = Set.of("txt", "md");
    public static final Set<String> IMAGE_TYPES = Set.of("png", "jpg", "jpeg", "bmp", "tif", "tiff");

    public static final long MAX_MATERIAL_SIZE_BYTES = 50 * 1024 * 1024; // 50MB
    public static final long MAX_IMAGE_SIZE_BYTES = 10 * 1024 * 1024;

    private FileTypes() {}

    public static boolean isMaterial(String extension) {
        return extension != null && MATERIAL_EXTENSIONS.contains(extension.toLowerCase(Locale.ROOT));
    }

    public static boolean isImage(String extension) {
        return extension != null && IMAGE_TYPES.contains(extension.toLowerCase(Locale.ROOT));
    }
}
