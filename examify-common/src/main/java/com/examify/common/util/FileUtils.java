package com.examify.common.util;

import com.examify.common.constants.FileTypes;

import java.util.Locale;

public final class FileUtils {

    private FileUtils() {}

    public static String getFileExtension(String filename) {
        if (filename == null || filename.isEmpty()) {
            return "";
        }
        int lastDot = filename.lastIndexOf('.');
        if (lastDot == -1 || lastDot == filename.length() - 1) {
            return "";
        }
        return filename.substring(lastDot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * Checks that an uploaded study material has a parseable extension and fits the size limit.
     */
    public static boolean isValidMaterial(String filename, long fileSizeBytes) {
        if (filename == null || filename.isBlank() || fileSizeBytes <= 0) {
            return false;
        }
        return FileTypes.isMaterial(getFileExtension(filename))
            && fileSizeBytes <= FileTypes.MAX_MATERIAL_SIZE_BYTES;
    }

    public static boolean isValidImage(String filename, long fileSizeBytes) {
        if (filename == null || filename.isBlank() || fileSizeBytes <= 0) {
            return false;
        }
        return FileTypes.isImage(getFileExtension(filename))
            && fileSizeBytes <= FileTypes.MAX_IMAGE_SIZE_BYTES;
    }

    public static String sanitizeFileName(String filename) {
        if (filename == null || filename.isBlank()) {
            return "unnamed";
        }
        return filename.replaceAll("[^a-zA-Z0-9._-]", "_");
    }

    /**
     * File name without its extension, used as the default material title.
     */
    public static String baseName(String filename) {
        if (filename == null || filename.isBlank()) {
            return "Untitled";
        }
        int lastDot = filename.lastIndexOf('.');
        return lastDot > 0 ? filename.substring(0, lastDot) : filename;
    }
}
