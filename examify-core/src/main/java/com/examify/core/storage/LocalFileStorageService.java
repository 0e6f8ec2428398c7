package com.examify.core.storage;

import com.examify.common.util.FileUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

@Service
@Slf4j
public class LocalFileStorageService implements FileStorageService {

    private final Path root;

    public LocalFileStorageService(@Value("${examify.storage.directory:./uploads}") String storageDirectory) {
        this.root = Paths.get(storageDirectory).toAbsolutePath().normalize();
    }

    @Override
    public String store(MultipartFile file, UUID materialId) throws IOException {
        Files.createDirectories(root);

        String extension = FileUtils.getFileExtension(file.getOriginalFilename());
        String fileName = materialId + (extension.isEmpty() ? "" : "." + extension);
        Path target = root.resolve(fileName);

        try (InputStream in = file.getInputStream()) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
        if (Files.size(target) == 0) {
            Files.deleteIfExists(target);
            throw new IOException("Stored file is empty: " + target);
        }

        log.info("[STORAGE] Saved file | materialId={} | path={} | sizeBytes={}", materialId, target, Files.size(target));
        return fileName;
    }

    @Override
    public InputStream open(String fileReference) throws IOException {
        Path path = resolve(fileReference);
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString());
        }
        return Files.newInputStream(path);
    }

    @Override
    public void delete(String fileReference) throws IOException {
        if (Files.deleteIfExists(resolve(fileReference))) {
            log.info("[STORAGE] Deleted file | reference={}", fileReference);
        }
    }

    private Path resolve(String fileReference) throws IOException {
        Path path = root.resolve(fileReference).normalize();
        if (!path.startsWith(root)) {
            throw new IOException("File reference escapes storage directory: " + fileReference);
        }
        return path;
    }
}
