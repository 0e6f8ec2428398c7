package com.examify.core.storage;

import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.UUID;

/**
 * Where uploaded study material files live. Returns an opaque reference that is stored on the
 * material and handed back to {@link #open} by the ingestion worker.
 */
public interface FileStorageService {

    String store(MultipartFile file, UUID materialId) throws IOException;

    InputStream open(String fileReference) throws IOException;

    void delete(String fileReference) throws IOException;
}
