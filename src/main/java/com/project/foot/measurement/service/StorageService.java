package com.project.foot.measurement.service;

import com.project.foot.measurement.exceptions.StorageException;
import com.project.foot.measurement.pipeline.ImageEncoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.UUID;

@Service
public class StorageService {
    private static final Logger log = LoggerFactory.getLogger(StorageService.class);
    private final Path rootDir;
    public StorageService(@Value("${app.upload.dir:uploads}") String root) {
        this.rootDir = Paths.get(root).toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.rootDir);
            log.info("Using upload directory: {}", this.rootDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create upload directory: " + rootDir, e);
        }
    }
    public record StoredFile(Path path, String filename) {}
    public StoredFile store(byte[] imageBytes, ImageEncoding encoding) {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new StorageException("Empty upload");
        }
        String filename = "captured_image_" + UUID.randomUUID().toString().replace("-", "")
                + "." + encoding.fileExtension();
        Path target = rootDir.resolve(filename);
        try {
            Files.write(target, imageBytes, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new StorageException("Failed to store image " + filename, e);
        }
        // Verify the write actually landed before measuring.
        if (!Files.isRegularFile(target)) {
            throw new StorageException("Stored image is missing: " + target);
        }
        log.info("Image saved to {}", target);
        return new StoredFile(target, filename);
    }

    public Path getRootDir() {
        return rootDir;
    }
}
