package com.rambopet.clinic_backend.util;

import com.rambopet.clinic_backend.exception.ApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

@Slf4j
public class FileUploadUtil {

    private FileUploadUtil() {
        // Utility class, no instantiation
    }

    /**
     * Stores the file under {@code baseDir/subDirectory} with a random name and returns the path relative to
     * {@code baseDir}.
     */
    public static String saveFile(String baseDir, MultipartFile file, String subDirectory) {
        if (file == null || file.isEmpty()) {
            throw new ApiException("File is empty", HttpStatus.BAD_REQUEST, "EMPTY_FILE");
        }
        if (!isValidFileSize(file, Constants.MAX_FILE_SIZE_MB)) {
            throw new ApiException("File exceeds " + Constants.MAX_FILE_SIZE_MB + "MB", HttpStatus.BAD_REQUEST,
                    "FILE_TOO_LARGE");
        }

        try {
            Path uploadPath = Paths.get(baseDir, subDirectory);
            Files.createDirectories(uploadPath);

            String uniqueFilename = UUID.randomUUID() + getFileExtension(file.getOriginalFilename());
            Path filePath = uploadPath.resolve(uniqueFilename);
            try (InputStream in = file.getInputStream()) {
                Files.copy(in, filePath, StandardCopyOption.REPLACE_EXISTING);
            }

            log.debug("Stored upload {} as {}", file.getOriginalFilename(), filePath);
            return subDirectory + "/" + uniqueFilename;

        } catch (IOException e) {
            log.error("Failed to save file: {}", e.getMessage(), e);
            throw new ApiException("Failed to save file", HttpStatus.INTERNAL_SERVER_ERROR);
        }
    }

    public static void deleteFile(String baseDir, String filePath) {
        if (filePath == null) {
            return;
        }
        try {
            Path path = Paths.get(baseDir, filePath);
            if (Files.deleteIfExists(path)) {
                log.info("File deleted: {}", filePath);
            }
        } catch (IOException e) {
            // The database row is already gone; a stray file is not worth failing the request
            log.error("Failed to delete file {}: {}", filePath, e.getMessage(), e);
        }
    }

    public static boolean isValidImageFile(MultipartFile file) {
        String contentType = file.getContentType();
        return contentType != null && contentType.startsWith("image/");
    }

    public static boolean isValidFileSize(MultipartFile file, long maxSizeInMB) {
        long maxSizeInBytes = maxSizeInMB * 1024 * 1024;
        return file.getSize() <= maxSizeInBytes;
    }

    static String getFileExtension(String filename) {
        if (filename == null || filename.lastIndexOf(".") == -1) {
            return "";
        }
        return filename.substring(filename.lastIndexOf(".")).toLowerCase();
    }
}
