package com.odin.share_relay_service.service;

import com.odin.share_relay_service.config.ShareRelayProperties;
import com.odin.share_relay_service.dto.InboundItem;
import com.odin.share_relay_service.dto.ItemRef;
import com.odin.share_relay_service.dto.StoredItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Durable item store on the local file system.
 * 
 * Directory Structure:
 * share-store/
 *   ├── 3f2a9c0d8e7b4a1f9c6d5e4b3a291807/
 *   │   └── photo1.jpg
 *   ├── 9b1e7d2c4f6a48e0b3c5d7e9f1a2b4c6/
 *   │   └── report.pdf
 *   └── ...
 * 
 * One folder per item, named after the item key. The key is what share records store.
 */
@Slf4j
@Service
public class ItemStorageService {

    private static final Pattern ITEM_KEY = Pattern.compile("[0-9a-f]{32}");
    private static final String DEFAULT_MEDIA_TYPE = "application/octet-stream";

    private final ShareRelayProperties properties;
    private final Path storeLocation;
    private final List<String> blockedExtensions;

    public ItemStorageService(ShareRelayProperties properties) {
        this.properties = properties;
        this.storeLocation = Paths.get(properties.getStoreDir())
                .toAbsolutePath()
                .normalize();
        this.blockedExtensions = Arrays.stream(properties.getBlockedExtensions().toLowerCase().split(","))
                .map(String::trim)
                .filter(ext -> !ext.isEmpty())
                .collect(Collectors.toList());

        try {
            Files.createDirectories(this.storeLocation);
            log.info("[ITEM-STORE] Store directory created/verified: {}", this.storeLocation);
        } catch (IOException e) {
            log.error("[ITEM-STORE] Failed to create store directory: {}", this.storeLocation, e);
            throw new IllegalStateException("Could not create item store directory", e);
        }
    }

    /**
     * Write one item into a new folder.
     *
     * @return ref of the stored item
     * @throws IllegalArgumentException if the item is empty or too large
     * @throws SecurityException if the extension is blocked
     * @throws IOException if writing fails; the folder is removed again
     */
    public ItemRef store(InboundItem item) throws IOException {
        validate(item);

        String key = UUID.randomUUID().toString().replace("-", "");
        Path folder = storeLocation.resolve(key);
        String fileName = sanitizeFilename(item.getFileName());
        Path destination = folder.resolve(fileName).normalize();

        if (!destination.getParent().equals(folder)) {
            throw new SecurityException("Cannot store item outside its folder");
        }

        try {
            Files.createDirectories(folder);
            Files.write(destination, item.getContent());
        } catch (IOException e) {
            deleteFolderQuietly(key);
            throw e;
        }

        log.info("[ITEM-STORE] Stored item key={} file={} size={} bytes", key, fileName, item.getContent().length);
        return ItemRef.of(key);
    }

    /**
     * @throws NoSuchFileException if the item is gone
     */
    public StoredItem load(ItemRef ref) throws IOException {
        Path folder = folderOf(ref);
        Path file = firstFile(folder).orElseThrow(() -> new NoSuchFileException(folder.toString()));
        byte[] content = Files.readAllBytes(file);
        String mediaType = Optional.ofNullable(Files.probeContentType(file)).orElse(DEFAULT_MEDIA_TYPE);

        log.debug("[ITEM-STORE] Loaded item key={} size={} bytes", ref.getKey(), content.length);
        return StoredItem.builder()
                .ref(ref)
                .fileName(file.getFileName().toString())
                .mediaType(mediaType)
                .content(content)
                .build();
    }

    /**
     * Remove an item with its folder.
     *
     * @return false if the item was already gone
     */
    public boolean delete(ItemRef ref) throws IOException {
        Path folder = folderOf(ref);
        if (!Files.exists(folder)) {
            log.warn("[ITEM-STORE] Item does not exist (already deleted?): {}", ref.getKey());
            return false;
        }

        try (Stream<Path> files = Files.list(folder)) {
            for (Path file : files.collect(Collectors.toList())) {
                Files.deleteIfExists(file);
            }
        }
        Files.deleteIfExists(folder);

        log.info("[ITEM-STORE] Deleted item key={}", ref.getKey());
        return true;
    }

    public boolean exists(ItemRef ref) {
        Path folder = folderOf(ref);
        return Files.isDirectory(folder);
    }

    private void deleteFolderQuietly(String key) {
        try {
            delete(ItemRef.of(key));
        } catch (IOException e) {
            log.error("[ITEM-STORE] Failed to remove partial item key={}", key, e);
        }
    }

    private Optional<Path> firstFile(Path folder) throws IOException {
        if (!Files.isDirectory(folder)) {
            return Optional.empty();
        }
        try (Stream<Path> files = Files.list(folder)) {
            return files.filter(Files::isRegularFile).findFirst();
        }
    }

    private Path folderOf(ItemRef ref) {
        if (ref == null || ref.getKey() == null || !ITEM_KEY.matcher(ref.getKey()).matches()) {
            throw new IllegalArgumentException("Malformed item key: " + ref);
        }
        return storeLocation.resolve(ref.getKey());
    }

    /**
     * Validate size and extension.
     */
    private void validate(InboundItem item) {
        if (item.getContent() == null || item.getContent().length == 0) {
            throw new IllegalArgumentException("Item is empty");
        }
        if (item.getContent().length > properties.getMaxItemSize()) {
            throw new IllegalArgumentException(
                    String.format("Item size exceeds maximum allowed size: %d bytes (max: %d bytes)",
                            item.getContent().length, properties.getMaxItemSize()));
        }

        String extension = getFileExtension(item.getFileName()).toLowerCase();
        if (!extension.isEmpty() && blockedExtensions.contains(extension)) {
            throw new SecurityException(
                    String.format("File extension '%s' is not allowed for security reasons", extension));
        }
    }

    /**
     * Strip everything that could escape the item folder.
     */
    private String sanitizeFilename(String filename) {
        if (filename == null || filename.isBlank()) {
            return "item";
        }
        return filename.replaceAll("[^a-zA-Z0-9._-]", "_");
    }

    public String getFileExtension(String filename) {
        if (filename == null || filename.isEmpty()) {
            return "";
        }

        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex == -1 || lastDotIndex == filename.length() - 1) {
            return "";
        }

        return filename.substring(lastDotIndex + 1);
    }
}
