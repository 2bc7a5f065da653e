package com.example.aurawatch.service;

import com.example.aurawatch.config.MonitorConfig;
import com.example.aurawatch.exception.ErrorCode;
import com.example.aurawatch.exception.IdentityException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists regular files of {@code monitor.keystore-path}. Sub-directories are ignored.
 */
@Component
@RequiredArgsConstructor
public class FileSystemKeystoreDirectory implements KeystoreDirectory {

    private final MonitorConfig config;

    @Override
    public List<String> listFileNames() {
        Path dir = Path.of(config.getKeystorePath());
        try (Stream<Path> entries = Files.list(dir)) {
            return entries
                .filter(Files::isRegularFile)
                .map(p -> p.getFileName().toString())
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new IdentityException(ErrorCode.KEYSTORE_UNREADABLE,
                "failed to read --monitor.keystore-path '" + dir + "': " + e.getMessage(), e);
        }
    }
}
