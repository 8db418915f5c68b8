package com.quanta.playground.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads Quanta program text from disk. The compiler itself never touches files.
 */
@Component
public class SourceFileLoader {

    private static final Logger logger = LoggerFactory.getLogger(SourceFileLoader.class);

    public String load(Path directory, String fileName) throws IOException {
        Path sourceFile = directory.resolve(fileName);
        logger.info("Reading Quanta source from {}", sourceFile.toAbsolutePath());
        return Files.readString(sourceFile, StandardCharsets.UTF_8);
    }
}
