package com.ukboards.network.persistence;

import java.nio.file.Path;

public class NoMatchingDataPathException extends RuntimeException {
    private final Path path;
    private final String prefix;

    public NoMatchingDataPathException(Path path, String prefix) {
        super("No file found in " + path + " matching prefix " + (prefix == null ? "" : prefix));
        this.path = path;
        this.prefix = prefix;
    }

    public Path getPath() {
        return path;
    }

    public String getPrefix() {
        return prefix;
    }
}
