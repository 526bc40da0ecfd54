package com.boundsmith.syntax;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Source languages BoundSmith can scan, with their file naming conventions for tests.
 */
public enum SourceLanguage {

    PYTHON("python", ".py") {
        @Override
        public boolean isTestFile(Path file) {
            String name = file.getFileName().toString();
            return (name.startsWith("test_") && name.endsWith(".py"))
                    || name.endsWith("_test.py")
                    || name.equals("conftest.py");
        }
    },

    JAVA("java", ".java") {
        @Override
        public boolean isTestFile(Path file) {
            String name = file.getFileName().toString();
            if (!name.endsWith(".java")) {
                return false;
            }
            String stem = name.substring(0, name.length() - ".java".length());
            if (stem.startsWith("Test") || stem.endsWith("Test") || stem.endsWith("Tests") || stem.endsWith("TestCase")) {
                return true;
            }
            String normalized = file.toString().replace('\\', '/');
            return normalized.contains("src/test/");
        }
    };

    private final String id;
    private final String extension;

    SourceLanguage(String id, String extension) {
        this.id = id;
        this.extension = extension;
    }

    /**
     * Whether the file belongs to a test suite by this language's naming conventions.
     */
    public abstract boolean isTestFile(Path file);

    public String getId() {
        return id;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Detects the language of a file from its extension.
     */
    public static Optional<SourceLanguage> forPath(Path file) {
        Path fileName = file.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        for (SourceLanguage language : values()) {
            if (name.endsWith(language.extension)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }

    /**
     * Looks up a language by its configuration id ({@code python}, {@code java}).
     */
    public static Optional<SourceLanguage> forId(String id) {
        for (SourceLanguage language : values()) {
            if (language.id.equalsIgnoreCase(id.trim())) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }
}
