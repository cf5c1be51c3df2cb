package org.dxworks.codeprobe;

import java.nio.file.Path;
import java.util.Optional;

public class LanguageDetector {

    public static Optional<Language> detectLanguage(Path filePath) {
        Path fileName = filePath.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toString();
        for (Language language : Language.values()) {
            if (language.matchesFileName(name)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }
}
