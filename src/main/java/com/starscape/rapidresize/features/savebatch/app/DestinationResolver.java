package com.starscape.rapidresize.features.savebatch.app;

import com.starscape.rapidresize.features.transcode.domain.OutputFormat;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Names output files: {@code <safe-stem>_resized<ext>} in the output directory.
 *
 * Characters that are unsafe in file names become {@code _}. Stems longer than 72 characters are
 * cut to 60 and tagged with the first 8 hex digits of their SHA-1 so distinct long names stay
 * distinct. Names already on disk or already handed out in the same run get {@code _1}, {@code _2}, ...
 * Dry runs skip the collision check, since nothing is written.
 */
@Component
public class DestinationResolver {

    static final String OUTPUT_SUFFIX = "_resized";
    static final int MAX_STEM_LENGTH = 72;
    static final int TRUNCATED_STEM_LENGTH = 60;
    static final int HASH_LENGTH = 8;
    private static final String UNSAFE_CHARACTERS = "\\/:*?\"<>|";

    public Path resolve(Path sourcePath, Path outputDirectory, OutputFormat format, boolean dryRun,
                        Set<Path> reserved) {
        String stem = safeStem(stemOf(sourcePath));
        String extension = format.getExtension();

        Path candidate = outputDirectory.resolve(stem + OUTPUT_SUFFIX + extension);
        if (dryRun) {
            return candidate;
        }
        int counter = 1;
        while (Files.exists(candidate) || reserved.contains(candidate)) {
            candidate = outputDirectory.resolve(stem + OUTPUT_SUFFIX + "_" + counter + extension);
            counter++;
        }
        reserved.add(candidate);
        return candidate;
    }

    static String stemOf(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    static String safeStem(String stem) {
        StringBuilder safe = new StringBuilder(stem.length());
        for (char c : stem.toCharArray()) {
            safe.append(UNSAFE_CHARACTERS.indexOf(c) >= 0 || Character.isISOControl(c) ? '_' : c);
        }
        String cleaned = safe.toString().strip();
        if (cleaned.isEmpty()) {
            cleaned = "image";
        }
        if (cleaned.length() > MAX_STEM_LENGTH) {
            String hash = DigestUtils.sha1Hex(cleaned).substring(0, HASH_LENGTH);
            cleaned = cleaned.substring(0, TRUNCATED_STEM_LENGTH) + "_" + hash;
        }
        return cleaned;
    }
}
