package io.pricedock.driver;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves user-supplied names to files inside the inbox directory.
 */
public final class InboxFiles {
    private final Path inboxDir;
    private final List<String> allowedExtensions;

    public InboxFiles(Path inboxDir, List<String> allowedExtensions) {
        this.inboxDir = inboxDir.toAbsolutePath().normalize();
        this.allowedExtensions = List.copyOf(allowedExtensions);
    }

    public Path inboxDir() {
        return inboxDir;
    }

    public boolean hasAllowedExtension(String name) {
        if (name == null) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for (String ext : allowedExtensions) {
            if (lower.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Validates one {@code --files} entry. A bare name is looked up in the inbox, anything
     * else must still resolve to a path under the inbox.
     *
     * @throws InvalidInboxFileException when the entry is empty, has a disallowed extension,
     *                                   escapes the inbox, or does not exist
     */
    public Path resolve(String name) {
        String raw = name == null ? "" : name.trim();
        raw = stripQuotes(raw).replace('\\', '/');
        if (raw.isEmpty()) {
            throw new InvalidInboxFileException(SkipReason.OTHER, "Empty filename");
        }
        Path candidate = Paths.get(raw);
        Path resolved;
        if (candidate.isAbsolute()) {
            resolved = candidate.normalize();
        } else if (candidate.getNameCount() == 1) {
            resolved = inboxDir.resolve(candidate.getFileName()).normalize();
        } else {
            resolved = inboxDir.resolve(candidate).normalize();
        }
        String fileName = resolved.getFileName() == null ? raw : resolved.getFileName().toString();
        if (!hasAllowedExtension(fileName)) {
            throw new InvalidInboxFileException(SkipReason.INVALID_EXTENSION, "Invalid extension: " + fileName);
        }
        if (!resolved.startsWith(inboxDir) || resolved.equals(inboxDir)) {
            throw new InvalidInboxFileException(SkipReason.OTHER, "Path traversal blocked: " + name);
        }
        if (!Files.isRegularFile(resolved)) {
            throw new InvalidInboxFileException(SkipReason.OTHER, "File not found: " + fileName);
        }
        return resolved;
    }

    public Optional<Path> newest() throws IOException {
        if (!Files.isDirectory(inboxDir)) {
            return Optional.empty();
        }
        Path newest = null;
        FileTime newestTime = null;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(inboxDir)) {
            for (Path p : stream) {
                if (!Files.isRegularFile(p) || !hasAllowedExtension(p.getFileName().toString())) {
                    continue;
                }
                FileTime t = Files.getLastModifiedTime(p);
                if (newestTime == null || t.compareTo(newestTime) > 0) {
                    newest = p;
                    newestTime = t;
                }
            }
        }
        return Optional.ofNullable(newest);
    }

    /**
     * Re-joins argument tokens that a shell split inside a file name with spaces: tokens are
     * accumulated until one ends with an allowed extension.
     */
    public List<String> coalesceArguments(List<String> parts) {
        List<String> out = new ArrayList<>();
        List<String> buf = new ArrayList<>();
        if (parts == null) {
            return out;
        }
        for (String part : parts) {
            if (part == null || part.isBlank()) {
                continue;
            }
            buf.add(part.trim());
            if (hasAllowedExtension(stripQuotes(part.trim()))) {
                out.add(String.join(" ", buf));
                buf.clear();
            }
        }
        if (!buf.isEmpty()) {
            out.add(String.join(" ", buf));
        }
        return out;
    }

    private static String stripQuotes(String s) {
        String out = s;
        while (out.length() >= 1 && (out.startsWith("\"") || out.startsWith("'"))) {
            out = out.substring(1);
        }
        while (out.length() >= 1 && (out.endsWith("\"") || out.endsWith("'"))) {
            out = out.substring(0, out.length() - 1);
        }
        return out.trim();
    }

    public static final class InvalidInboxFileException extends RuntimeException {
        private final SkipReason reason;

        public InvalidInboxFileException(SkipReason reason, String message) {
            super(message);
            this.reason = reason;
        }

        public SkipReason reason() {
            return reason;
        }
    }
}
