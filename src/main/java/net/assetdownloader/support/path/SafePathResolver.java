package net.assetdownloader.support.path;

import jakarta.annotation.Nullable;
import net.assetdownloader.exception.AssetFileSystemException;
import net.assetdownloader.exception.PathSecurityException;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Resolves untrusted path strings against an optional root, rejecting traversal
 * segments, null bytes and anything that would escape the root.
 *
 * <p>Every file-touching operation of a run goes through this class.</p>
 */
@Component
public class SafePathResolver {

    private static final Pattern SEGMENT_SEPARATOR = Pattern.compile("[/\\\\]");
    private static final String PARENT_SEGMENT = "..";
    private static final char NULL_BYTE = '\0';

    /**
     * Resolves {@code rawPath} to an absolute, normalized path.
     *
     * @param rawPath untrusted path; relative paths are resolved against {@code root} when given
     * @param root optional directory the result must stay within
     * @return the normalized absolute path
     * @throws PathSecurityException when the path is blank, contains traversal or null bytes, or leaves {@code root}
     */
    public Path resolveSafe(String rawPath, @Nullable Path root) {
        if (!StringUtils.hasText(rawPath)) {
            throw new PathSecurityException("Path must not be empty", String.valueOf(rawPath));
        }
        rejectForbidden(rawPath, rawPath);

        Path candidate = toPath(rawPath);
        Path resolved;
        if (root != null) {
            Path normalizedRoot = root.toAbsolutePath().normalize();
            resolved = (candidate.isAbsolute() ? candidate : normalizedRoot.resolve(candidate))
                .toAbsolutePath().normalize();
            ensureWithin(resolved, normalizedRoot, rawPath);
        } else {
            resolved = candidate.toAbsolutePath().normalize();
        }
        return resolved;
    }

    /**
     * Joins relative components onto {@code root}.
     *
     * @throws PathSecurityException when any component is blank, absolute, or contains traversal or null bytes
     */
    public Path joinSafe(Path root, String... parts) {
        if (root == null) {
            throw new PathSecurityException("Root path must not be null", "null");
        }
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path joined = normalizedRoot;
        for (String part : parts) {
            if (!StringUtils.hasText(part)) {
                throw new PathSecurityException("Path component must not be empty", String.valueOf(part));
            }
            rejectForbidden(part, part);
            Path component = toPath(part);
            if (component.isAbsolute() || part.startsWith("/") || part.startsWith("\\")) {
                throw new PathSecurityException("Absolute path component not allowed", part);
            }
            joined = joined.resolve(component);
        }
        Path normalized = joined.normalize();
        ensureWithin(normalized, normalizedRoot, String.join("/", parts));
        return normalized;
    }

    /**
     * Appends a file name to a display-only base path such as a UNC share, without touching
     * the local file system. The separator follows the style already used by {@code base}.
     *
     * @return {@code base + separator + fileName}, or an empty string when {@code base} is blank
     * @throws PathSecurityException when {@code fileName} contains separators, traversal or null bytes
     */
    public String joinDisplayPath(@Nullable String base, String fileName) {
        if (!StringUtils.hasText(base)) {
            return "";
        }
        if (!StringUtils.hasText(fileName)) {
            throw new PathSecurityException("File name must not be empty", String.valueOf(fileName));
        }
        rejectForbidden(fileName, fileName);
        if (fileName.indexOf('/') >= 0 || fileName.indexOf('\\') >= 0) {
            throw new PathSecurityException("File name must not contain separators", fileName);
        }
        String trimmed = base.trim();
        char separator = trimmed.indexOf('\\') >= 0 && trimmed.indexOf('/') < 0 ? '\\' : '/';
        int end = trimmed.length();
        while (end > 0 && (trimmed.charAt(end - 1) == '/' || trimmed.charAt(end - 1) == '\\')) {
            end--;
        }
        return trimmed.substring(0, end) + separator + fileName;
    }

    /**
     * Lists the direct entries of {@code dir} in name order.
     *
     * @throws AssetFileSystemException when the directory cannot be read
     */
    public List<Path> listSafe(Path dir, @Nullable Path root) {
        Path safeDir = resolveSafe(dir.toString(), root);
        try (Stream<Path> entries = Files.list(safeDir)) {
            return entries.sorted().toList();
        } catch (IOException e) {
            throw new AssetFileSystemException(safeDir.toString(), "Cannot list directory " + safeDir + ": " + e.getMessage(), e);
        }
    }

    /**
     * Lists every regular file below {@code dir}, in path order. Symbolic links are not followed.
     *
     * @throws AssetFileSystemException when the tree cannot be walked
     */
    public List<Path> listFilesRecursively(Path dir, @Nullable Path root) {
        Path safeDir = resolveSafe(dir.toString(), root);
        try (Stream<Path> entries = Files.walk(safeDir)) {
            return entries
                .filter(Files::isRegularFile)
                .filter(path -> path.normalize().startsWith(safeDir))
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new AssetFileSystemException(safeDir.toString(), "Cannot walk directory " + safeDir + ": " + e.getMessage(), e);
        }
    }

    private static void rejectForbidden(String value, String attempted) {
        if (value.indexOf(NULL_BYTE) >= 0) {
            throw new PathSecurityException("Null bytes are not allowed in paths", attempted);
        }
        for (String segment : SEGMENT_SEPARATOR.split(value)) {
            if (PARENT_SEGMENT.equals(segment)) {
                throw new PathSecurityException("Path traversal detected", attempted);
            }
        }
    }

    private static Path toPath(String raw) {
        try {
            return Paths.get(raw);
        } catch (InvalidPathException e) {
            throw new PathSecurityException("Invalid path: " + e.getReason(), raw);
        }
    }

    private static void ensureWithin(Path resolved, Path root, String attempted) {
        if (!resolved.startsWith(root)) {
            throw new PathSecurityException("Path escapes allowed root " + root, attempted);
        }
    }
}
