package net.assetdownloader.support.path;

import net.assetdownloader.exception.PathSecurityException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SafePathResolverTest {

    private final SafePathResolver resolver = new SafePathResolver();

    @TempDir
    Path root;

    @Test
    void should_ResolveRelativePathUnderRoot_When_PathIsClean() {
        Path resolved = resolver.resolveSafe("images/a.jpg", root);

        assertThat(resolved).isEqualTo(root.toAbsolutePath().normalize().resolve("images/a.jpg"));
    }

    @Test
    void should_Reject_When_PathContainsTraversal() {
        assertThatThrownBy(() -> resolver.resolveSafe("images/../../etc/passwd", root))
            .isInstanceOf(PathSecurityException.class)
            .satisfies(e -> assertThat(((PathSecurityException) e).getAttemptedPath()).isEqualTo("images/../../etc/passwd"));
    }

    @Test
    void should_Reject_When_PathContainsNullByte() {
        assertThatThrownBy(() -> resolver.resolveSafe("a\0b.jpg", null))
            .isInstanceOf(PathSecurityException.class)
            .hasMessageContaining("Null bytes");
    }

    @Test
    void should_Reject_When_AbsolutePathEscapesRoot() {
        Path outside = root.getParent().resolve("elsewhere.txt");

        assertThatThrownBy(() -> resolver.resolveSafe(outside.toString(), root))
            .isInstanceOf(PathSecurityException.class)
            .hasMessageContaining("escapes");
    }

    @Test
    void should_Reject_When_PathIsBlank() {
        assertThatThrownBy(() -> resolver.resolveSafe("  ", null)).isInstanceOf(PathSecurityException.class);
    }

    @Test
    void should_AllowDotsInsideFileNames_When_NotATraversalSegment() {
        assertThat(resolver.resolveSafe("v1..2.jpg", root).getFileName().toString()).isEqualTo("v1..2.jpg");
    }

    @Test
    void should_JoinComponents_When_AllAreRelative() {
        assertThat(resolver.joinSafe(root, "out", "ABC1.jpg"))
            .isEqualTo(root.toAbsolutePath().normalize().resolve("out").resolve("ABC1.jpg"));
    }

    @Test
    void should_RejectJoin_When_ComponentIsAbsoluteOrTraversal() {
        assertThatThrownBy(() -> resolver.joinSafe(root, "/etc/passwd")).isInstanceOf(PathSecurityException.class);
        assertThatThrownBy(() -> resolver.joinSafe(root, "..", "x.jpg")).isInstanceOf(PathSecurityException.class);
    }

    @Test
    void should_JoinDisplayPathWithMatchingSeparator_When_BaseIsUncShare() {
        assertThat(resolver.joinDisplayPath("\\\\server\\photos\\", "ABC1.jpg")).isEqualTo("\\\\server\\photos\\ABC1.jpg");
        assertThat(resolver.joinDisplayPath("/mnt/share/photos", "ABC1.jpg")).isEqualTo("/mnt/share/photos/ABC1.jpg");
        assertThat(resolver.joinDisplayPath(null, "ABC1.jpg")).isEmpty();
    }

    @Test
    void should_ListFilesRecursivelyInOrder_When_TreeIsNested() throws IOException {
        Files.createDirectories(root.resolve("b/nested"));
        Files.writeString(root.resolve("b/nested/z.jpg"), "z");
        Files.writeString(root.resolve("a.jpg"), "a");

        List<Path> files = resolver.listFilesRecursively(root, root);

        assertThat(files).extracting(p -> root.toAbsolutePath().normalize().relativize(p).toString().replace('\\', '/'))
            .containsExactly("a.jpg", "b/nested/z.jpg");
    }
}
