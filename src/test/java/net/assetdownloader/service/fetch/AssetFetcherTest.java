package net.assetdownloader.service.fetch;

import net.assetdownloader.model.AssetKind;
import net.assetdownloader.model.DownloadJob;
import net.assetdownloader.support.cancel.CancellationToken;
import net.assetdownloader.support.path.SafePathResolver;
import net.assetdownloader.testutil.TestImages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AssetFetcherTest {

    @Mock
    private HttpAssetClient httpAssetClient;

    @TempDir
    Path tempDir;

    private AssetFetcher fetcher;

    @BeforeEach
    void setUp() {
        fetcher = new AssetFetcher(new SafePathResolver(), httpAssetClient);
    }

    @Test
    void should_UseSourceFolderMatch_When_PartNumberAppearsInFileName() throws Exception {
        Path source = Files.createDirectories(tempDir.resolve("src"));
        byte[] png = TestImages.opaquePngWithAlphaChannel(4, 4);
        Files.write(source.resolve("abc-1_photo.jpg"), png);
        DownloadJob job = imageJob("ABC-1", "http://x/abc.png", null, source.toString());

        FetchOutcome outcome = fetcher.resolve(job, new CancellationToken());

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.strategy()).isEqualTo(ResolutionStrategy.SOURCE_FOLDER);
        assertThat(outcome.contentType()).isEqualTo(FetchOutcome.LOCAL_CONTENT_TYPE);
        assertThat(outcome.httpStatus()).isEqualTo(200);
        assertThat(outcome.message()).isEqualTo(AssetFetcher.SOURCE_FOLDER_MESSAGE);
        assertThat(outcome.bytes()).isEqualTo(png);
        verifyNoInteractions(httpAssetClient);
    }

    @Test
    void should_PreferCustomFilename_When_SearchingSourceFolder() throws Exception {
        Path source = Files.createDirectories(tempDir.resolve("src"));
        Files.write(source.resolve("abc-1.png"), new byte[] {1});
        Files.write(source.resolve("Special-Name.png"), new byte[] {2});
        DownloadJob job = imageJob("ABC-1", "http://x/abc.png", "special-name", source.toString());

        FetchOutcome outcome = fetcher.resolve(job, new CancellationToken());

        assertThat(outcome.bytes()).containsExactly(2);
    }

    @Test
    void should_IgnoreFilesOfOtherKind_When_SearchingForPdf() throws Exception {
        Path source = Files.createDirectories(tempDir.resolve("src"));
        Files.write(source.resolve("ABC-1.png"), new byte[] {1});
        DownloadJob job = new DownloadJob(1, "ABC-1", AssetKind.PDF, "http://x/abc.pdf", null,
            source.toString(), tempDir.resolve("ABC1.pdf"), "");
        FetchOutcome remote = FetchOutcome.http(new byte[] {9}, "application/pdf", 200, 1, "http://x/abc.pdf");
        when(httpAssetClient.fetch(eq("http://x/abc.pdf"), any())).thenReturn(remote);

        FetchOutcome outcome = fetcher.resolve(job, new CancellationToken());

        assertThat(outcome.strategy()).isEqualTo(ResolutionStrategy.HTTP);
    }

    @Test
    void should_ReadFile_When_LocatorIsLocalFile() throws Exception {
        Path file = Files.write(tempDir.resolve("local.png"), new byte[] {7, 7});
        DownloadJob job = imageJob("P1", file.toString(), null, null);

        FetchOutcome outcome = fetcher.resolve(job, new CancellationToken());

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.strategy()).isEqualTo(ResolutionStrategy.LOCAL_PATH);
        assertThat(outcome.message()).isEqualTo(AssetFetcher.LOCAL_FILE_MESSAGE);
        assertThat(outcome.origin()).isEqualTo(file.toString());
        verifyNoInteractions(httpAssetClient);
    }

    @Test
    void should_TakeFirstImage_When_LocatorIsDirectory() throws Exception {
        Path dir = Files.createDirectories(tempDir.resolve("photos"));
        Files.write(dir.resolve("b.png"), new byte[] {2});
        Files.write(dir.resolve("a.jpg"), new byte[] {1});
        Files.write(dir.resolve("notes.txt"), new byte[] {0});

        FetchOutcome outcome = fetcher.resolve(imageJob("P1", dir.toString(), null, null), new CancellationToken());

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.bytes()).containsExactly(1);
        assertThat(outcome.message()).isEqualTo("File copied and processed from directory (2 images found)");
    }

    @Test
    void should_Fail_When_DirectoryHasNoImages() throws Exception {
        Path dir = Files.createDirectories(tempDir.resolve("empty"));
        Files.write(dir.resolve("readme.txt"), new byte[] {0});

        FetchOutcome outcome = fetcher.resolve(imageJob("P1", dir.toString(), null, null), new CancellationToken());

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.message()).isEqualTo(AssetFetcher.EMPTY_DIRECTORY_MESSAGE);
        verifyNoInteractions(httpAssetClient);
    }

    @Test
    void should_RejectTraversal_When_LocatorEscapes() {
        DownloadJob job = imageJob("P1", "../../etc/passwd", null, null);

        FetchOutcome outcome = fetcher.resolve(job, new CancellationToken());

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.message()).startsWith("Path security violation");
        verifyNoInteractions(httpAssetClient);
    }

    @Test
    void should_DelegateToHttp_When_LocatorIsUrl() {
        DownloadJob job = imageJob("P1", "https://cdn.example.com/p1.png", null, null);
        CancellationToken token = new CancellationToken();
        FetchOutcome remote = FetchOutcome.http(new byte[] {1}, "image/png", 200, 1, job.locator());
        when(httpAssetClient.fetch(job.locator(), token)).thenReturn(remote);

        assertThat(fetcher.resolve(job, token)).isSameAs(remote);
        verify(httpAssetClient).fetch(job.locator(), token);
    }

    @Test
    void should_ReturnCancelled_When_TokenAlreadyCancelled() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        FetchOutcome outcome = fetcher.resolve(imageJob("P1", "https://x/p.png", null, null), token);

        assertThat(outcome.cancelled()).isTrue();
        verifyNoInteractions(httpAssetClient);
    }

    private DownloadJob imageJob(String partNumber, String locator, String customFilename, String sourceFolder) {
        return new DownloadJob(1, partNumber, AssetKind.IMAGE, locator, customFilename, sourceFolder,
            tempDir.resolve("out").resolve(partNumber + ".jpg"), "");
    }
}
