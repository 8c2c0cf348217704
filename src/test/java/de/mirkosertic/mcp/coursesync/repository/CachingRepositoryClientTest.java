package de.mirkosertic.mcp.coursesync.repository;

import de.mirkosertic.mcp.coursesync.tree.EntryKind;
import de.mirkosertic.mcp.coursesync.tree.TreeEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CachingRepositoryClient Tests")
class CachingRepositoryClientTest {

    @Mock
    private RepositoryClient delegate;

    private ContentCacheStats stats;
    private CachingRepositoryClient client;

    @BeforeEach
    void setUp() {
        stats = new ContentCacheStats();
        client = new CachingRepositoryClient(delegate, CachingRepositoryClient.createSharedCache(1024, stats), stats);
    }

    @Test
    @DisplayName("Should download a blob once and serve it from the cache afterwards")
    void shouldServeFromCache() throws TransportException {
        // Given
        when(delegate.listTree()).thenReturn(List.of(new TreeEntry("a.md", EntryKind.BLOB, 5, "sha-a")));
        when(delegate.getFileContents("a.md")).thenReturn("hello".getBytes(StandardCharsets.UTF_8));
        client.listTree();

        // When
        final byte[] first = client.getFileContents("a.md");
        final byte[] second = client.getFileContents("a.md");

        // Then
        assertThat(second).isEqualTo(first);
        verify(delegate, times(1)).getFileContents("a.md");
        assertThat(stats.getCacheHits()).isEqualTo(1);
        assertThat(stats.getCacheMisses()).isEqualTo(1);
        assertThat(stats.getBytesServed()).isEqualTo(5);
        assertThat(stats.getHitRate()).isEqualTo(50.0);
    }

    @Test
    @DisplayName("Should share cached contents between paths with the same blob")
    void shouldShareByBlobSha() throws TransportException {
        when(delegate.listTree()).thenReturn(List.of(
                new TreeEntry("a.md", EntryKind.BLOB, 1, "same"),
                new TreeEntry("b.md", EntryKind.BLOB, 1, "same")));
        when(delegate.getFileContents("a.md")).thenReturn(new byte[]{1});
        client.listTree();

        client.getFileContents("a.md");
        final byte[] copy = client.getFileContents("b.md");

        assertThat(copy).containsExactly(1);
    }

    @Test
    @DisplayName("Should bypass the cache for paths without blob SHA")
    void shouldBypassWithoutSha() throws TransportException {
        when(delegate.getFileContents("x.md")).thenReturn(new byte[]{7});

        client.getFileContents("x.md");
        client.getFileContents("x.md");

        verify(delegate, times(2)).getFileContents("x.md");
        assertThat(stats.getTotalRequests()).isZero();
    }

    @Test
    @DisplayName("Should hand out copies so callers cannot corrupt the cache")
    void shouldReturnCopies() throws TransportException {
        when(delegate.listTree()).thenReturn(List.of(new TreeEntry("a.md", EntryKind.BLOB, 1, "s")));
        when(delegate.getFileContents("a.md")).thenReturn(new byte[]{1});
        client.listTree();

        client.getFileContents("a.md")[0] = 9;

        assertThat(client.getFileContents("a.md")).containsExactly(1);
    }
}
