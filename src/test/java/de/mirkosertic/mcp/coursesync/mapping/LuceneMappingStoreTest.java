package de.mirkosertic.mcp.coursesync.mapping;

import de.mirkosertic.mcp.coursesync.index.CourseIndexService;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LuceneMappingStore Tests")
class LuceneMappingStoreTest {

    private CourseIndexService indexService;
    private LuceneMappingStore store;

    @BeforeEach
    void setUp() throws IOException {
        indexService = new CourseIndexService(new ByteBuffersDirectory(), 1000);
        indexService.init();
        store = new LuceneMappingStore(indexService);
    }

    @AfterEach
    void tearDown() throws IOException {
        indexService.close();
    }

    @Test
    @DisplayName("Should return empty for unknown paths")
    void shouldReturnEmptyForUnknownPath() throws IOException {
        assertThat(store.lookup("course", "sections/a/01.md")).isEmpty();
    }

    @Test
    @DisplayName("Should insert a record with all fields")
    void shouldInsertRecord() throws IOException {
        // When
        final MappingRecord inserted = store.upsert("course", "sections/a/01.md", "e1", "s1", "h1");

        // Then
        final Optional<MappingRecord> found = store.lookup("course", "sections/a/01.md");
        assertThat(found).contains(inserted);
        assertThat(inserted.entityId()).isEqualTo("e1");
        assertThat(inserted.parentEntityId()).isEqualTo("s1");
        assertThat(inserted.contentHash()).isEqualTo("h1");
        assertThat(inserted.itemId()).isNull();
        assertThat(inserted.createdAt()).isPositive().isEqualTo(inserted.modifiedAt());
    }

    @Test
    @DisplayName("Should only overwrite non-null fields and keep the creation time")
    void shouldMergePartialUpdates() throws IOException {
        // Given
        final MappingRecord first = store.upsert("course", "p", "e1", "s1", "h1");

        // When
        final MappingRecord second = store.upsert("course", "p", MappingUpdate.hashOnly("h2"));
        final MappingRecord third = store.upsert("course", "p", new MappingUpdate(null, null, null, "item-7"));

        // Then
        assertThat(second.entityId()).isEqualTo("e1");
        assertThat(second.parentEntityId()).isEqualTo("s1");
        assertThat(second.contentHash()).isEqualTo("h2");
        assertThat(third.itemId()).isEqualTo("item-7");
        assertThat(third.contentHash()).isEqualTo("h2");
        assertThat(third.createdAt()).isEqualTo(first.createdAt());
        assertThat(third.modifiedAt()).isGreaterThanOrEqualTo(first.modifiedAt());
    }

    @Test
    @DisplayName("Should keep at most one record per scope and path")
    void shouldKeepOneRecordPerKey() throws IOException {
        store.upsert("course", "p", "e1", null, "h1");
        store.upsert("course", "p", "e1", null, "h2");
        store.upsert("course", "p", "e1", null, "h3");

        assertThat(store.list("course")).hasSize(1);
    }

    @Test
    @DisplayName("Should separate scopes and list records ordered by path")
    void shouldListPerScopeOrderedByPath() throws IOException {
        // Given
        store.upsert("course", "sections/b", "e2", null, null);
        store.upsert("course", "sections/a", "e1", null, null);
        store.upsert("other", "sections/a", "x1", null, null);

        // When
        final List<MappingRecord> records = store.list("course");

        // Then
        assertThat(records).extracting(MappingRecord::repoPath).containsExactly("sections/a", "sections/b");
        assertThat(store.lookup("other", "sections/a")).get()
                .extracting(MappingRecord::entityId).isEqualTo("x1");
    }
}
