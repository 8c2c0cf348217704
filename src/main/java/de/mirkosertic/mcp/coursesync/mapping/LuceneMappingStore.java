package de.mirkosertic.mcp.coursesync.mapping;

import de.mirkosertic.mcp.coursesync.index.CourseIndexService;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.TermQuery;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * {@link MappingStore} kept as {@code doc_type=mapping} documents in the course index.
 * Each record is keyed by a {@code mapping_key} term made of scope and path.
 */
public class LuceneMappingStore implements MappingStore {

    private static final Logger logger = LoggerFactory.getLogger(LuceneMappingStore.class);

    static final String DOC_TYPE = "mapping";
    private static final String FIELD_KEY = "mapping_key";
    private static final String FIELD_REPO_PATH = "repo_path";
    private static final String FIELD_ENTITY_ID = "mapped_entity_id";
    private static final String FIELD_PARENT_ID = "parent_entity_id";
    private static final String FIELD_HASH = "content_hash";
    private static final String FIELD_ITEM_ID = "item_id";
    private static final String FIELD_CREATED = "created_at";
    private static final String FIELD_MODIFIED = "modified_at";

    private final CourseIndexService indexService;

    public LuceneMappingStore(final CourseIndexService indexService) {
        this.indexService = indexService;
    }

    @Override
    public Optional<MappingRecord> lookup(final String scopeId, final String repoPath) throws IOException {
        return indexService.findOne(new TermQuery(keyTerm(scopeId, repoPath))).map(LuceneMappingStore::toRecord);
    }

    @Override
    public synchronized MappingRecord upsert(final String scopeId, final String repoPath, final MappingUpdate update)
            throws IOException {
        final Optional<MappingRecord> existing = lookup(scopeId, repoPath);
        final long now = System.currentTimeMillis();

        final MappingRecord merged;
        if (existing.isPresent()) {
            final MappingRecord current = existing.get();
            merged = new MappingRecord(scopeId, repoPath,
                    pick(update.entityId(), current.entityId()),
                    pick(update.parentEntityId(), current.parentEntityId()),
                    pick(update.contentHash(), current.contentHash()),
                    pick(update.itemId(), current.itemId()),
                    current.createdAt(), now);
        } else {
            merged = new MappingRecord(scopeId, repoPath, update.entityId(), update.parentEntityId(),
                    update.contentHash(), update.itemId(), now, now);
        }

        indexService.upsertDocument(keyTerm(scopeId, repoPath), toDocument(merged));
        logger.debug("Upserted mapping {}:{} -> {}", scopeId, repoPath, merged.entityId());
        return merged;
    }

    @Override
    public List<MappingRecord> list(final String scopeId) throws IOException {
        final Query query = new BooleanQuery.Builder()
                .add(new TermQuery(new Term(CourseIndexService.FIELD_DOC_TYPE, DOC_TYPE)), BooleanClause.Occur.FILTER)
                .add(new TermQuery(new Term(CourseIndexService.FIELD_SCOPE_ID, scopeId)), BooleanClause.Occur.FILTER)
                .build();
        final List<MappingRecord> records = new ArrayList<>();
        for (final Document document : indexService.findAll(query)) {
            records.add(toRecord(document));
        }
        records.sort(Comparator.comparing(MappingRecord::repoPath));
        return records;
    }

    private static @Nullable String pick(final @Nullable String update, final @Nullable String current) {
        return update != null ? update : current;
    }

    private static Term keyTerm(final String scopeId, final String repoPath) {
        return new Term(FIELD_KEY, scopeId + '\u0000' + repoPath);
    }

    private static Document toDocument(final MappingRecord record) {
        final Document doc = new Document();
        doc.add(new StringField(CourseIndexService.FIELD_DOC_TYPE, DOC_TYPE, Field.Store.YES));
        doc.add(new StringField(FIELD_KEY, record.scopeId() + '\u0000' + record.repoPath(), Field.Store.NO));
        doc.add(new StringField(CourseIndexService.FIELD_SCOPE_ID, record.scopeId(), Field.Store.YES));
        doc.add(new StringField(FIELD_REPO_PATH, record.repoPath(), Field.Store.YES));
        addIfPresent(doc, FIELD_ENTITY_ID, record.entityId());
        addIfPresent(doc, FIELD_PARENT_ID, record.parentEntityId());
        addIfPresent(doc, FIELD_HASH, record.contentHash());
        addIfPresent(doc, FIELD_ITEM_ID, record.itemId());
        doc.add(new StoredField(FIELD_CREATED, record.createdAt()));
        doc.add(new StoredField(FIELD_MODIFIED, record.modifiedAt()));
        return doc;
    }

    private static void addIfPresent(final Document doc, final String field, final @Nullable String value) {
        if (value != null) {
            doc.add(new StringField(field, value, Field.Store.YES));
        }
    }

    private static MappingRecord toRecord(final Document doc) {
        return new MappingRecord(
                doc.get(CourseIndexService.FIELD_SCOPE_ID),
                doc.get(FIELD_REPO_PATH),
                doc.get(FIELD_ENTITY_ID),
                doc.get(FIELD_PARENT_ID),
                doc.get(FIELD_HASH),
                doc.get(FIELD_ITEM_ID),
                longValue(doc, FIELD_CREATED),
                longValue(doc, FIELD_MODIFIED));
    }

    private static long longValue(final Document doc, final String field) {
        final Number value = doc.getField(field) != null ? doc.getField(field).numericValue() : null;
        return value != null ? value.longValue() : 0L;
    }
}
