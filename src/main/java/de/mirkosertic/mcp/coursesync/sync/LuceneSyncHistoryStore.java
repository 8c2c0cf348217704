package de.mirkosertic.mcp.coursesync.sync;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.coursesync.index.CourseIndexService;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.TermQuery;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * {@link SyncHistoryStore} kept as {@code doc_type=sync_history} documents in the course index.
 * The operation log is stored as JSON.
 */
public class LuceneSyncHistoryStore implements SyncHistoryStore {

    static final String DOC_TYPE = "sync_history";

    private static final String FIELD_USER = "triggering_user";
    private static final String FIELD_SNAPSHOT = "snapshot_identity";
    private static final String FIELD_STATUS = "status";
    private static final String FIELD_SUMMARY = "summary";
    private static final String FIELD_OPERATIONS = "operations_json";
    private static final String FIELD_TIMESTAMP = "timestamp";

    private static final TypeReference<List<OperationLogEntry>> OPERATION_LIST = new TypeReference<>() {
    };

    private final CourseIndexService indexService;
    private final ObjectMapper objectMapper;

    public LuceneSyncHistoryStore(final CourseIndexService indexService, final ObjectMapper objectMapper) {
        this.indexService = indexService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void append(final SyncHistoryRecord record) throws IOException {
        final Document doc = new Document();
        doc.add(new StringField(CourseIndexService.FIELD_DOC_TYPE, DOC_TYPE, Field.Store.YES));
        doc.add(new StringField(CourseIndexService.FIELD_SCOPE_ID, record.scopeId(), Field.Store.YES));
        doc.add(new StoredField(FIELD_USER, record.triggeringUser()));
        if (record.snapshotIdentity() != null) {
            doc.add(new StoredField(FIELD_SNAPSHOT, record.snapshotIdentity()));
        }
        doc.add(new StringField(FIELD_STATUS, record.status().code(), Field.Store.YES));
        doc.add(new StoredField(FIELD_SUMMARY, record.summary()));
        doc.add(new StoredField(FIELD_OPERATIONS, objectMapper.writeValueAsString(record.operations())));
        doc.add(new StoredField(FIELD_TIMESTAMP, record.timestamp()));
        indexService.addDocument(doc);
    }

    @Override
    public List<SyncHistoryRecord> list(final String scopeId, final int limit) throws IOException {
        final Query query = new BooleanQuery.Builder()
                .add(new TermQuery(new Term(CourseIndexService.FIELD_DOC_TYPE, DOC_TYPE)), BooleanClause.Occur.FILTER)
                .add(new TermQuery(new Term(CourseIndexService.FIELD_SCOPE_ID, scopeId)), BooleanClause.Occur.FILTER)
                .build();

        final List<SyncHistoryRecord> records = new ArrayList<>();
        for (final Document doc : indexService.findAll(query)) {
            records.add(toRecord(doc));
        }
        records.sort(Comparator.comparingLong(SyncHistoryRecord::timestamp).reversed());
        return records.size() > limit ? new ArrayList<>(records.subList(0, limit)) : records;
    }

    private SyncHistoryRecord toRecord(final Document doc) throws IOException {
        final String operationsJson = doc.get(FIELD_OPERATIONS);
        final List<OperationLogEntry> operations = operationsJson != null
                ? objectMapper.readValue(operationsJson, OPERATION_LIST)
                : List.of();
        final IndexableField timestamp = doc.getField(FIELD_TIMESTAMP);
        return new SyncHistoryRecord(
                doc.get(CourseIndexService.FIELD_SCOPE_ID),
                doc.get(FIELD_USER),
                doc.get(FIELD_SNAPSHOT),
                SyncStatus.fromCode(doc.get(FIELD_STATUS)),
                doc.get(FIELD_SUMMARY),
                operations,
                timestamp != null && timestamp.numericValue() != null ? timestamp.numericValue().longValue() : 0L);
    }
}
