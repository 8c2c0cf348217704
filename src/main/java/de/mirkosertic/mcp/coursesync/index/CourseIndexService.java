package de.mirkosertic.mcp.coursesync.index;

import de.mirkosertic.mcp.coursesync.config.ApplicationConfig;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.Term;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.queryparser.classic.QueryParser;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Owns the Lucene index shared by the mapping store, the sync history and the bundled content store.
 * <p>
 * Writes are committed immediately and the {@link SearcherManager} is refreshed before returning,
 * so a lookup following an upsert always sees it. A background task additionally refreshes
 * the searcher at the configured NRT interval.
 */
public class CourseIndexService {

    private static final Logger logger = LoggerFactory.getLogger(CourseIndexService.class);

    public static final String FIELD_DOC_TYPE = "doc_type";
    public static final String FIELD_SCOPE_ID = "scope_id";
    public static final String FIELD_SEARCHABLE = "searchable";
    public static final String FIELD_CONTENT = "content";
    public static final String FIELD_NAME = "name";

    private final @Nullable String indexPath;
    private final long nrtRefreshIntervalMs;
    private final StandardAnalyzer analyzer;

    private Directory directory;
    private IndexWriter indexWriter;
    private SearcherManager searcherManager;
    private ScheduledExecutorService refreshScheduler;

    public CourseIndexService(final ApplicationConfig config) {
        this.indexPath = config.getIndexPath();
        this.nrtRefreshIntervalMs = config.getNrtRefreshIntervalMs();
        this.analyzer = new StandardAnalyzer();
    }

    /**
     * Uses an already opened directory, typically a {@code ByteBuffersDirectory} in tests.
     */
    public CourseIndexService(final Directory directory, final long nrtRefreshIntervalMs) {
        this.indexPath = null;
        this.directory = directory;
        this.nrtRefreshIntervalMs = nrtRefreshIntervalMs;
        this.analyzer = new StandardAnalyzer();
    }

    /**
     * Initialize the Lucene index. Must be called before using the service.
     */
    public void init() throws IOException {
        if (directory == null) {
            final Path path = Path.of(indexPath);
            if (!Files.exists(path)) {
                Files.createDirectories(path);
                logger.info("Created index directory: {}", path.toAbsolutePath());
            }
            directory = FSDirectory.open(path);
        }

        final IndexWriterConfig config = new IndexWriterConfig(analyzer);
        config.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
        indexWriter = new IndexWriter(directory, config);

        // Commit to ensure index files are created
        indexWriter.commit();

        searcherManager = new SearcherManager(indexWriter, null);

        refreshScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "lucene-nrt-refresh");
            t.setDaemon(true);
            return t;
        });
        refreshScheduler.scheduleAtFixedRate(this::maybeRefreshSearcher,
                nrtRefreshIntervalMs, nrtRefreshIntervalMs, TimeUnit.MILLISECONDS);

        logger.info("Course index initialized at: {} with NRT refresh interval {}ms",
                indexPath != null ? indexPath : directory, nrtRefreshIntervalMs);
    }

    private void maybeRefreshSearcher() {
        try {
            searcherManager.maybeRefresh();
        } catch (final IOException e) {
            logger.warn("Failed to refresh SearcherManager", e);
        }
    }

    /**
     * Close the index service and release all resources.
     */
    public void close() throws IOException {
        if (refreshScheduler != null) {
            refreshScheduler.shutdown();
            try {
                if (!refreshScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    refreshScheduler.shutdownNow();
                }
            } catch (final InterruptedException e) {
                refreshScheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        // Close SearcherManager before IndexWriter
        if (searcherManager != null) {
            searcherManager.close();
        }
        if (indexWriter != null) {
            indexWriter.close();
        }
        if (directory != null) {
            directory.close();
        }
        logger.info("Course index closed");
    }

    /**
     * Replaces every document matching {@code key} with {@code document} and makes the change visible.
     */
    public void upsertDocument(final Term key, final Document document) throws IOException {
        indexWriter.updateDocument(key, document);
        commitAndRefresh();
    }

    public void addDocument(final Document document) throws IOException {
        indexWriter.addDocument(document);
        commitAndRefresh();
    }

    public void deleteDocuments(final Term key) throws IOException {
        indexWriter.deleteDocuments(key);
        commitAndRefresh();
    }

    private void commitAndRefresh() throws IOException {
        indexWriter.commit();
        searcherManager.maybeRefreshBlocking();
    }

    public Optional<Document> findOne(final Query query) throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final TopDocs topDocs = searcher.search(query, 1);
            if (topDocs.scoreDocs.length == 0) {
                return Optional.empty();
            }
            return Optional.of(searcher.storedFields().document(topDocs.scoreDocs[0].doc));
        } finally {
            searcherManager.release(searcher);
        }
    }

    /**
     * Returns the stored fields of every matching document, in index order.
     */
    public List<Document> findAll(final Query query) throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final int count = searcher.count(query);
            final List<Document> documents = new ArrayList<>(count);
            if (count == 0) {
                return documents;
            }
            final TopDocs topDocs = searcher.search(query, count);
            for (final ScoreDoc scoreDoc : topDocs.scoreDocs) {
                documents.add(searcher.storedFields().document(scoreDoc.doc));
            }
            return documents;
        } finally {
            searcherManager.release(searcher);
        }
    }

    /**
     * Full-text search over the searchable content documents, optionally limited to one course.
     */
    public SearchResult search(final String queryString, final @Nullable String scopeId,
                               final int page, final int pageSize) throws IOException, ParseException {

        if (queryString == null || queryString.isBlank()) {
            return new SearchResult(List.of(), 0, page, pageSize);
        }

        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final QueryParser parser = new QueryParser(FIELD_CONTENT, analyzer);
            final Query mainQuery = parser.parse(queryString);

            final BooleanQuery.Builder builder = new BooleanQuery.Builder();
            builder.add(mainQuery, BooleanClause.Occur.MUST);
            builder.add(new TermQuery(new Term(FIELD_SEARCHABLE, "true")), BooleanClause.Occur.FILTER);
            if (scopeId != null && !scopeId.isBlank()) {
                builder.add(new TermQuery(new Term(FIELD_SCOPE_ID, scopeId)), BooleanClause.Occur.FILTER);
            }

            final int startIndex = page * pageSize;
            final int maxResults = startIndex + pageSize;

            final TopDocs topDocs = searcher.search(builder.build(), maxResults);
            final long totalHits = topDocs.totalHits.value;

            final List<Map<String, Object>> results = new ArrayList<>();
            final ScoreDoc[] scoreDocs = topDocs.scoreDocs;
            for (int i = startIndex; i < scoreDocs.length && i < maxResults; i++) {
                final Document doc = searcher.storedFields().document(scoreDocs[i].doc);
                final Map<String, Object> docMap = new HashMap<>();
                docMap.put("score", scoreDocs[i].score);

                // Only essential fields, the full content stays in the index
                addFieldIfPresent(doc, docMap, FIELD_DOC_TYPE);
                addFieldIfPresent(doc, docMap, FIELD_SCOPE_ID);
                addFieldIfPresent(doc, docMap, FIELD_NAME);
                addFieldIfPresent(doc, docMap, "entity_id");
                addFieldIfPresent(doc, docMap, "parent_id");
                addFieldIfPresent(doc, docMap, "attr_activity_type");
                addFieldIfPresent(doc, docMap, "visible");

                final String content = doc.get(FIELD_CONTENT);
                if (content != null) {
                    docMap.put("snippet", createSnippet(content, queryString, 300));
                }
                results.add(docMap);
            }

            return new SearchResult(results, totalHits, page, pageSize);
        } finally {
            searcherManager.release(searcher);
        }
    }

    public long getDocumentCount() throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            return searcher.getIndexReader().numDocs();
        } finally {
            searcherManager.release(searcher);
        }
    }

    private void addFieldIfPresent(final Document doc, final Map<String, Object> map, final String fieldName) {
        final String value = doc.get(fieldName);
        if (value != null && !value.isEmpty()) {
            map.put(fieldName, value);
        }
    }

    private String createSnippet(final String content, final String queryString, final int maxLength) {
        if (content.isEmpty()) {
            return "";
        }

        final String[] terms = queryString.toLowerCase()
                .replaceAll("[(){}\\[\\]\":]", " ")
                .replaceAll("\\b(and|or|not)\\b", " ")
                .split("\\s+");

        final String lowerContent = content.toLowerCase();
        int bestPos = -1;
        for (final String term : terms) {
            if (term.length() > 2) {
                final int pos = lowerContent.indexOf(term);
                if (pos >= 0 && (bestPos < 0 || pos < bestPos)) {
                    bestPos = pos;
                }
            }
        }

        if (bestPos < 0) {
            return content.length() <= maxLength ? content : content.substring(0, maxLength) + "...";
        }

        final int snippetStart = Math.max(0, bestPos - 100);
        final int snippetEnd = Math.min(content.length(), bestPos + 200);
        String snippet = content.substring(snippetStart, snippetEnd);
        if (snippetStart > 0) {
            snippet = "..." + snippet;
        }
        if (snippetEnd < content.length()) {
            snippet = snippet + "...";
        }
        return snippet;
    }

    public record SearchResult(
            List<Map<String, Object>> documents,
            long totalHits,
            int page,
            int pageSize
    ) {
        public int totalPages() {
            return pageSize <= 0 ? 0 : (int) Math.ceil((double) totalHits / pageSize);
        }

        public boolean hasNextPage() {
            return page < totalPages() - 1;
        }

        public boolean hasPreviousPage() {
            return page > 0;
        }
    }
}
