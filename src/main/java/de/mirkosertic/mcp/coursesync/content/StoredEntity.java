package de.mirkosertic.mcp.coursesync.content;

import de.mirkosertic.mcp.coursesync.index.CourseIndexService;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexableField;
import org.jspecify.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One entity of the bundled content store and its Lucene document form.
 * Attributes are stored only, except the few used for lookups, which are indexed as exact terms.
 */
record StoredEntity(
        String docType,
        String entityId,
        String scopeId,
        @Nullable String parentId,
        @Nullable String name,
        @Nullable String content,
        boolean visible,
        Map<String, String> attributes
) {

    static final String FIELD_ENTITY_ID = "entity_id";
    static final String FIELD_PARENT_ID = "parent_id";
    static final String FIELD_VISIBLE = "visible";
    static final String ATTR_PREFIX = "attr_";

    static final String ATTR_POSITION = "position";
    static final String ATTR_IMPORT_KEY = "import_key";

    private static final Set<String> INDEXED_ATTRIBUTES = Set.of(ATTR_POSITION, ATTR_IMPORT_KEY);
    private static final Set<String> SEARCHABLE_TYPES = Set.of(
            LuceneContentStore.TYPE_ACTIVITY, LuceneContentStore.TYPE_CHAPTER, LuceneContentStore.TYPE_LESSON_PAGE);

    StoredEntity {
        attributes = new LinkedHashMap<>(attributes);
    }

    static StoredEntity create(final String docType, final String entityId, final String scopeId,
                               final @Nullable String parentId) {
        return new StoredEntity(docType, entityId, scopeId, parentId, null, null, true, Map.of());
    }

    @Nullable String attribute(final String key) {
        return attributes.get(key);
    }

    int intAttribute(final String key, final int defaultValue) {
        final String value = attributes.get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (final NumberFormatException e) {
            return defaultValue;
        }
    }

    StoredEntity withAttribute(final String key, final @Nullable Object value) {
        final Map<String, String> copy = new LinkedHashMap<>(attributes);
        if (value == null) {
            copy.remove(key);
        } else {
            copy.put(key, value.toString());
        }
        return new StoredEntity(docType, entityId, scopeId, parentId, name, content, visible, copy);
    }

    StoredEntity withName(final @Nullable String newName) {
        return new StoredEntity(docType, entityId, scopeId, parentId, newName, content, visible, attributes);
    }

    StoredEntity withContent(final @Nullable String newContent) {
        return new StoredEntity(docType, entityId, scopeId, parentId, name, newContent, visible, attributes);
    }

    StoredEntity withParentId(final String newParentId) {
        return new StoredEntity(docType, entityId, scopeId, newParentId, name, content, visible, attributes);
    }

    StoredEntity withVisible(final boolean newVisible) {
        return new StoredEntity(docType, entityId, scopeId, parentId, name, content, newVisible, attributes);
    }

    Document toDocument() {
        final Document doc = new Document();
        doc.add(new StringField(CourseIndexService.FIELD_DOC_TYPE, docType, Field.Store.YES));
        doc.add(new StringField(FIELD_ENTITY_ID, entityId, Field.Store.YES));
        doc.add(new StringField(CourseIndexService.FIELD_SCOPE_ID, scopeId, Field.Store.YES));
        if (parentId != null) {
            doc.add(new StringField(FIELD_PARENT_ID, parentId, Field.Store.YES));
        }
        doc.add(new StringField(FIELD_VISIBLE, Boolean.toString(visible), Field.Store.YES));
        if (name != null) {
            doc.add(new TextField(CourseIndexService.FIELD_NAME, name, Field.Store.YES));
        }
        if (content != null) {
            doc.add(new TextField(CourseIndexService.FIELD_CONTENT, content, Field.Store.YES));
            if (SEARCHABLE_TYPES.contains(docType)) {
                doc.add(new StringField(CourseIndexService.FIELD_SEARCHABLE, "true", Field.Store.NO));
            }
        }
        for (final Map.Entry<String, String> attribute : attributes.entrySet()) {
            final String fieldName = ATTR_PREFIX + attribute.getKey();
            if (INDEXED_ATTRIBUTES.contains(attribute.getKey())) {
                doc.add(new StringField(fieldName, attribute.getValue(), Field.Store.YES));
            } else {
                doc.add(new StoredField(fieldName, attribute.getValue()));
            }
        }
        return doc;
    }

    static StoredEntity fromDocument(final Document doc) {
        final Map<String, String> attributes = new LinkedHashMap<>();
        for (final IndexableField field : doc.getFields()) {
            if (field.name().startsWith(ATTR_PREFIX) && field.stringValue() != null) {
                attributes.put(field.name().substring(ATTR_PREFIX.length()), field.stringValue());
            }
        }
        return new StoredEntity(
                doc.get(CourseIndexService.FIELD_DOC_TYPE),
                doc.get(FIELD_ENTITY_ID),
                doc.get(CourseIndexService.FIELD_SCOPE_ID),
                doc.get(FIELD_PARENT_ID),
                doc.get(CourseIndexService.FIELD_NAME),
                doc.get(CourseIndexService.FIELD_CONTENT),
                Boolean.parseBoolean(doc.get(FIELD_VISIBLE)),
                attributes);
    }
}
