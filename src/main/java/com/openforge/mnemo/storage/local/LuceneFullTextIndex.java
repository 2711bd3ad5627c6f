package com.openforge.mnemo.storage.local;

import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.cn.smart.SmartChineseAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.queryparser.classic.MultiFieldQueryParser;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.queryparser.classic.QueryParser;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.MatchNoDocsQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.ByteBuffersDirectory;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * In-memory Lucene index over the text fields of one document collection.
 *
 * Every String field, and every list of strings (joined with spaces), is indexed
 * as a {@link TextField}. Only the document id is stored; callers re-read the
 * document from the owning map. {@link SmartChineseAnalyzer} segments Chinese and
 * stems English, so mixed-language restatements search well.
 */
@Slf4j
public class LuceneFullTextIndex implements Closeable {

    static final String ID_FIELD = "id";

    private final Analyzer        analyzer;
    private final IndexWriter     writer;
    private final SearcherManager searcherManager;

    public LuceneFullTextIndex() {
        try {
            this.analyzer        = new SmartChineseAnalyzer();
            this.writer          = new IndexWriter(new ByteBuffersDirectory(), new IndexWriterConfig(analyzer));
            this.searcherManager = new SearcherManager(writer, null);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open in-memory full-text index", e);
        }
    }

    /** Adds or replaces the entry for {@code id}. */
    public void index(String id, Map<String, Object> document) {
        Document doc = new Document();
        doc.add(new StringField(ID_FIELD, id, Field.Store.YES));
        for (Map.Entry<String, Object> e : document.entrySet()) {
            if (ID_FIELD.equals(e.getKey())) continue;
            String text = asText(e.getValue());
            if (text != null && !text.isBlank()) {
                doc.add(new TextField(e.getKey(), text, Field.Store.NO));
            }
        }
        try {
            writer.updateDocument(new Term(ID_FIELD, id), doc);
            searcherManager.maybeRefreshBlocking();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to index document " + id, e);
        }
    }

    public void remove(String id) {
        try {
            writer.deleteDocuments(new Term(ID_FIELD, id));
            searcherManager.maybeRefreshBlocking();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to remove document " + id, e);
        }
    }

    /**
     * @return matching ids, most relevant first
     */
    public List<String> search(String text, List<String> fields, int limit) {
        if (text == null || text.isBlank() || fields == null || fields.isEmpty() || limit <= 0) {
            return List.of();
        }
        Query query = parse(text, fields);
        IndexSearcher searcher = null;
        try {
            searcher = searcherManager.acquire();
            TopDocs top = searcher.search(query, limit);
            StoredFields stored = searcher.storedFields();
            List<String> ids = new ArrayList<>(top.scoreDocs.length);
            for (ScoreDoc hit : top.scoreDocs) {
                ids.add(stored.document(hit.doc).get(ID_FIELD));
            }
            return ids;
        } catch (IOException e) {
            throw new UncheckedIOException("Full-text search failed", e);
        } finally {
            release(searcher);
        }
    }

    @Override
    public void close() throws IOException {
        searcherManager.close();
        writer.close();
        analyzer.close();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private Query parse(String text, List<String> fields) {
        MultiFieldQueryParser parser = new MultiFieldQueryParser(fields.toArray(String[]::new), analyzer);
        parser.setDefaultOperator(QueryParser.Operator.OR);
        try {
            Query query = parser.parse(QueryParser.escape(text));
            return query == null ? new MatchNoDocsQuery() : query;
        } catch (ParseException e) {
            log.debug("[FTS] Unparseable query '{}': {}", text, e.getMessage());
            return new MatchNoDocsQuery();
        }
    }

    private void release(IndexSearcher searcher) {
        if (searcher == null) return;
        try {
            searcherManager.release(searcher);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to release index searcher", e);
        }
    }

    private static String asText(Object value) {
        if (value instanceof String s) return s;
        if (value instanceof Collection<?> c) {
            return c.stream()
                    .filter(String.class::isInstance)
                    .map(String.class::cast)
                    .collect(Collectors.joining(" "));
        }
        return null;
    }
}
