package de.mirkosertic.filevault;

import de.mirkosertic.filevault.config.BuildInfo;
import de.mirkosertic.filevault.model.Account;
import de.mirkosertic.filevault.model.OwnerRef;
import de.mirkosertic.filevault.model.Organization;
import de.mirkosertic.filevault.model.ShareLink;
import de.mirkosertic.filevault.model.StoredFile;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.LongPoint;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.Term;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Lucene-backed metadata store: accounts, organizations, stored file records and share links.
 * <p>
 * The store is a disposable cache over the storage tree. It manages one IndexWriter and an
 * NRT SearcherManager refreshed in the background. Reads issued after a write by the same
 * caller refresh the searcher first, so read-compare-write sequences see their own writes.
 * Single-document writes are atomic; serializing writes per key is the caller's job.
 */
public class MetadataStore {

    private static final Logger logger = LoggerFactory.getLogger(MetadataStore.class);

    static final String COMMIT_SCHEMA_VERSION = "schema_version";
    static final String COMMIT_SOFTWARE_VERSION = "software_version";

    private final String indexPath;
    private final long nrtRefreshIntervalMs;

    private Directory directory;
    private IndexWriter indexWriter;
    private SearcherManager searcherManager;
    private ScheduledExecutorService refreshScheduler;

    // Generation of the last write, and the write generation the searcher is known to include
    private final AtomicLong writeGeneration = new AtomicLong();
    private final AtomicLong refreshedGeneration = new AtomicLong();

    private int storedSchemaVersion = -1;
    private String storedSoftwareVersion;
    private boolean schemaUpgradeRequired;
    private boolean closed;

    public MetadataStore(final String indexPath, final long nrtRefreshIntervalMs) {
        this.indexPath = indexPath;
        this.nrtRefreshIntervalMs = nrtRefreshIntervalMs;
    }

    /**
     * Open (or create) the index. Must be called before using the store.
     */
    public void init() throws IOException {
        final Path path = Path.of(indexPath);
        if (!Files.exists(path)) {
            Files.createDirectories(path);
            logger.info("Created metadata index directory: {}", path.toAbsolutePath());
        }

        directory = FSDirectory.open(path);
        readSchemaVersion();

        final IndexWriterConfig config = new IndexWriterConfig(new StandardAnalyzer());
        config.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
        indexWriter = new IndexWriter(directory, config);

        // Stamp the current schema version into every subsequent commit
        indexWriter.setLiveCommitData(Map.of(
                COMMIT_SCHEMA_VERSION, Integer.toString(MetadataDocuments.SCHEMA_VERSION),
                COMMIT_SOFTWARE_VERSION, BuildInfo.getVersion()).entrySet(), true);
        indexWriter.commit();

        searcherManager = new SearcherManager(indexWriter, null);

        refreshScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "metadata-nrt-refresh");
            t.setDaemon(true);
            return t;
        });
        refreshScheduler.scheduleAtFixedRate(this::maybeRefreshSearcher,
                nrtRefreshIntervalMs, nrtRefreshIntervalMs, TimeUnit.MILLISECONDS);

        if (schemaUpgradeRequired) {
            logger.warn("Metadata index schema version {} is older than {} - run a full index rebuild",
                    storedSchemaVersion, MetadataDocuments.SCHEMA_VERSION);
        }
        logger.info("Metadata index initialized at: {} with NRT refresh interval {}ms",
                path.toAbsolutePath(), nrtRefreshIntervalMs);
    }

    private void readSchemaVersion() throws IOException {
        if (!DirectoryReader.indexExists(directory)) {
            schemaUpgradeRequired = false;
            return;
        }
        try (final DirectoryReader reader = DirectoryReader.open(directory)) {
            final Map<String, String> userData = reader.getIndexCommit().getUserData();
            storedSoftwareVersion = userData.get(COMMIT_SOFTWARE_VERSION);
            final String version = userData.get(COMMIT_SCHEMA_VERSION);
            if (version != null) {
                storedSchemaVersion = Integer.parseInt(version);
                schemaUpgradeRequired = storedSchemaVersion < MetadataDocuments.SCHEMA_VERSION;
            } else {
                // Unversioned index: only an upgrade concern if it holds documents
                schemaUpgradeRequired = reader.numDocs() > 0;
            }
        }
    }

    private void maybeRefreshSearcher() {
        try {
            searcherManager.maybeRefresh();
        } catch (final IOException e) {
            logger.warn("Failed to refresh SearcherManager", e);
        }
    }

    /**
     * Close the store and release all resources.
     */
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;

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
        logger.info("Metadata index closed");
    }

    public void commit() throws IOException {
        indexWriter.commit();
    }

    public String getIndexPath() {
        return indexPath;
    }

    public boolean isSchemaUpgradeRequired() {
        return schemaUpgradeRequired;
    }

    /**
     * Schema version found in the index when it was opened, -1 for a new or unversioned index.
     */
    public int getStoredSchemaVersion() {
        return storedSchemaVersion;
    }

    public String getStoredSoftwareVersion() {
        return storedSoftwareVersion;
    }

    public long getDocumentCount() throws IOException {
        final IndexSearcher searcher = acquireFresh();
        try {
            return searcher.getIndexReader().numDocs();
        } finally {
            searcherManager.release(searcher);
        }
    }

    // ==================== Accounts ====================

    public void saveAccount(final Account account) throws IOException {
        write(MetadataDocuments.accountKey(account.userId()), MetadataDocuments.fromAccount(account));
    }

    public Optional<Account> findAccount(final long userId) throws IOException {
        final Query query = new BooleanQuery.Builder()
                .add(MetadataDocuments.ofType(MetadataDocuments.TYPE_ACCOUNT), BooleanClause.Occur.FILTER)
                .add(LongPoint.newExactQuery(MetadataDocuments.FIELD_USER_ID, userId), BooleanClause.Occur.FILTER)
                .build();
        return searchFirst(query, MetadataDocuments::toAccount);
    }

    public Optional<Account> findAccountByApiKeyHash(final String apiKeyHash) throws IOException {
        final Query query = new BooleanQuery.Builder()
                .add(MetadataDocuments.ofType(MetadataDocuments.TYPE_ACCOUNT), BooleanClause.Occur.FILTER)
                .add(new TermQuery(new Term(MetadataDocuments.FIELD_API_KEY_HASH, apiKeyHash)), BooleanClause.Occur.FILTER)
                .build();
        return searchFirst(query, MetadataDocuments::toAccount);
    }

    public Optional<Account> findAccountByUsername(final String username) throws IOException {
        final Query query = new BooleanQuery.Builder()
                .add(MetadataDocuments.ofType(MetadataDocuments.TYPE_ACCOUNT), BooleanClause.Occur.FILTER)
                .add(new TermQuery(new Term(MetadataDocuments.FIELD_USERNAME, username)), BooleanClause.Occur.FILTER)
                .build();
        return searchFirst(query, MetadataDocuments::toAccount);
    }

    public List<Account> listAccounts() throws IOException {
        final List<Account> accounts = searchAll(MetadataDocuments.ofType(MetadataDocuments.TYPE_ACCOUNT),
                MetadataDocuments::toAccount);
        accounts.sort((a, b) -> Long.compare(a.userId(), b.userId()));
        return accounts;
    }

    // ==================== Organizations ====================

    public void saveOrganization(final Organization organization) throws IOException {
        write(MetadataDocuments.organizationKey(organization.orgId()), MetadataDocuments.fromOrganization(organization));
    }

    public Optional<Organization> findOrganization(final long orgId) throws IOException {
        final Query query = new BooleanQuery.Builder()
                .add(MetadataDocuments.ofType(MetadataDocuments.TYPE_ORGANIZATION), BooleanClause.Occur.FILTER)
                .add(LongPoint.newExactQuery(MetadataDocuments.FIELD_ORG_ID, orgId), BooleanClause.Occur.FILTER)
                .build();
        return searchFirst(query, MetadataDocuments::toOrganization);
    }

    public List<Organization> listOrganizations() throws IOException {
        final List<Organization> organizations = searchAll(
                MetadataDocuments.ofType(MetadataDocuments.TYPE_ORGANIZATION), MetadataDocuments::toOrganization);
        organizations.sort((a, b) -> Long.compare(a.orgId(), b.orgId()));
        return organizations;
    }

    // ==================== Stored files ====================

    public List<StoredFile> listStoredFiles(final OwnerRef owner) throws IOException {
        return searchAll(MetadataDocuments.storedFilesOf(owner), MetadataDocuments::toStoredFile);
    }

    public Optional<StoredFile> findStoredFile(final OwnerRef owner, final String path) throws IOException {
        final Query query = new TermQuery(MetadataDocuments.recordKeyTerm(owner.recordKey(path)));
        return searchFirst(query, MetadataDocuments::toStoredFile);
    }

    /**
     * Insert or replace the record with the same {@code (owner, path)}.
     */
    public void putStoredFile(final StoredFile file) throws IOException {
        write(file.recordKey(), MetadataDocuments.fromStoredFile(file));
    }

    public long countStoredFiles() throws IOException {
        return count(MetadataDocuments.ofType(MetadataDocuments.TYPE_STORED_FILE));
    }

    public void deleteStoredFile(final OwnerRef owner, final String path) throws IOException {
        indexWriter.deleteDocuments(MetadataDocuments.recordKeyTerm(owner.recordKey(path)));
        writeGeneration.incrementAndGet();
    }

    // ==================== Share links ====================

    public void saveShareLink(final ShareLink link) throws IOException {
        write(MetadataDocuments.shareLinkKey(link.token()), MetadataDocuments.fromShareLink(link));
    }

    public List<ShareLink> listShareLinks(final String fileRecordKey) throws IOException {
        return searchAll(MetadataDocuments.shareLinksOf(fileRecordKey), MetadataDocuments::toShareLink);
    }

    public long countShareLinks() throws IOException {
        return count(MetadataDocuments.ofType(MetadataDocuments.TYPE_SHARE_LINK));
    }

    /**
     * Delete all share links pointing at the given file record.
     *
     * @return the number of links deleted
     */
    public int deleteShareLinks(final String fileRecordKey) throws IOException {
        final Query query = MetadataDocuments.shareLinksOf(fileRecordKey);
        final int existing = (int) count(query);
        if (existing > 0) {
            indexWriter.deleteDocuments(query);
            writeGeneration.incrementAndGet();
        }
        return existing;
    }

    // ==================== Internals ====================

    private void write(final String recordKey, final Document document) throws IOException {
        indexWriter.updateDocument(MetadataDocuments.recordKeyTerm(recordKey), document);
        writeGeneration.incrementAndGet();
    }

    /**
     * Acquire a searcher that includes every write completed before this call.
     */
    private IndexSearcher acquireFresh() throws IOException {
        final long generation = writeGeneration.get();
        if (refreshedGeneration.get() < generation) {
            searcherManager.maybeRefreshBlocking();
            refreshedGeneration.accumulateAndGet(generation, Math::max);
        }
        return searcherManager.acquire();
    }

    private long count(final Query query) throws IOException {
        final IndexSearcher searcher = acquireFresh();
        try {
            return searcher.count(query);
        } finally {
            searcherManager.release(searcher);
        }
    }

    private <T> Optional<T> searchFirst(final Query query, final Function<Document, T> mapper) throws IOException {
        final IndexSearcher searcher = acquireFresh();
        try {
            final TopDocs topDocs = searcher.search(query, 1);
            if (topDocs.scoreDocs.length == 0) {
                return Optional.empty();
            }
            return Optional.of(mapper.apply(searcher.storedFields().document(topDocs.scoreDocs[0].doc)));
        } finally {
            searcherManager.release(searcher);
        }
    }

    private <T> List<T> searchAll(final Query query, final Function<Document, T> mapper) throws IOException {
        final IndexSearcher searcher = acquireFresh();
        try {
            final int total = searcher.count(query);
            final List<T> results = new ArrayList<>(total);
            if (total == 0) {
                return results;
            }
            final TopDocs topDocs = searcher.search(query, total);
            for (final ScoreDoc scoreDoc : topDocs.scoreDocs) {
                results.add(mapper.apply(searcher.storedFields().document(scoreDoc.doc)));
            }
            return results;
        } finally {
            searcherManager.release(searcher);
        }
    }
}
