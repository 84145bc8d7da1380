package de.mirkosertic.filevault;

import de.mirkosertic.filevault.model.Account;
import de.mirkosertic.filevault.model.OwnerRef;
import de.mirkosertic.filevault.model.OwnerType;
import de.mirkosertic.filevault.model.Organization;
import de.mirkosertic.filevault.model.ShareLink;
import de.mirkosertic.filevault.model.StoredFile;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.LongPoint;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.TermQuery;

/**
 * Maps the domain records to Lucene documents and back, with a consistent field schema.
 * <p>
 * Every document carries a {@code doc_type} and a unique {@code record_key}; all writes
 * go through {@code updateDocument(record_key)} so a key never exists twice.
 */
public final class MetadataDocuments {

    /**
     * Schema version for the metadata index.
     * MUST be incremented whenever the index schema changes (fields added/removed/modified).
     * Version 1: Accounts, organizations, stored files and share links in one index.
     */
    public static final int SCHEMA_VERSION = 1;

    public static final String FIELD_DOC_TYPE = "doc_type";
    public static final String FIELD_RECORD_KEY = "record_key";

    static final String TYPE_ACCOUNT = "account";
    static final String TYPE_ORGANIZATION = "organization";
    static final String TYPE_STORED_FILE = "stored_file";
    static final String TYPE_SHARE_LINK = "share_link";

    static final String FIELD_OWNER = "owner";
    static final String FIELD_OWNER_TYPE = "owner_type";
    static final String FIELD_OWNER_ID = "owner_id";
    static final String FIELD_PATH = "path";
    static final String FIELD_NAME = "name";
    static final String FIELD_PARENT_PATH = "parent_path";
    static final String FIELD_SIZE = "size";
    static final String FIELD_CONTENT_TYPE = "content_type";
    static final String FIELD_IS_DIRECTORY = "is_directory";
    static final String FIELD_MODIFIED_AT = "modified_at";
    static final String FIELD_INDEXED_AT = "indexed_at";

    static final String FIELD_TOKEN = "token";
    static final String FIELD_FILE_KEY = "file_key";
    static final String FIELD_CREATED_AT = "created_at";
    static final String FIELD_EXPIRES_AT = "expires_at";
    static final String FIELD_REVOKED = "revoked";

    static final String FIELD_USER_ID = "user_id";
    static final String FIELD_ACCOUNT_ID = "account_id";
    static final String FIELD_USERNAME = "username";
    static final String FIELD_IS_ADMIN = "is_admin";
    static final String FIELD_API_KEY_HASH = "api_key_hash";

    static final String FIELD_ORG_ID = "org_id";
    static final String FIELD_ORG_NAME = "org_name";

    private MetadataDocuments() {
    }

    // ==================== Keys and queries ====================

    public static Term recordKeyTerm(final String recordKey) {
        return new Term(FIELD_RECORD_KEY, recordKey);
    }

    static String accountKey(final long userId) {
        return TYPE_ACCOUNT + ":" + userId;
    }

    static String organizationKey(final long orgId) {
        return TYPE_ORGANIZATION + ":" + orgId;
    }

    static String shareLinkKey(final String token) {
        return TYPE_SHARE_LINK + ":" + token;
    }

    static Query ofType(final String docType) {
        return new TermQuery(new Term(FIELD_DOC_TYPE, docType));
    }

    static Query storedFilesOf(final OwnerRef owner) {
        return new BooleanQuery.Builder()
                .add(ofType(TYPE_STORED_FILE), BooleanClause.Occur.FILTER)
                .add(new TermQuery(new Term(FIELD_OWNER, owner.key())), BooleanClause.Occur.FILTER)
                .build();
    }

    static Query shareLinksOf(final String fileRecordKey) {
        return new BooleanQuery.Builder()
                .add(ofType(TYPE_SHARE_LINK), BooleanClause.Occur.FILTER)
                .add(new TermQuery(new Term(FIELD_FILE_KEY, fileRecordKey)), BooleanClause.Occur.FILTER)
                .build();
    }

    // ==================== Stored files ====================

    public static Document fromStoredFile(final StoredFile file) {
        final Document doc = new Document();
        doc.add(new StringField(FIELD_DOC_TYPE, TYPE_STORED_FILE, Field.Store.YES));
        doc.add(new StringField(FIELD_RECORD_KEY, file.recordKey(), Field.Store.YES));
        addOwner(doc, file.owner());

        // path - unique within the owner (not analyzed, stored)
        doc.add(new StringField(FIELD_PATH, file.path(), Field.Store.YES));
        doc.add(new StoredField(FIELD_NAME, file.name()));
        doc.add(new StringField(FIELD_PARENT_PATH, file.parentPath(), Field.Store.YES));

        doc.add(new LongPoint(FIELD_SIZE, file.size()));
        doc.add(new StoredField(FIELD_SIZE, file.size()));

        doc.add(new StringField(FIELD_CONTENT_TYPE, file.contentType(), Field.Store.YES));
        doc.add(new StringField(FIELD_IS_DIRECTORY, Boolean.toString(file.directory()), Field.Store.YES));

        doc.add(new StoredField(FIELD_MODIFIED_AT, file.modifiedAt()));
        doc.add(new StoredField(FIELD_INDEXED_AT, file.indexedAt()));
        return doc;
    }

    public static StoredFile toStoredFile(final Document doc) {
        return new StoredFile(
                readOwner(doc),
                doc.get(FIELD_PATH),
                doc.get(FIELD_NAME),
                nullToEmpty(doc.get(FIELD_PARENT_PATH)),
                readLong(doc, FIELD_SIZE, 0L),
                nullToEmpty(doc.get(FIELD_CONTENT_TYPE)),
                Boolean.parseBoolean(doc.get(FIELD_IS_DIRECTORY)),
                readLong(doc, FIELD_MODIFIED_AT, 0L),
                readLong(doc, FIELD_INDEXED_AT, 0L));
    }

    // ==================== Share links ====================

    public static Document fromShareLink(final ShareLink link) {
        final Document doc = new Document();
        doc.add(new StringField(FIELD_DOC_TYPE, TYPE_SHARE_LINK, Field.Store.YES));
        doc.add(new StringField(FIELD_RECORD_KEY, shareLinkKey(link.token()), Field.Store.YES));
        addOwner(doc, link.owner());
        doc.add(new StringField(FIELD_TOKEN, link.token(), Field.Store.YES));
        doc.add(new StringField(FIELD_PATH, link.filePath(), Field.Store.YES));
        doc.add(new StringField(FIELD_FILE_KEY, link.fileRecordKey(), Field.Store.YES));
        doc.add(new StoredField(FIELD_CREATED_AT, link.createdAt()));
        if (link.expiresAt() != null) {
            doc.add(new StoredField(FIELD_EXPIRES_AT, link.expiresAt()));
        }
        doc.add(new StringField(FIELD_REVOKED, Boolean.toString(link.revoked()), Field.Store.YES));
        return doc;
    }

    public static ShareLink toShareLink(final Document doc) {
        final IndexableField expires = doc.getField(FIELD_EXPIRES_AT);
        return new ShareLink(
                doc.get(FIELD_TOKEN),
                readOwner(doc),
                doc.get(FIELD_PATH),
                readLong(doc, FIELD_CREATED_AT, 0L),
                expires != null ? Long.valueOf(readLong(doc, FIELD_EXPIRES_AT, 0L)) : null,
                Boolean.parseBoolean(doc.get(FIELD_REVOKED)));
    }

    // ==================== Accounts and organizations ====================

    public static Document fromAccount(final Account account) {
        final Document doc = new Document();
        doc.add(new StringField(FIELD_DOC_TYPE, TYPE_ACCOUNT, Field.Store.YES));
        doc.add(new StringField(FIELD_RECORD_KEY, accountKey(account.userId()), Field.Store.YES));
        doc.add(new LongPoint(FIELD_USER_ID, account.userId()));
        doc.add(new StoredField(FIELD_USER_ID, account.userId()));
        doc.add(new StringField(FIELD_ACCOUNT_ID, account.accountId(), Field.Store.YES));
        doc.add(new StringField(FIELD_USERNAME, account.username(), Field.Store.YES));
        doc.add(new StringField(FIELD_IS_ADMIN, Boolean.toString(account.admin()), Field.Store.YES));
        if (account.apiKeyHash() != null) {
            doc.add(new StringField(FIELD_API_KEY_HASH, account.apiKeyHash(), Field.Store.YES));
        }
        return doc;
    }

    public static Account toAccount(final Document doc) {
        return new Account(
                readLong(doc, FIELD_USER_ID, 0L),
                doc.get(FIELD_ACCOUNT_ID),
                doc.get(FIELD_USERNAME),
                Boolean.parseBoolean(doc.get(FIELD_IS_ADMIN)),
                doc.get(FIELD_API_KEY_HASH));
    }

    public static Document fromOrganization(final Organization organization) {
        final Document doc = new Document();
        doc.add(new StringField(FIELD_DOC_TYPE, TYPE_ORGANIZATION, Field.Store.YES));
        doc.add(new StringField(FIELD_RECORD_KEY, organizationKey(organization.orgId()), Field.Store.YES));
        doc.add(new LongPoint(FIELD_ORG_ID, organization.orgId()));
        doc.add(new StoredField(FIELD_ORG_ID, organization.orgId()));
        doc.add(new StoredField(FIELD_ORG_NAME, organization.name()));
        return doc;
    }

    public static Organization toOrganization(final Document doc) {
        return new Organization(readLong(doc, FIELD_ORG_ID, 0L), doc.get(FIELD_ORG_NAME));
    }

    // ==================== Helpers ====================

    private static void addOwner(final Document doc, final OwnerRef owner) {
        doc.add(new StringField(FIELD_OWNER, owner.key(), Field.Store.YES));
        doc.add(new StoredField(FIELD_OWNER_TYPE, owner.type().code()));
        doc.add(new StoredField(FIELD_OWNER_ID, owner.id()));
    }

    private static OwnerRef readOwner(final Document doc) {
        return new OwnerRef(OwnerType.fromCode(doc.get(FIELD_OWNER_TYPE)), doc.get(FIELD_OWNER_ID));
    }

    private static long readLong(final Document doc, final String field, final long fallback) {
        // Point fields share the name but carry no numeric value
        for (final IndexableField value : doc.getFields(field)) {
            if (value.numericValue() != null) {
                return value.numericValue().longValue();
            }
        }
        return fallback;
    }

    private static String nullToEmpty(final String value) {
        return value == null ? "" : value;
    }
}
