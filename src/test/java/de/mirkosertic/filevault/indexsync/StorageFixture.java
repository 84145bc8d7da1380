package de.mirkosertic.filevault.indexsync;

import de.mirkosertic.filevault.MetadataStore;
import de.mirkosertic.filevault.model.Account;
import de.mirkosertic.filevault.model.Organization;
import de.mirkosertic.filevault.model.OwnerRef;
import de.mirkosertic.filevault.model.ShareLink;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Temp storage tree plus a real metadata store, for engine tests.
 */
public final class StorageFixture implements AutoCloseable {

    public final Path storageRoot;
    public final Path sharedRoot;
    public final MetadataStore store;

    public StorageFixture(final Path tempDir) throws IOException {
        this.storageRoot = tempDir.resolve("storage");
        this.sharedRoot = tempDir.resolve("shared");
        Files.createDirectories(storageRoot);
        Files.createDirectories(sharedRoot);
        this.store = new MetadataStore(tempDir.resolve("index").toString(), 50);
        this.store.init();
    }

    public Account createUser(final long userId) throws IOException {
        return createUser(userId, false, null);
    }

    public Account createUser(final long userId, final boolean admin, final String apiKeyHash) throws IOException {
        final Account account = new Account(userId, "acct-" + userId, "user" + userId, admin, apiKeyHash);
        store.saveAccount(account);
        store.commit();
        Files.createDirectories(rootOf(account));
        return account;
    }

    public Organization createOrganization(final long orgId) throws IOException {
        final Organization organization = new Organization(orgId, "org" + orgId);
        store.saveOrganization(organization);
        store.commit();
        Files.createDirectories(sharedRoot.resolve(Long.toString(orgId)));
        return organization;
    }

    public Path rootOf(final Account account) {
        return storageRoot.resolve(account.accountId());
    }

    public Path writeFile(final Account account, final String relativePath, final int size) throws IOException {
        return writeFile(rootOf(account), relativePath, size);
    }

    public Path writeSharedFile(final Organization organization, final String relativePath, final int size)
            throws IOException {
        return writeFile(sharedRoot.resolve(Long.toString(organization.orgId())), relativePath, size);
    }

    private static Path writeFile(final Path root, final String relativePath, final int size) throws IOException {
        final Path file = root.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.write(file, new byte[size]);
        return file;
    }

    public ShareLink share(final OwnerRef owner, final String path, final String token) throws IOException {
        final ShareLink link = new ShareLink(token, owner, path, System.currentTimeMillis(), null, false);
        store.saveShareLink(link);
        return link;
    }

    public IndexSyncService newService(final OrphanPolicy policy, final int threads) {
        return new IndexSyncService(store, new FilesystemScanner(), storageRoot, sharedRoot, policy,
                new SyncWorkerPool(threads));
    }

    @Override
    public void close() throws IOException {
        store.close();
    }
}
