package com.libragraph.stash.core.test;

import com.libragraph.stash.core.access.AccessPolicy;
import com.libragraph.stash.core.config.StashSettings;
import com.libragraph.stash.core.db.JdbiProducer;
import com.libragraph.stash.core.note.NoteService;
import com.libragraph.stash.core.quota.OwnerLocks;
import com.libragraph.stash.core.quota.QuotaLedger;
import com.libragraph.stash.core.service.ObjectIngestor;
import com.libragraph.stash.core.service.ObjectService;
import com.libragraph.stash.core.storage.AtomicObjectWriter;
import com.libragraph.stash.core.storage.FilesystemObjectStore;
import com.libragraph.stash.core.storage.ObjectReader;
import com.libragraph.stash.formats.codecs.ZstdCodec;
import com.libragraph.stash.formats.registry.CodecRegistry;
import com.libragraph.stash.formats.sniff.ContentSniffer;
import org.h2.jdbcx.JdbcDataSource;
import org.jdbi.v3.core.Jdbi;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Wires the storage stack by hand over a private H2 database (PostgreSQL mode),
 * the same way the CDI container would.
 */
public final class StashTestFixture {

    public static final String SCHEMA = "/db/migration/V1__stash_schema.sql";

    public final StashSettings settings;
    public final Jdbi jdbi;
    public final CodecRegistry codecs;
    public final ContentSniffer sniffer;
    public final FilesystemObjectStore store;
    public final AtomicObjectWriter writer;
    public final ObjectReader reader;
    public final QuotaLedger quota;
    public final OwnerLocks locks;
    public final AccessPolicy access;
    public final ObjectIngestor ingestor;
    public final ObjectService objects;
    public final NoteService notes;

    private StashTestFixture(StashSettings settings) {
        this.settings = settings;
        this.jdbi = newDatabase();
        this.codecs = CodecRegistry.of(new ZstdCodec(6));
        this.sniffer = new ContentSniffer();
        this.store = new FilesystemObjectStore(settings);
        this.writer = new AtomicObjectWriter(settings, sniffer, codecs);
        this.reader = new ObjectReader(settings, store, codecs);
        this.quota = new QuotaLedger(jdbi, store, settings);
        this.locks = new OwnerLocks();
        this.access = new AccessPolicy();
        this.ingestor = new ObjectIngestor(settings, store, writer);
        this.objects = new ObjectService(jdbi, ingestor, reader, store, quota, locks, access);
        this.notes = new NoteService(jdbi, ingestor, reader, store, quota, locks, access);
    }

    public static StashTestFixture create(StashSettings settings) {
        return new StashTestFixture(settings);
    }

    public static StashTestFixture create(Path storageRoot) {
        return create(StashSettings.defaults(storageRoot));
    }

    /**
     * Fresh in-memory database with the production schema applied.
     */
    public static Jdbi newDatabase() {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:" + UUID.randomUUID()
                + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH;DB_CLOSE_DELAY=-1");
        Jdbi jdbi = JdbiProducer.create(ds);
        String schema = loadSchema();
        jdbi.useHandle(h -> h.createScript(schema).execute());
        return jdbi;
    }

    /**
     * Regular files currently in the storage root, temp files included.
     */
    public long fileCount() {
        try (Stream<Path> files = Files.list(store.root())) {
            return files.filter(Files::isRegularFile).count();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static String loadSchema() {
        try (InputStream in = StashTestFixture.class.getResourceAsStream(SCHEMA)) {
            if (in == null) {
                throw new IllegalStateException("Schema not on classpath: " + SCHEMA);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
