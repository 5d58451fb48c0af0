package com.sealedstore.transfer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sealedstore.crypto.AeadCipher;
import com.sealedstore.crypto.SymmetricKey;
import com.sealedstore.metadata.FileMetadataRecord;
import com.sealedstore.metadata.MetadataCipher;
import com.sealedstore.session.CryptoSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Listing and search over encrypted entries, with per-entry placeholders.
 */
class FileCatalogTest {

    private MetadataCipher metadataCipher;
    private FileCatalog catalog;
    private CryptoSession session;

    @BeforeEach
    void setup() {
        metadataCipher = new MetadataCipher(new AeadCipher(), new ObjectMapper());
        catalog = new FileCatalog(metadataCipher);
        session = new CryptoSession("user-1", SymmetricKey.random());
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private StoredFile stored(String fileId, String name, String mimeType, long size, SymmetricKey key) {
        FileMetadataRecord record = new FileMetadataRecord(name, size, mimeType, "a2V5", "bm9uY2Ux", "bm9uY2Uy");
        return new StoredFile(fileId, new EncryptedUpload(
                "Ym9keQ==",
                metadataCipher.encryptFilename(name, key).block(),
                metadataCipher.encryptMetadata(record, key).block()));
    }

    // ── Listing ───────────────────────────────────────────────────────────────

    @Test
    void describeDecryptsNameTypeAndSizeInOrder() {
        List<StoredFile> files = List.of(
                stored("f1", "a.txt", "text/plain", 11, session.masterKey()),
                stored("f2", "Report.pdf", "application/pdf", 2048, session.masterKey()));

        StepVerifier.create(catalog.describe(session, files))
                .expectNext(new FileListing("f1", "a.txt", "text/plain", 11, true))
                .expectNext(new FileListing("f2", "Report.pdf", "application/pdf", 2048, true))
                .verifyComplete();
    }

    @Test
    void unreadableEntryGetsPlaceholdersWithoutFailingTheListing() {
        SymmetricKey foreignKey = SymmetricKey.random();
        List<StoredFile> files = List.of(
                stored("f1", "secret.txt", "text/plain", 5, foreignKey),
                stored("f2", "a.txt", "text/plain", 11, session.masterKey()));

        StepVerifier.create(catalog.describe(session, files))
                .assertNext(listing -> {
                    assertEquals("f1", listing.fileId());
                    assertEquals(FileCatalog.UNREADABLE_NAME, listing.filename());
                    assertEquals(FileMetadataRecord.FALLBACK_MIME_TYPE, listing.mimeType());
                    assertEquals(0, listing.size());
                    assertFalse(listing.readable());
                })
                .assertNext(listing -> {
                    assertEquals("a.txt", listing.filename());
                    assertTrue(listing.readable());
                })
                .verifyComplete();
    }

    @Test
    void missingFilenameBlobFallsBackToTheMetadataName() {
        StoredFile full = stored("f1", "notes.txt", "text/plain", 3, session.masterKey());
        StoredFile noName = new StoredFile("f1",
                new EncryptedUpload(full.upload().encryptedBody(), null, full.upload().encryptedMetadata()));

        StepVerifier.create(catalog.describe(session, List.of(noName)))
                .expectNext(new FileListing("f1", "notes.txt", "text/plain", 3, true))
                .verifyComplete();
    }

    @Test
    void closedSessionFailsTheListing() {
        List<StoredFile> files = List.of(stored("f1", "a.txt", "text/plain", 11, session.masterKey()));
        session.close();

        StepVerifier.create(catalog.describe(session, files))
                .expectError(IllegalStateException.class)
                .verify();
    }

    // ── Search ────────────────────────────────────────────────────────────────

    @Test
    void searchMatchesDecryptedNamesCaseInsensitively() {
        List<StoredFile> files = List.of(
                stored("f1", "Quarterly Report.pdf", "application/pdf", 10, session.masterKey()),
                stored("f2", "holiday.png", "image/png", 20, session.masterKey()),
                stored("f3", "report-draft.txt", "text/plain", 30, session.masterKey()));

        StepVerifier.create(catalog.search(session, files, " REPORT "))
                .assertNext(listing -> assertEquals("f1", listing.fileId()))
                .assertNext(listing -> assertEquals("f3", listing.fileId()))
                .verifyComplete();

        StepVerifier.create(catalog.search(session, files, ""))
                .expectNextCount(3)
                .verifyComplete();
    }
}
