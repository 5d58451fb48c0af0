package com.sealedstore.transfer;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.sealedstore.crypto.CryptoException;
import com.sealedstore.crypto.SymmetricKey;
import com.sealedstore.metadata.FileMetadataRecord;
import com.sealedstore.metadata.MetadataCipher;
import com.sealedstore.metadata.MetadataDecryption;
import com.sealedstore.session.CryptoSession;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Turns a server file listing into readable rows.
 *
 * Each entry is decrypted on its own: an entry whose name or metadata cannot be read
 * gets placeholder values and the listing carries on. Search filters on the decrypted
 * names, since the server only ever sees ciphertext.
 */
@Service
public class FileCatalog {

    private static final Logger log = LoggerFactory.getLogger(FileCatalog.class);

    public static final String UNREADABLE_NAME = "Encrypted File";

    private final MetadataCipher metadataCipher;

    public FileCatalog(MetadataCipher metadataCipher) {
        this.metadataCipher = metadataCipher;
    }

    public Flux<FileListing> describe(CryptoSession session, List<StoredFile> files) {
        return Flux.defer(() -> {
            SymmetricKey masterKey = session.masterKey();
            return Flux.fromIterable(files).concatMap(file -> describeOne(masterKey, file));
        });
    }

    /** Case-insensitive substring match on the decrypted name; a blank query matches everything. */
    public Flux<FileListing> search(CryptoSession session, List<StoredFile> files, String query) {
        String needle = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
        return describe(session, files)
                .filter(listing -> listing.filename().toLowerCase(Locale.ROOT).contains(needle));
    }

    private Mono<FileListing> describeOne(SymmetricKey masterKey, StoredFile file) {
        EncryptedUpload upload = file.upload();
        Mono<Optional<String>> name = metadataCipher.decryptFilename(upload.encryptedFilename(), masterKey)
                .map(Optional::of)
                .onErrorResume(CryptoException.class, e -> {
                    log.warn("Filename of file {} unreadable ({})", file.fileId(), e.getClass().getSimpleName());
                    return Mono.just(Optional.empty());
                });
        Mono<MetadataDecryption> metadata =
                metadataCipher.decryptMetadataDetailed(upload.encryptedMetadata(), masterKey);

        return Mono.zip(name, metadata)
                .map(parts -> toListing(file.fileId(), parts.getT1(), parts.getT2()));
    }

    private static FileListing toListing(String fileId, Optional<String> name, MetadataDecryption metadata) {
        FileMetadataRecord record = metadata.record();
        boolean readable = !metadata.isFallback();
        String filename = name.orElse(readable ? record.filename() : UNREADABLE_NAME);
        return new FileListing(fileId, filename, record.mimeType(), record.size(), readable);
    }
}
