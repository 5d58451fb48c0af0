package com.sealedstore;

import com.sealedstore.config.CryptoProperties;
import com.sealedstore.config.TransferProperties;
import com.sealedstore.crypto.AeadCipher;
import com.sealedstore.crypto.KeyDerivationService;
import com.sealedstore.crypto.SymmetricKey;
import com.sealedstore.file.FileCipher;
import com.sealedstore.metadata.FileMetadataRecord;
import com.sealedstore.metadata.MetadataCipher;
import com.sealedstore.metadata.MetadataDecryption;
import com.sealedstore.session.KeySessionService;
import com.sealedstore.transfer.FileCatalog;
import com.sealedstore.transfer.FileTransport;
import com.sealedstore.transfer.TransferOrchestrator;
import com.sealedstore.transfer.TransferTracker;
import com.sealedstore.vault.KeyVault;
import com.sealedstore.vault.VaultEntryRepository;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.ConfigDataApplicationContextInitializer;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.util.unit.DataSize;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Wires the core beans against the real {@code application.yml} without Cassandra:
 * the repository and the transport are Mockito mocks.
 */
class SealedStoreWiringTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withInitializer(new ConfigDataApplicationContextInitializer())
            .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class))
            .withUserConfiguration(CoreBeans.class, Collaborators.class);

    @Test
    void coreBeansAreCreated() {
        runner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context)
                    .hasSingleBean(AeadCipher.class)
                    .hasSingleBean(KeyDerivationService.class)
                    .hasSingleBean(FileCipher.class)
                    .hasSingleBean(MetadataCipher.class)
                    .hasSingleBean(KeyVault.class)
                    .hasSingleBean(KeySessionService.class)
                    .hasSingleBean(TransferTracker.class)
                    .hasSingleBean(TransferOrchestrator.class)
                    .hasSingleBean(FileCatalog.class);
        });
    }

    @Test
    void propertiesBindFromApplicationYml() {
        runner.run(context -> {
            CryptoProperties crypto = context.getBean(CryptoProperties.class);
            assertThat(crypto.pbkdf2Iterations()).isEqualTo(100_000);
            assertThat(crypto.saltLength()).isEqualTo(16);
            assertThat(crypto.minPasswordScore()).isEqualTo(3);

            TransferProperties transfer = context.getBean(TransferProperties.class);
            assertThat(transfer.maxFileSize()).isEqualTo(DataSize.ofMegabytes(50));
            assertThat(transfer.allowedMimeTypes()).contains("text/plain", "application/pdf");
            assertThat(transfer.isAllowed("application/x-msdownload")).isFalse();
        });
    }

    @Test
    void propertyOverridesReachTheRecords() {
        runner.withPropertyValues(
                        "sealedstore.crypto.pbkdf2-iterations=150000",
                        "sealedstore.transfer.max-file-size=5MB")
                .run(context -> {
                    assertThat(context.getBean(CryptoProperties.class).pbkdf2Iterations()).isEqualTo(150_000);
                    assertThat(context.getBean(TransferProperties.class).maxFileSize())
                            .isEqualTo(DataSize.ofMegabytes(5));
                });
    }

    @Test
    void iterationsBelowTheFloorStopTheContext() {
        runner.withPropertyValues("sealedstore.crypto.pbkdf2-iterations=1000")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void metadataCipherUsesTheContextObjectMapper() {
        runner.run(context -> {
            MetadataCipher cipher = context.getBean(MetadataCipher.class);
            SymmetricKey key = SymmetricKey.random();
            FileMetadataRecord record = new FileMetadataRecord("notes.txt", 12, "text/plain", null, null, null);

            String blob = cipher.encryptMetadata(record, key).block();
            MetadataDecryption result = cipher.decryptMetadataDetailed(blob, key).block();

            assertThat(result).isNotNull();
            assertThat(result.isFallback()).isFalse();
            assertThat(result.record().filename()).isEqualTo("notes.txt");
            assertThat(result.record().size()).isEqualTo(12);
        });
    }

    @Test
    void missingTransportBeanFailsStartup() {
        new ApplicationContextRunner()
                .withInitializer(new ConfigDataApplicationContextInitializer())
                .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class))
                .withUserConfiguration(CoreBeans.class, RepositoryOnly.class)
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .isInstanceOf(BeanCreationException.class)
                            .hasMessageContaining("FileTransport");
                });
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties({CryptoProperties.class, TransferProperties.class})
    @Import({AeadCipher.class, KeyDerivationService.class, FileCipher.class, MetadataCipher.class,
            KeyVault.class, KeySessionService.class, TransferTracker.class, TransferOrchestrator.class,
            FileCatalog.class})
    static class CoreBeans {
    }

    @Configuration(proxyBeanMethods = false)
    static class RepositoryOnly {

        @Bean
        VaultEntryRepository vaultEntryRepository() {
            return Mockito.mock(VaultEntryRepository.class);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @Import(RepositoryOnly.class)
    static class Collaborators {

        @Bean
        FileTransport fileTransport() {
            return Mockito.mock(FileTransport.class);
        }
    }
}
