package com.sealedstore.vault;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface VaultEntryRepository extends ReactiveCassandraRepository<VaultEntry, String> {
    // Single record per user: findById(userId), save(entry), deleteById(userId)
}
