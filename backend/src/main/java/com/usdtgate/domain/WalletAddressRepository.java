package com.usdtgate.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for per-user wallet usage.
 */
public interface WalletAddressRepository extends MongoRepository<WalletAddress, String>, WalletAddressRepositoryCustom {

    List<WalletAddress> findByUserIdOrderByLastUsedAtDesc(String userId);
}
