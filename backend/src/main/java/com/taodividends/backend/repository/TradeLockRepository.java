package com.taodividends.backend.repository;

import com.taodividends.backend.model.TradeLock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;

public interface TradeLockRepository extends JpaRepository<TradeLock, String> {

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from TradeLock l where l.lockKey = :lockKey and l.expiresAt <= :now")
    int deleteExpired(@Param("lockKey") String lockKey, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from TradeLock l where l.lockKey = :lockKey and l.holderId = :holderId")
    int deleteByLockKeyAndHolder(@Param("lockKey") String lockKey, @Param("holderId") String holderId);
}
