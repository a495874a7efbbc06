package com.taodividends.backend.repository;

import com.taodividends.backend.model.DividendRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

public interface DividendRecordRepository extends JpaRepository<DividendRecord, Long>,
        JpaSpecificationExecutor<DividendRecord> {
}
