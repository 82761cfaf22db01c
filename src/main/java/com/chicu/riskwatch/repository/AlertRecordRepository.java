package com.chicu.riskwatch.repository;

import com.chicu.riskwatch.domain.AlertRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AlertRecordRepository extends JpaRepository<AlertRecordEntity, Long> {
}
