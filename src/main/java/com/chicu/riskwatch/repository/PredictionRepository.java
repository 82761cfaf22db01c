package com.chicu.riskwatch.repository;

import com.chicu.riskwatch.domain.PredictionEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PredictionRepository extends JpaRepository<PredictionEntity, Long> {
}
