package com.chicu.riskwatch.repository;

import com.chicu.riskwatch.domain.StudentRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.time.Instant;
import java.util.List;

public interface StudentRecordRepository extends JpaRepository<StudentRecordEntity, Long> {

    List<StudentRecordEntity> findByLastUpdatedAfterOrderByIdAsc(Instant since);

    List<StudentRecordEntity> findByIsActiveIsNotNullOrderByIdAsc();

    @Query("select count(s) from StudentRecordEntity s where s.studentId is null or s.studentId = ''")
    long countMissingStudentIds();
}
