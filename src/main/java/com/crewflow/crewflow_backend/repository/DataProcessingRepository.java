package com.crewflow.crewflow_backend.repository;

import com.crewflow.crewflow_backend.model.domain.DataProcessingRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DataProcessingRepository extends JpaRepository<DataProcessingRecord, Long> {

    long countByProcessedFalse();

    long countByCompanyNameIsNull();
}
