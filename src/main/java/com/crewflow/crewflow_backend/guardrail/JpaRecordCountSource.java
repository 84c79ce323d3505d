package com.crewflow.crewflow_backend.guardrail;

import com.crewflow.crewflow_backend.repository.DataProcessingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaRecordCountSource implements RecordCountSource {

    private final DataProcessingRepository repository;
    private final JdbcTemplate jdbcTemplate;

    @Override
    public long countTotal() {
        return repository.count();
    }

    @Override
    public long countUnprocessed() {
        return repository.countByProcessedFalse();
    }

    @Override
    public long countMissingCompanyName() {
        return repository.countByCompanyNameIsNull();
    }

    @Override
    public void createIfMissing() {
        log.info("[GUARDRAIL] Ensuring data_processing table exists");
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS data_processing ("
                + "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                + "che_number VARCHAR(255) NOT NULL UNIQUE, "
                + "processed BOOLEAN NOT NULL DEFAULT FALSE, "
                + "company_name VARCHAR(255), "
                + "created_at TIMESTAMP, "
                + "updated_at TIMESTAMP)");
    }
}
