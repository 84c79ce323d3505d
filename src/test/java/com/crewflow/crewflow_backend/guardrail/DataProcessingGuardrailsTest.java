package com.crewflow.crewflow_backend.guardrail;

import com.crewflow.crewflow_backend.model.guardrail.GuardrailResult;
import com.crewflow.crewflow_backend.model.guardrail.TaskOutput;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.mockito.Mockito.*;

public class DataProcessingGuardrailsTest {

    private RecordCountSource source;
    private CountProbe probe;
    private final TaskOutput output = TaskOutput.text("done");

    @BeforeEach
    public void setUp() {
        source = mock(RecordCountSource.class);
        probe = new CountProbe(source);
    }

    @Test
    public void shouldPassCountGuardrailAtExactlyTheMinimum() {
        GuardrailConfig config = new GuardrailConfig("data_processing_count",
                Map.of("type", "data_processing_count", "minimum_count", 10));
        DataProcessingCountGuardrail guardrail = new DataProcessingCountGuardrail(probe);

        when(source.countTotal()).thenReturn(10L);
        GuardrailResult atMinimum = guardrail.validate(output, config);
        when(source.countTotal()).thenReturn(9L);
        GuardrailResult belowMinimum = guardrail.validate(output, config);

        Assertions.assertTrue(atMinimum.valid());
        Assertions.assertFalse(belowMinimum.valid());
        Assertions.assertTrue(belowMinimum.feedback().contains("(9)"));
        Assertions.assertTrue(belowMinimum.feedback().contains("(10)"));
    }

    @Test
    public void shouldReportCountErrorAsRejection() {
        when(source.countTotal()).thenThrow(new IllegalStateException("timeout"));
        GuardrailConfig config = new GuardrailConfig("data_processing_count",
                Map.of("type", "data_processing_count", "minimum_count", 1));

        GuardrailResult result = new DataProcessingCountGuardrail(probe).validate(output, config);

        Assertions.assertFalse(result.valid());
        Assertions.assertEquals("Error checking data processing count: timeout", result.feedback());
    }

    @Test
    public void shouldRequireEmptyTable() {
        EmptyDataProcessingGuardrail guardrail = new EmptyDataProcessingGuardrail(probe);
        GuardrailConfig config = new GuardrailConfig("empty_data_processing", Map.of("type", "empty_data_processing"));

        when(source.countTotal()).thenReturn(3L);
        Assertions.assertEquals("The data_processing table contains 3 records. The table must be empty to proceed.",
                guardrail.validate(output, config).feedback());

        when(source.countTotal()).thenReturn(0L);
        Assertions.assertTrue(guardrail.validate(output, config).valid());
    }

    @Test
    public void shouldFlagNullCompanyNames() {
        CompanyNameNotNullGuardrail guardrail = new CompanyNameNotNullGuardrail(probe);
        GuardrailConfig config = new GuardrailConfig("company_name_not_null", Map.of("type", "company_name_not_null"));
        when(source.countTotal()).thenReturn(5L);
        when(source.countMissingCompanyName()).thenReturn(2L);

        GuardrailResult result = guardrail.validate(output, config);

        Assertions.assertFalse(result.valid());
        Assertions.assertTrue(result.feedback().startsWith("There are 2 records with null company_name"));
    }

    @Test
    public void shouldWaitForUnprocessedRecords() {
        DataProcessingGuardrail guardrail = new DataProcessingGuardrail(probe);
        GuardrailConfig config = new GuardrailConfig("data_processing", Map.of("type", "data_processing"));
        when(source.countTotal()).thenReturn(5L);
        when(source.countUnprocessed()).thenReturn(1L, 0L);

        Assertions.assertFalse(guardrail.validate(output, config).valid());
        Assertions.assertTrue(guardrail.validate(output, config).valid());
    }
}
