package com.crewflow.crewflow_backend.guardrail;

import com.crewflow.crewflow_backend.TestFlows;
import com.crewflow.crewflow_backend.model.guardrail.GuardrailResult;
import com.crewflow.crewflow_backend.model.guardrail.TaskOutput;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.mockito.Mockito.*;

public class GuardrailEngineTest {

    private RecordCountSource source;
    private GuardrailEngine engine;

    @BeforeEach
    public void setUp() {
        ObjectMapper mapper = new ObjectMapper();
        source = mock(RecordCountSource.class);
        engine = new GuardrailEngine(TestFlows.guardrailFactory(mapper, source), mapper);
    }

    @Test
    public void shouldValidateWithJsonStringConfig() {
        GuardrailResult result = engine.validate(TaskOutput.text(TestFlows.companyList(12)),
                "{\"type\": \"company_count\", \"minimum_count\": 50}");

        Assertions.assertFalse(result.valid());
        Assertions.assertTrue(result.feedback().contains("12"));
        Assertions.assertTrue(result.feedback().contains("50"));
    }

    @Test
    public void shouldJudgeOpaqueOutputAsUtf8() {
        byte[] json = "{\"total_count\": 14, \"note\": \"Zürich\"}".getBytes(StandardCharsets.UTF_8);
        Map<String, Object> rule = Map.of("type", "minimum_number", "min_value", 10);

        Assertions.assertTrue(engine.validate(TaskOutput.opaque(json), rule).valid());

        byte[] companies = TestFlows.companyList(2).getBytes(StandardCharsets.UTF_8);
        GuardrailResult tooFew = engine.validate(TaskOutput.opaque(companies),
                Map.of("type", "company_count", "min_companies", 3));
        Assertions.assertFalse(tooFew.valid());
        Assertions.assertTrue(tooFew.feedback().contains("2"));
    }

    @Test
    public void shouldRejectUnknownType() {
        GuardrailResult result = engine.validate(TaskOutput.text("x"), Map.of("type", "tone"));

        Assertions.assertFalse(result.valid());
        Assertions.assertEquals("Unknown guardrail type: tone", result.feedback());
    }

    @Test
    public void shouldRejectUnparsableConfig() {
        GuardrailResult result = engine.validate(TaskOutput.text("x"), "{not json");

        Assertions.assertFalse(result.valid());
        Assertions.assertTrue(result.feedback().startsWith("Invalid guardrail configuration"));
    }

    @Test
    public void shouldTurnGuardrailExceptionIntoRejection() {
        // A non-numeric minimum makes the guardrail itself throw
        GuardrailResult result = engine.validate(TaskOutput.text("x"),
                Map.of("type", "data_processing_count", "minimum_count", "lots"));

        Assertions.assertFalse(result.valid());
        Assertions.assertTrue(result.feedback().contains("data_processing_count"));
    }

    @Test
    public void shouldConsultCountSourceForDataGuardrails() {
        when(source.countTotal()).thenReturn(0L);

        GuardrailResult result = engine.validate(TaskOutput.text(""), Map.of("type", "empty_data_processing"));

        Assertions.assertTrue(result.valid());
        verify(source).countTotal();
    }
}
