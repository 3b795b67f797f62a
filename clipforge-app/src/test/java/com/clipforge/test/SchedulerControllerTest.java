package com.clipforge.test;

import com.clipforge.trigger.application.command.ProductionDispatchApplicationService;
import com.clipforge.trigger.http.GlobalApiExceptionHandler;
import com.clipforge.trigger.http.SchedulerController;
import com.clipforge.types.enums.ResponseCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class SchedulerControllerTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 2, 10, 0);

    private MockMvc mockMvc;
    private ProductionDispatchApplicationService dispatchService;

    @BeforeEach
    public void setUp() {
        this.dispatchService = mock(ProductionDispatchApplicationService.class);
        Clock clock = Clock.fixed(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC);
        this.mockMvc = MockMvcBuilders.standaloneSetup(new SchedulerController(dispatchService, clock))
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldRunOneTickAndReturnCounts() throws Exception {
        when(dispatchService.runTick(NOW)).thenReturn(new ProductionDispatchApplicationService.TickResult(
                NOW, false, false, 2, 0, 5, 1, 2, 1, 1, 0, 0, 0, 0));

        mockMvc.perform(post("/api/scheduler/tick"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.campaignCount").value(2))
                .andExpect(jsonPath("$.data.channelCount").value(5))
                .andExpect(jsonPath("$.data.dispatchedCount").value(1))
                .andExpect(jsonPath("$.data.budgetSkippedCount").value(1));
    }

    @Test
    public void shouldReturnErrorEnvelopeWhenTickAbandoned() throws Exception {
        when(dispatchService.runTick(NOW)).thenThrow(new IllegalStateException("store unreachable"));

        mockMvc.perform(post("/api/scheduler/tick"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.UN_ERROR.getCode()))
                .andExpect(jsonPath("$.info").value(ResponseCode.UN_ERROR.getInfo()));
    }
}
