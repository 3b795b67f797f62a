package com.clipforge.test;

import com.clipforge.api.response.Response;
import com.clipforge.trigger.http.GlobalApiExceptionHandler;
import com.clipforge.types.enums.ResponseCode;
import com.clipforge.types.exception.BudgetExceededException;
import com.clipforge.types.exception.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class GlobalApiExceptionHandlerTest {

    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        this.mockMvc = MockMvcBuilders.standaloneSetup(new ErrorController())
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldReturnAppExceptionCode() throws Exception {
        mockMvc.perform(get("/api/test/config-error"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.CONFIGURATION_ERROR.getCode()))
                .andExpect(jsonPath("$.info").value("video backend base-url is blank"));
    }

    @Test
    public void shouldTruncateLongInfo() throws Exception {
        mockMvc.perform(get("/api/test/budget-error"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.BUDGET_EXCEEDED.getCode()))
                .andExpect(jsonPath("$.info").value("x".repeat(300)));
    }

    @Test
    public void shouldHandleUnknownException() throws Exception {
        mockMvc.perform(get("/api/test/runtime-error"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.UN_ERROR.getCode()))
                .andExpect(jsonPath("$.info").value(ResponseCode.UN_ERROR.getInfo()));
    }

    @Test
    public void shouldHandleTypeMismatchExceptionAsIllegalParameter() throws Exception {
        mockMvc.perform(get("/api/test/type-error/not-number"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()));
    }

    @Test
    public void shouldHandleIllegalArgumentAsIllegalParameter() throws Exception {
        mockMvc.perform(get("/api/test/argument-error"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()))
                .andExpect(jsonPath("$.info").value("Unknown platform code: myspace"));
    }

    @RestController
    private static class ErrorController {

        @GetMapping("/api/test/config-error")
        public Response<Void> configError() {
            throw new ConfigurationException("video backend base-url is blank");
        }

        @GetMapping("/api/test/budget-error")
        public Response<Void> budgetError() {
            throw new BudgetExceededException("x".repeat(500));
        }

        @GetMapping("/api/test/runtime-error")
        public Response<Void> runtimeError() {
            throw new IllegalStateException("boom");
        }

        @GetMapping("/api/test/type-error/{id}")
        public Response<Void> typeError(@PathVariable("id") Long id) {
            return Response.<Void>builder().code(ResponseCode.SUCCESS.getCode()).build();
        }

        @GetMapping("/api/test/argument-error")
        public Response<Void> argumentError() {
            throw new IllegalArgumentException("Unknown platform code: myspace");
        }
    }
}
