package com.taskaggregator.test;

import com.taskaggregator.api.response.Response;
import com.taskaggregator.trigger.http.GlobalApiExceptionHandler;
import com.taskaggregator.types.enums.ResponseCode;
import com.taskaggregator.types.exception.AppException;
import com.taskaggregator.types.exception.CollaboratorUnavailableException;
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
    public void shouldHandleAppException() throws Exception {
        mockMvc.perform(get("/api/test/app-error"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.DUPLICATE_RESPONSE.getCode()))
                .andExpect(jsonPath("$.info").value("重复提交"));
    }

    @Test
    public void shouldHandleCollaboratorUnavailableAsRetriable() throws Exception {
        mockMvc.perform(get("/api/test/collaborator-error"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.COLLABORATOR_UNAVAILABLE.getCode()));
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

    @RestController
    private static class ErrorController {

        @GetMapping("/api/test/app-error")
        public Response<Void> appError() {
            throw new AppException(ResponseCode.DUPLICATE_RESPONSE.getCode(), "重复提交");
        }

        @GetMapping("/api/test/collaborator-error")
        public Response<Void> collaboratorError() {
            throw new CollaboratorUnavailableException("response-authenticator", "timed out", null);
        }

        @GetMapping("/api/test/runtime-error")
        public Response<Void> runtimeError() {
            throw new RuntimeException("boom");
        }

        @GetMapping("/api/test/type-error/{id}")
        public Response<String> typeError(@PathVariable("id") Long id) {
            return Response.<String>builder()
                    .code(ResponseCode.SUCCESS.getCode())
                    .info(ResponseCode.SUCCESS.getInfo())
                    .data(String.valueOf(id))
                    .build();
        }
    }
}
