package me.christianrobert.vbs2js.transformer.rest;

import me.christianrobert.vbs2js.transformer.context.Diagnostics;
import me.christianrobert.vbs2js.transformer.context.TranspilationResult;
import me.christianrobert.vbs2js.transformer.service.TranspilationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class TranspilationResourceTest {

    private TranspilationResource resource;
    private TranspilationService service;

    @BeforeEach
    void setUp() {
        service = Mockito.mock(TranspilationService.class);
        resource = new TranspilationResource();
        resource.transpilationService = service;
    }

    @Test
    void delegatesToService() {
        TranspilationResult expected = TranspilationResult.success("x = 1", "x = 1;\n", new Diagnostics(),
                List.of(), List.of(), List.of());
        when(service.transpile("x = 1")).thenReturn(expected);

        TranspilationResult result = resource.transpile("x = 1");

        assertSame(expected, result);
        verify(service).transpile("x = 1");
    }

    @Test
    void emptyBody_isFailureWithoutCallingService() {
        TranspilationResult result = resource.transpile("  ");

        assertTrue(result.isFailure());
        assertEquals("VBScript source cannot be empty", result.getErrorMessage());
        verifyNoInteractions(service);
    }

    @Test
    void serviceException_isReportedAsFailure() {
        when(service.transpile(anyString())).thenThrow(new IllegalStateException("boom"));

        TranspilationResult result = resource.transpile("x = 1");

        assertTrue(result.isFailure());
        assertEquals("Transpilation error: boom", result.getErrorMessage());
        assertEquals("x = 1", result.getVbScript());
    }

    @Test
    void failureResult_isPassedThrough() {
        when(service.transpile(anyString())).thenReturn(TranspilationResult.failure("Sub S()", "Line 1: not closed"));

        TranspilationResult result = resource.transpile("Sub S()");

        assertTrue(result.isFailure());
        assertEquals("Line 1: not closed", result.getErrorMessage());
    }
}
