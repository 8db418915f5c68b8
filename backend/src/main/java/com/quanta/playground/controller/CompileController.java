package com.quanta.playground.controller;

import com.quanta.playground.dto.CompileRequest;
import com.quanta.playground.dto.CompileResponse;
import com.quanta.playground.dto.TranslateResponse;
import com.quanta.playground.service.QuantaCompilerService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api")
@Validated
public class CompileController {

    private static final Logger logger = LoggerFactory.getLogger(CompileController.class);

    private final QuantaCompilerService compilerService;

    public CompileController(QuantaCompilerService compilerService) {
        this.compilerService = compilerService;
    }

    @PostMapping("/compile")
    public ResponseEntity<CompileResponse> compile(@Valid @RequestBody CompileRequest request) {
        logger.info("Received compilation request (length: {} chars)", request.sourceCode().length());

        try {
            CompileResponse response = compilerService.compileAndExecute(request.normalizedSourceCode());

            logger.info("Compilation completed - Success: {}, Type: {}",
                       response.success(), response.resultType());

            return ResponseEntity.ok(response);

        } catch (Exception e) {
            logger.error("Unexpected error during compilation: {}", e.getMessage(), e);

            return ResponseEntity.internalServerError()
                    .body(CompileResponse.compilationError("Internal server error: " + e.getMessage()));
        }
    }

    @PostMapping("/translate")
    public ResponseEntity<TranslateResponse> translate(@Valid @RequestBody CompileRequest request) {
        logger.info("Received translation request (length: {} chars)", request.sourceCode().length());

        try {
            return ResponseEntity.ok(compilerService.translate(request.normalizedSourceCode()));
        } catch (Exception e) {
            logger.error("Unexpected error during translation: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError()
                    .body(TranslateResponse.error("Internal server error: " + e.getMessage()));
        }
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Quanta Playground Backend is healthy");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<CompileResponse> handleValidationException(MethodArgumentNotValidException e) {
        StringBuilder errorMessage = new StringBuilder("Validation error: ");

        e.getBindingResult().getFieldErrors().forEach(error ->
            errorMessage.append(error.getField())
                       .append(" - ")
                       .append(error.getDefaultMessage())
                       .append("; ")
        );

        logger.warn("Validation error: {}", errorMessage);

        return ResponseEntity.badRequest().body(CompileResponse.compilationError(errorMessage.toString()));
    }
}
