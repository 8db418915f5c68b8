package com.quanta.playground.service;

import com.quanta.playground.compiler.QuantaCompiler;
import com.quanta.playground.config.QuantaCompilerProperties;
import com.quanta.playground.dto.CompileResponse;
import com.quanta.playground.dto.TranslateResponse;
import com.quanta.playground.exception.CompilationException;
import com.quanta.playground.exception.ExecutionException;
import com.quanta.playground.service.PythonExecutor.ExecutionResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class QuantaCompilerService {

    private static final Logger logger = LoggerFactory.getLogger(QuantaCompilerService.class);

    private final QuantaCompiler compiler;
    private final PythonExecutor executor;
    private final QuantaCompilerProperties properties;

    public QuantaCompilerService(QuantaCompiler compiler, PythonExecutor executor,
                                 QuantaCompilerProperties properties) {
        this.compiler = compiler;
        this.executor = executor;
        this.properties = properties;
    }

    public CompileResponse compileAndExecute(String sourceCode) {
        String rejection = validate(sourceCode);
        if (rejection != null) {
            return CompileResponse.compilationError(rejection);
        }

        long startTime = System.currentTimeMillis();
        String pythonCode;
        try {
            pythonCode = compiler.compile(sourceCode);
        } catch (CompilationException e) {
            logger.info("Compilation rejected: {}", e.getMessage());
            return CompileResponse.compilationError(e.getMessage());
        }

        try {
            ExecutionResult result = executor.execute(pythonCode);
            long executionTime = System.currentTimeMillis() - startTime;

            if (result.timedOut()) {
                return CompileResponse.timeout(result.output(), pythonCode);
            }
            if (result.success()) {
                return CompileResponse.success(result.output(), pythonCode, executionTime);
            }
            return CompileResponse.runtimeError(result.output(), pythonCode, executionTime);

        } catch (ExecutionException e) {
            long executionTime = System.currentTimeMillis() - startTime;
            logger.error("Execution failed: {}", e.getMessage());
            return CompileResponse.runtimeError(e.getMessage(), pythonCode, executionTime);
        }
    }

    public TranslateResponse translate(String sourceCode) {
        String rejection = validate(sourceCode);
        if (rejection != null) {
            return TranslateResponse.error(rejection);
        }

        try {
            return TranslateResponse.success(compiler.compile(sourceCode));
        } catch (CompilationException e) {
            logger.info("Translation rejected: {}", e.getMessage());
            return TranslateResponse.error(e.getMessage());
        }
    }

    private String validate(String sourceCode) {
        if (sourceCode == null || sourceCode.trim().isEmpty()) {
            return "Source code cannot be empty";
        }

        if (sourceCode.length() > properties.maxSourceCodeLength()) {
            return "Source code exceeds maximum length of " + properties.maxSourceCodeLength() + " characters";
        }
        return null;
    }
}
