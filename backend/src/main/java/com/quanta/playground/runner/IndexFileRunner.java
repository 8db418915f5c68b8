package com.quanta.playground.runner;

import com.quanta.playground.compiler.QuantaCompiler;
import com.quanta.playground.config.QuantaRunnerProperties;
import com.quanta.playground.service.PythonExecutor;
import com.quanta.playground.service.PythonExecutor.ExecutionResult;
import com.quanta.playground.service.SourceFileLoader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * On startup, compiles {@code index.quanta} from the configured directory and runs the result.
 */
@Component
@ConditionalOnProperty(prefix = "quanta.runner", name = "enabled", havingValue = "true")
public class IndexFileRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(IndexFileRunner.class);

    private final QuantaRunnerProperties properties;
    private final SourceFileLoader loader;
    private final QuantaCompiler compiler;
    private final PythonExecutor executor;

    public IndexFileRunner(QuantaRunnerProperties properties, SourceFileLoader loader,
                           QuantaCompiler compiler, PythonExecutor executor) {
        this.properties = properties;
        this.loader = loader;
        this.compiler = compiler;
        this.executor = executor;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        ExecutionResult result = runIndexFile();
        if (!result.success()) {
            logger.error("{} failed (exit code {}):\n{}", properties.fileName(), result.exitCode(), result.output());
            return;
        }
        logger.info("{} output:\n{}", properties.fileName(), result.output());
    }

    ExecutionResult runIndexFile() throws Exception {
        String source = loader.load(Path.of(properties.directory()), properties.fileName());
        String python = compiler.compile(source);
        logger.debug("Generated Python:\n{}", python);
        return executor.execute(python);
    }
}
