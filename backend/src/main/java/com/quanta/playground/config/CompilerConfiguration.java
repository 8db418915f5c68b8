package com.quanta.playground.config;

import com.quanta.playground.compiler.CodeGenerator;
import com.quanta.playground.compiler.QuantaCompiler;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CompilerConfiguration {

    @Bean
    public QuantaCompiler quantaCompiler(QuantaCompilerProperties properties) {
        return new QuantaCompiler(new CodeGenerator(properties.indentUnit(), properties.endMarkers()));
    }
}
