package com.quanta.playground.compiler;

import com.quanta.playground.compiler.ast.Program;
import com.quanta.playground.exception.CompilationException;
import com.quanta.playground.exception.ParseException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Quanta to Python pipeline: tokenize, parse, generate. Holds no per-call
 * state, so one instance can serve concurrent callers.
 */
public class QuantaCompiler {

    private static final Logger logger = LoggerFactory.getLogger(QuantaCompiler.class);

    private final Tokenizer tokenizer;
    private final Parser parser;
    private final CodeGenerator generator;

    public QuantaCompiler() {
        this(new CodeGenerator());
    }

    public QuantaCompiler(CodeGenerator generator) {
        this.tokenizer = new Tokenizer();
        this.parser = new Parser();
        this.generator = generator;
    }

    public String compile(String source) throws CompilationException {
        List<Token> tokens = tokenize(source);
        Program program = parse(tokens);
        String python = generate(program);
        logger.trace("Compiled {} chars into {} tokens, {} top-level statements, {} chars of Python",
                source.length(), tokens.size(), program.body().size(), python.length());
        return python;
    }

    public List<Token> tokenize(String source) throws CompilationException {
        return tokenizer.tokenize(source);
    }

    public Program parse(List<Token> tokens) throws ParseException {
        return parser.parse(tokens);
    }

    public String generate(Program program) {
        return generator.generate(program);
    }
}
