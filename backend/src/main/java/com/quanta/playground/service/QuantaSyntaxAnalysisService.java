package com.quanta.playground.service;

import com.quanta.playground.compiler.QuantaCompiler;
import com.quanta.playground.compiler.Token;
import com.quanta.playground.dto.SyntaxAnalysisRequest;
import com.quanta.playground.dto.SyntaxAnalysisResponse;
import com.quanta.playground.dto.SyntaxToken;
import com.quanta.playground.exception.CompilationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class QuantaSyntaxAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(QuantaSyntaxAnalysisService.class);

    private final QuantaCompiler compiler;

    public QuantaSyntaxAnalysisService(QuantaCompiler compiler) {
        this.compiler = compiler;
    }

    /**
     * Tokenizes the request source and, when that succeeds, also checks that it parses.
     * A parse failure still returns the tokens so the editor can highlight them.
     */
    public SyntaxAnalysisResponse analyzeSyntax(SyntaxAnalysisRequest request) {
        long startTime = System.currentTimeMillis();
        String sourceCode = sanitizeInput(request.sourceCode());

        List<Token> raw;
        try {
            raw = compiler.tokenize(sourceCode);
        } catch (CompilationException e) {
            long analysisTime = System.currentTimeMillis() - startTime;
            logger.debug("Tokenization failed: {}", e.getMessage());
            return SyntaxAnalysisResponse.error(e.getMessage(), analysisTime);
        }

        List<SyntaxToken> tokens = raw.stream()
                .map(SyntaxToken::from)
                .toList();

        try {
            compiler.parse(raw);
        } catch (CompilationException e) {
            long analysisTime = System.currentTimeMillis() - startTime;
            logger.debug("Parsing failed after {} tokens: {}", tokens.size(), e.getMessage());
            return new SyntaxAnalysisResponse(false, tokens, e.getMessage(), analysisTime);
        }

        long analysisTime = System.currentTimeMillis() - startTime;
        logger.debug("Syntax analysis completed in {}ms with {} tokens", analysisTime, tokens.size());
        return SyntaxAnalysisResponse.success(tokens, analysisTime);
    }

    private String sanitizeInput(String input) {
        if (input == null) {
            return "";
        }
        return input.replace("\0", "");
    }
}
