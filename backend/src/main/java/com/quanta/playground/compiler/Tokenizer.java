package com.quanta.playground.compiler;

import com.quanta.playground.exception.InvalidCharacterException;
import com.quanta.playground.exception.UnterminatedStringException;

import java.util.ArrayList;
import java.util.List;

/**
 * Single left-to-right scan turning Quanta source text into tokens.
 * Stateless; every call to {@link #tokenize(String)} owns its own cursor.
 */
public final class Tokenizer {

    private static final String OPERATORS = "+-*/=<>&|";

    public List<Token> tokenize(String source) throws InvalidCharacterException, UnterminatedStringException {
        return new Scan(source).run();
    }

    private static final class Scan {
        private final String s;
        private int i = 0;

        Scan(String s) {
            this.s = s;
        }

        List<Token> run() throws InvalidCharacterException, UnterminatedStringException {
            List<Token> out = new ArrayList<>();
            while (i < s.length()) {
                char c = s.charAt(i);

                if (isBlank(c)) {
                    i++;
                    continue;
                }

                if (Character.isLetter(c)) {
                    out.add(readWord());
                    continue;
                }

                if (Character.isDigit(c)) {
                    out.add(readNumber());
                    continue;
                }

                if (c == '"') {
                    out.add(readString());
                    continue;
                }

                if (OPERATORS.indexOf(c) >= 0) {
                    out.add(Token.operator(c));
                    i++;
                    continue;
                }

                throw new InvalidCharacterException(c, i);
            }
            return List.copyOf(out);
        }

        private static boolean isBlank(char c) {
            return Character.isWhitespace(c) || Character.isSpaceChar(c);
        }

        private Token readWord() {
            int j = i;
            while (j < s.length() && Character.isLetterOrDigit(s.charAt(j))) j++;
            String word = s.substring(i, j);
            i = j;
            return Keywords.isKeyword(word) ? Token.keyword(word) : Token.identifier(word);
        }

        private Token readNumber() {
            int j = i;
            while (j < s.length() && Character.isDigit(s.charAt(j))) j++;
            String digits = s.substring(i, j);
            i = j;
            return Token.number(digits);
        }

        private Token readString() throws UnterminatedStringException {
            int start = i;
            int close = s.indexOf('"', start + 1);
            if (close < 0) {
                throw new UnterminatedStringException(start);
            }
            i = close + 1;
            return Token.string(s.substring(start + 1, close));
        }
    }
}
