package dumb.obligato;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads terms written as s-expressions. Symbols become {@link Term.Atom}s, tokens
 * starting with {@code ?} become {@link Term.Var}s (obligation and goal holes), and
 * {@code ;} starts a comment running to the end of the line.
 */
public class KifParser {
    private static final int CONTEXT_SIZE = 40;
    private final String src;
    private int pos = 0;
    private int line = 1;
    private int col = 0;

    private KifParser(String src) {
        this.src = src;
    }

    public static List<Term> parseKif(String kif) throws ParseException {
        var parser = new KifParser(kif);
        var terms = new ArrayList<Term>();
        parser.skipBlank();
        while (!parser.atEnd()) {
            terms.add(parser.term());
            parser.skipBlank();
        }
        return terms;
    }

    private boolean atEnd() {
        return pos >= src.length();
    }

    private int peek() {
        return atEnd() ? -1 : src.charAt(pos);
    }

    private char next() {
        var c = src.charAt(pos++);
        if (c == '\n') {
            line++;
            col = 0;
        } else {
            col++;
        }
        return c;
    }

    private static boolean delimiter(int c) {
        return c == -1 || Character.isWhitespace(c) || c == '(' || c == ')' || c == '"' || c == ';';
    }

    private void skipBlank() {
        while (!atEnd()) {
            var c = peek();
            if (Character.isWhitespace(c)) next();
            else if (c == ';') {
                while (!atEnd() && peek() != '\n') next();
            } else return;
        }
    }

    private Term term() throws ParseException {
        skipBlank();
        var c = peek();
        if (c == -1) throw error("Unexpected end of input while reading a term", null);
        return switch (c) {
            case '(' -> list();
            case ')' -> throw error("Unbalanced ')'", null);
            case '"' -> quoted();
            case '?' -> variable();
            default -> Term.Atom.of(symbol());
        };
    }

    private Term.Lst list() throws ParseException {
        next();
        var terms = new ArrayList<Term>();
        skipBlank();
        while (peek() != ')') {
            if (atEnd()) throw error("Unexpected end of input inside list", null);
            terms.add(term());
            skipBlank();
        }
        next();
        return new Term.Lst(terms);
    }

    private Term.Atom quoted() throws ParseException {
        next();
        var sb = new StringBuilder();
        while (true) {
            if (atEnd()) throw error("Unterminated string literal", null);
            var c = next();
            if (c == '"') break;
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (atEnd()) throw error("Unterminated escape sequence", null);
            var e = next();
            switch (e) {
                case '"', '\\' -> sb.append(e);
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                default -> throw error("Invalid escape sequence", "'\\" + e + "'");
            }
        }
        return Term.Atom.of(sb.toString());
    }

    private Term.Var variable() throws ParseException {
        var name = symbol();
        if (name.length() < 2) throw error("Hole name must follow '?'", "'" + name + "'");
        return Term.Var.of(name);
    }

    private String symbol() {
        var start = pos;
        while (!delimiter(peek())) next();
        return src.substring(start, pos);
    }

    private ParseException error(String message, @Nullable String found) {
        var from = Math.max(0, pos - CONTEXT_SIZE);
        return new ParseException(found != null ? message + ", found " + found : message, line, col, src.substring(from, pos));
    }

    public static class ParseException extends Exception {
        private final int line;
        private final int col;
        private final String context;

        public ParseException(String message, int line, int col, String context) {
            super(message);
            this.line = line;
            this.col = col;
            this.context = context;
        }

        public int line() {
            return line;
        }

        public int col() {
            return col;
        }

        @Override
        public String getMessage() {
            var location = line > 0 ? " at line " + line + ", col " + col : "";
            var snippet = context != null && !context.isEmpty() ? " near '" + context + "'" : "";
            return super.getMessage() + location + snippet;
        }
    }
}
