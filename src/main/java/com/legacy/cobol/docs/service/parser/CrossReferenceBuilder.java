package com.legacy.cobol.docs.service.parser;

import com.legacy.cobol.docs.dto.parser.CrossReference;
import com.legacy.cobol.docs.dto.parser.CrossReferenceType;
import com.legacy.cobol.docs.dto.parser.DataDivision;
import com.legacy.cobol.docs.dto.parser.DataItem;
import com.legacy.cobol.docs.dto.parser.DependencyKind;
import com.legacy.cobol.docs.dto.parser.Divisions;
import com.legacy.cobol.docs.dto.parser.FileControlEntry;
import com.legacy.cobol.docs.dto.parser.FileDescription;
import com.legacy.cobol.docs.dto.parser.Paragraph;
import com.legacy.cobol.docs.dto.parser.ProcedureDivision;
import com.legacy.cobol.docs.dto.parser.ProcedureSection;
import com.legacy.cobol.docs.dto.parser.ProgramDependency;
import com.legacy.cobol.docs.dto.parser.StatementVerb;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Per-line identifier index. Definitions come from the parsed structure (data items, files,
 * paragraphs, sections); references and modifications are read from PROCEDURE DIVISION lines
 * word by word, without resolving qualification or scope.
 */
final class CrossReferenceBuilder {

    private static final Pattern PROCEDURE_HEADER =
            Pattern.compile("^\\s*PROCEDURE\\s+DIVISION", Pattern.CASE_INSENSITIVE);
    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[\\s,;():]+");
    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Z0-9][A-Z0-9\\-]*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern HAS_LETTER = Pattern.compile("[A-Z]", Pattern.CASE_INSENSITIVE);

    private static final Set<String> RESERVED = new HashSet<>(Arrays.asList(
            "TO", "FROM", "BY", "INTO", "GIVING", "USING", "RETURNING", "IS", "ARE", "THE", "OF", "IN",
            "ON", "AT", "NOT", "AND", "OR", "THAN", "EQUAL", "EQUALS", "GREATER", "LESS", "THEN",
            "ZERO", "ZEROS", "ZEROES", "SPACE", "SPACES", "HIGH-VALUE", "HIGH-VALUES",
            "LOW-VALUE", "LOW-VALUES", "QUOTE", "QUOTES", "ALL", "TRUE", "FALSE",
            "UNTIL", "VARYING", "TIMES", "THRU", "THROUGH", "AFTER", "BEFORE", "ELSE", "WHEN", "ALSO",
            "RUN", "INPUT", "OUTPUT", "I-O", "EXTEND", "ROUNDED", "SIZE", "ERROR", "EXCEPTION",
            "OVERFLOW", "INVALID", "KEY", "RECORD", "RECORDS", "DELIMITED", "COUNT", "POINTER",
            "TALLYING", "REPLACING", "LEADING", "FIRST", "CHARACTERS", "CONVERTING", "UPON", "WITH",
            "NO", "ADVANCING", "LINE", "LINES", "PAGE", "REFERENCE", "CONTENT", "VALUE", "VALUES",
            "SECTION", "DIVISION", "PROCEDURE", "SQL", "NUMERIC", "ALPHABETIC", "ALPHABETIC-UPPER",
            "ALPHABETIC-LOWER", "POSITIVE", "NEGATIVE", "INDEX", "INDEXED", "ASCENDING", "DESCENDING",
            "PROGRAM", "LENGTH", "FUNCTION", "ADDRESS", "CORRESPONDING", "CORR", "TEST", "OPTIONAL",
            "ANY", "DEPENDING", "GO", "SENTENCE", "END", "DATE", "DAY", "TIME", "OCCURS", "PIC",
            "PICTURE", "REDEFINES", "USAGE", "COMP", "COMP-3", "BINARY", "DISPLAY", "SELECT",
            "ASSIGN", "FD", "SD", "REMAINDER", "DECLARATIVES", "OTHER", "STATUS", "FILE"));

    private static final Set<String> SCOPE_TERMINATORS = Set.of(
            "END-IF", "END-PERFORM", "END-EVALUATE", "END-READ", "END-WRITE", "END-REWRITE", "END-DELETE",
            "END-START", "END-RETURN", "END-SEARCH", "END-CALL", "END-COMPUTE", "END-ADD", "END-SUBTRACT",
            "END-MULTIPLY", "END-DIVIDE", "END-STRING", "END-UNSTRING", "END-EXEC", "END-ACCEPT",
            "END-DISPLAY");

    static {
        for (StatementVerb verb : StatementVerb.values()) {
            RESERVED.add(verb.name());
        }
        RESERVED.addAll(SCOPE_TERMINATORS);
    }

    private static final Set<String> CLAUSE_STOPS = Set.of(
            "ON", "AT", "NOT", "WITH", "DELIMITED", "COUNT", "TALLYING", "POINTER", "END", "ELSE",
            "INVALID", "SIZE", "OVERFLOW", "EXCEPTION");

    List<CrossReference> build(SourceLines lines, Divisions divisions, List<ProgramDependency> dependencies) {
        Map<Integer, List<Definition>> definitionsByLine = definitions(divisions);
        Map<String, CrossReferenceType> knownTypes = new HashMap<>();
        definitionsByLine.values().forEach(defs -> defs.forEach(d -> knownTypes.put(d.key(), d.type())));

        Map<Integer, List<String>> copybooksByLine = new HashMap<>();
        for (ProgramDependency dependency : dependencies) {
            if (dependency.getType() == DependencyKind.COPY || dependency.getType() == DependencyKind.INCLUDE) {
                copybooksByLine.computeIfAbsent(dependency.getLine(), l -> new ArrayList<>()).add(dependency.getTarget());
                knownTypes.putIfAbsent(dependency.getTarget().toUpperCase(Locale.ROOT), CrossReferenceType.COPYBOOK);
            }
        }

        int procedureHeader = lines.find(PROCEDURE_HEADER, 0);
        Map<String, Entry> entries = new LinkedHashMap<>();
        boolean inExec = false;

        for (int i = 0; i < lines.size(); i++) {
            if (lines.isIgnorable(i)) continue;
            int line = i + 1;

            List<Definition> defined = definitionsByLine.getOrDefault(line, List.of());
            for (Definition definition : defined) {
                entry(entries, definition.name(), definition.type()).defined.add(line);
            }
            for (String copybook : copybooksByLine.getOrDefault(line, List.of())) {
                entry(entries, copybook, CrossReferenceType.COPYBOOK).addReferenced(line);
            }

            if (procedureHeader < 0 || i <= procedureHeader || !defined.isEmpty()) {
                continue;
            }

            String text = CobolText.withoutLiterals(lines.text(i));
            List<String> tokens = tokens(text);
            if (tokens.isEmpty()) continue;

            String first = tokens.get(0).toUpperCase(Locale.ROOT);
            if ("EXEC".equals(first) || inExec) {
                inExec = !text.toUpperCase(Locale.ROOT).contains("END-EXEC");
                continue;
            }

            Set<Integer> modifiedPositions = modifiedPositions(first, tokens);
            for (int t = 0; t < tokens.size(); t++) {
                String token = tokens.get(t);
                if (!isIdentifier(token)) continue;
                String key = token.toUpperCase(Locale.ROOT);
                if (copybooksByLine.getOrDefault(line, List.of()).stream().anyMatch(key::equalsIgnoreCase)) continue;

                Entry entry = entry(entries, token, knownTypes.getOrDefault(key, CrossReferenceType.VARIABLE));
                if (modifiedPositions.contains(t)) {
                    entry.addModified(line);
                } else {
                    entry.addReferenced(line);
                }
            }
        }

        return entries.values().stream().map(Entry::toCrossReference).collect(Collectors.toList());
    }

    // ========================= DEFINITIONS =========================

    private Map<Integer, List<Definition>> definitions(Divisions divisions) {
        Map<Integer, List<Definition>> byLine = new HashMap<>();
        if (divisions == null) return byLine;

        if (divisions.getEnvironment() != null && divisions.getEnvironment().getInputOutputSection() != null) {
            for (FileControlEntry entry : divisions.getEnvironment().getInputOutputSection().getFileControl()) {
                define(byLine, entry.getLine(), entry.getFileName(), CrossReferenceType.FILE);
            }
        }

        DataDivision data = divisions.getData();
        if (data != null) {
            for (FileDescription fd : data.getFileSection()) {
                define(byLine, fd.getLine(), fd.getFileName(), CrossReferenceType.FILE);
                defineItems(byLine, fd.getRecords());
            }
            defineItems(byLine, data.getWorkingStorageSection());
            defineItems(byLine, data.getLocalStorageSection());
            defineItems(byLine, data.getLinkageSection());
        }

        ProcedureDivision procedure = divisions.getProcedure();
        if (procedure != null) {
            for (ProcedureSection section : procedure.getSections()) {
                define(byLine, section.getLine(), section.getName(), CrossReferenceType.PROCEDURE);
            }
            for (Paragraph paragraph : procedure.getParagraphs()) {
                define(byLine, paragraph.getStartLine(), paragraph.getName(), CrossReferenceType.PROCEDURE);
            }
        }
        return byLine;
    }

    private void defineItems(Map<Integer, List<Definition>> byLine, List<DataItem> items) {
        for (DataItem item : items) {
            if (!"FILLER".equalsIgnoreCase(item.getName())) {
                define(byLine, item.getLine(), item.getName(), CrossReferenceType.VARIABLE);
            }
            defineItems(byLine, item.getChildren());
        }
    }

    private void define(Map<Integer, List<Definition>> byLine, int line, String name, CrossReferenceType type) {
        if (name == null || name.isEmpty()) return;
        byLine.computeIfAbsent(line, l -> new ArrayList<>()).add(new Definition(name, type));
    }

    // ========================= MODIFICATIONS =========================

    /**
     * Token positions written by the statement starting with {@code verb}, for example the
     * operands after TO in a MOVE or the receiving field left of {@code =} in a COMPUTE.
     */
    private Set<Integer> modifiedPositions(String verb, List<String> tokens) {
        Set<Integer> positions = new HashSet<>();
        switch (verb) {
            case "MOVE" -> collectAfter(tokens, "TO", positions);
            case "ADD" -> collectAfter(tokens, has(tokens, "GIVING") ? "GIVING" : "TO", positions);
            case "SUBTRACT" -> collectAfter(tokens, has(tokens, "GIVING") ? "GIVING" : "FROM", positions);
            case "MULTIPLY" -> collectAfter(tokens, has(tokens, "GIVING") ? "GIVING" : "BY", positions);
            case "DIVIDE" -> collectAfter(tokens, has(tokens, "GIVING") ? "GIVING" : "INTO", positions);
            case "READ", "STRING", "UNSTRING", "RETURN" -> collectAfter(tokens, "INTO", positions);
            case "SET" -> collectBetween(tokens, 1, indexOf(tokens, "TO"), positions);
            case "COMPUTE" -> collectBetween(tokens, 1, indexOf(tokens, "="), positions);
            case "INITIALIZE" -> collectBetween(tokens, 1, indexOf(tokens, "REPLACING"), positions);
            case "ACCEPT" -> collectBetween(tokens, 1, Math.min(2, tokens.size()), positions);
            default -> {
            }
        }
        return positions;
    }

    private void collectAfter(List<String> tokens, String keyword, Set<Integer> positions) {
        int start = indexOf(tokens, keyword);
        if (start < 0) return;
        for (int t = start + 1; t < tokens.size(); t++) {
            String upper = tokens.get(t).toUpperCase(Locale.ROOT);
            if (CLAUSE_STOPS.contains(upper) || SCOPE_TERMINATORS.contains(upper)) break;
            if (isIdentifier(tokens.get(t))) positions.add(t);
        }
    }

    private void collectBetween(List<String> tokens, int from, int to, Set<Integer> positions) {
        int end = to < 0 ? tokens.size() : to;
        for (int t = from; t < end; t++) {
            if (isIdentifier(tokens.get(t))) positions.add(t);
        }
    }

    private boolean has(List<String> tokens, String keyword) {
        return indexOf(tokens, keyword) >= 0;
    }

    private int indexOf(List<String> tokens, String keyword) {
        for (int t = 0; t < tokens.size(); t++) {
            if (tokens.get(t).equalsIgnoreCase(keyword)) return t;
        }
        return -1;
    }

    // ========================= TOKENS =========================

    private List<String> tokens(String text) {
        String code = text;
        int inlineComment = code.indexOf("*>");
        if (inlineComment >= 0) {
            code = code.substring(0, inlineComment);
        }
        List<String> tokens = new ArrayList<>();
        for (String raw : TOKEN_SEPARATOR.split(code.trim())) {
            String token = CobolText.stripTrailingPeriod(raw);
            if (!token.isEmpty()) tokens.add(token);
        }
        return tokens;
    }

    private boolean isIdentifier(String token) {
        return IDENTIFIER.matcher(token).matches()
                && HAS_LETTER.matcher(token).find()
                && !token.endsWith("-")
                && !RESERVED.contains(token.toUpperCase(Locale.ROOT));
    }

    private Entry entry(Map<String, Entry> entries, String name, CrossReferenceType type) {
        return entries.computeIfAbsent(name.toUpperCase(Locale.ROOT), k -> new Entry(name, type));
    }

    private record Definition(String name, CrossReferenceType type) {
        String key() {
            return name.toUpperCase(Locale.ROOT);
        }
    }

    private static final class Entry {
        private final String name;
        private final CrossReferenceType type;
        private final List<Integer> defined = new ArrayList<>();
        private final List<Integer> referenced = new ArrayList<>();
        private final List<Integer> modified = new ArrayList<>();

        private Entry(String name, CrossReferenceType type) {
            this.name = name;
            this.type = type;
        }

        private void addReferenced(int line) {
            addOnce(referenced, line);
        }

        private void addModified(int line) {
            addOnce(modified, line);
        }

        private static void addOnce(List<Integer> lines, int line) {
            if (lines.isEmpty() || lines.get(lines.size() - 1) != line) {
                lines.add(line);
            }
        }

        private CrossReference toCrossReference() {
            return CrossReference.builder()
                    .name(name)
                    .type(type)
                    .defined(List.copyOf(defined))
                    .referenced(List.copyOf(referenced))
                    .modified(List.copyOf(modified))
                    .build();
        }
    }
}
