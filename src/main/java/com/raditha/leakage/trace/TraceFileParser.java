package com.raditha.leakage.trace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the line based text trace format.
 * <p>
 * One entry per line; blank lines and lines starting with {@code #} are
 * ignored. Numbers are decimal or {@code 0x}-prefixed hexadecimal.
 *
 * <pre>
 * call   &lt;source&gt; &lt;target&gt; [&lt;callStackId&gt;]
 * branch &lt;source&gt; &lt;target&gt; taken|nottaken
 * return &lt;source&gt; &lt;target&gt;
 * read   &lt;instruction&gt; &lt;address&gt;
 * write  &lt;instruction&gt; &lt;address&gt;
 * alloc  &lt;id&gt; &lt;size&gt; heap|stack
 * </pre>
 *
 * When a call omits its call stack ID, it is derived from the enclosing
 * stack with {@link CallStackIds#derive(long, long, long)}.
 */
public class TraceFileParser {

    private static final Logger logger = LoggerFactory.getLogger(TraceFileParser.class);

    private static final Pattern TESTCASE_ID_PATTERN = Pattern.compile("(\\d+)");

    /**
     * Extracts the testcase ID from a trace file name, e.g. {@code t17.trace}
     * yields 17.
     *
     * @throws TraceFormatException if the file name holds no number
     */
    public static int testcaseIdFromFileName(Path file) throws TraceFormatException {
        String name = file.getFileName().toString();
        Matcher matcher = TESTCASE_ID_PATTERN.matcher(name);
        if (!matcher.find()) {
            throw new TraceFormatException("Cannot derive testcase ID from file name: " + name);
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            throw new TraceFormatException("Testcase ID out of range in file name: " + name, e);
        }
    }

    /**
     * Parses a trace file; the testcase ID is taken from its name.
     */
    public ParsedTrace parse(Path file) throws IOException, TraceFormatException {
        int testcaseId = testcaseIdFromFileName(file);
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            List<TraceEntry> entries = parse(reader, testcaseId);
            logger.debug("Parsed {} entries for testcase {} from {}", entries.size(), testcaseId, file);
            return new ParsedTrace(testcaseId, entries);
        }
    }

    /**
     * Parses trace entries from a reader.
     */
    public List<TraceEntry> parse(Reader input, int testcaseId) throws IOException, TraceFormatException {
        BufferedReader reader = input instanceof BufferedReader br ? br : new BufferedReader(input);
        List<TraceEntry> entries = new ArrayList<>();
        Deque<Long> callStacks = new ArrayDeque<>();
        callStacks.push(CallStackIds.ROOT);

        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }

            String[] parts = trimmed.split("\\s+");
            TraceEntry entry = parseLine(parts, callStacks, testcaseId, lineNumber);
            if (entry instanceof TraceEntry.CallEntry call) {
                callStacks.push(call.callStackId());
            } else if (entry instanceof TraceEntry.ReturnEntry && callStacks.size() > 1) {
                // Unbalanced returns are reported by the validator, not here
                callStacks.pop();
            }
            entries.add(entry);
        }
        return entries;
    }

    private TraceEntry parseLine(String[] parts, Deque<Long> callStacks, int testcaseId, int lineNumber)
            throws TraceFormatException {
        String keyword = parts[0].toLowerCase(Locale.ROOT);
        switch (keyword) {
            case "call": {
                expectFields(parts, 3, 4, testcaseId, lineNumber);
                long source = parseNumber(parts[1], testcaseId, lineNumber);
                long target = parseNumber(parts[2], testcaseId, lineNumber);
                long callStackId = parts.length == 4
                        ? parseNumber(parts[3], testcaseId, lineNumber)
                        : CallStackIds.derive(callStacks.peek(), source, target);
                return new TraceEntry.CallEntry(source, target, callStackId);
            }
            case "branch": {
                expectFields(parts, 4, 4, testcaseId, lineNumber);
                boolean taken = parseFlag(parts[3], "taken", "nottaken", testcaseId, lineNumber);
                return new TraceEntry.BranchEntry(parseNumber(parts[1], testcaseId, lineNumber),
                        parseNumber(parts[2], testcaseId, lineNumber), taken);
            }
            case "return": {
                expectFields(parts, 3, 3, testcaseId, lineNumber);
                return new TraceEntry.ReturnEntry(parseNumber(parts[1], testcaseId, lineNumber),
                        parseNumber(parts[2], testcaseId, lineNumber));
            }
            case "read":
            case "write": {
                expectFields(parts, 3, 3, testcaseId, lineNumber);
                return new TraceEntry.MemoryAccessEntry(parseNumber(parts[1], testcaseId, lineNumber),
                        keyword.equals("write"), parseNumber(parts[2], testcaseId, lineNumber));
            }
            case "alloc": {
                expectFields(parts, 4, 4, testcaseId, lineNumber);
                long id = parseNumber(parts[1], testcaseId, lineNumber);
                if (id < 0 || id > Integer.MAX_VALUE) {
                    throw new TraceFormatException("Line " + lineNumber + ": allocation ID out of range: " + parts[1],
                            testcaseId, lineNumber);
                }
                boolean heap = parseFlag(parts[3], "heap", "stack", testcaseId, lineNumber);
                return new TraceEntry.AllocationEntry((int) id, parseNumber(parts[2], testcaseId, lineNumber), heap);
            }
            default:
                throw new TraceFormatException("Line " + lineNumber + ": unknown entry type '" + parts[0] + "'",
                        testcaseId, lineNumber);
        }
    }

    private static void expectFields(String[] parts, int min, int max, int testcaseId, int lineNumber)
            throws TraceFormatException {
        if (parts.length < min || parts.length > max) {
            throw new TraceFormatException(String.format("Line %d: '%s' expects %d field(s), got %d",
                    lineNumber, parts[0], min - 1, parts.length - 1), testcaseId, lineNumber);
        }
    }

    private static long parseNumber(String text, int testcaseId, int lineNumber) throws TraceFormatException {
        try {
            if (text.startsWith("0x") || text.startsWith("0X")) {
                return Long.parseUnsignedLong(text.substring(2), 16);
            }
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new TraceFormatException("Line " + lineNumber + ": invalid number '" + text + "'",
                    testcaseId, lineNumber);
        }
    }

    private static boolean parseFlag(String text, String yes, String no, int testcaseId, int lineNumber)
            throws TraceFormatException {
        if (text.equalsIgnoreCase(yes)) {
            return true;
        }
        if (text.equalsIgnoreCase(no)) {
            return false;
        }
        throw new TraceFormatException("Line " + lineNumber + ": expected '" + yes + "' or '" + no + "', got '"
                + text + "'", testcaseId, lineNumber);
    }
}
