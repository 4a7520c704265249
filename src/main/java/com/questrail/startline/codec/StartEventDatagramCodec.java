package com.questrail.startline.codec;

import com.questrail.startline.observability.StartEvent;
import com.questrail.startline.observability.StartEventType;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * StartEventDatagramCodec
 * =============================================================================
 * Wire format of the event broadcast: one UTF-8 line per {@link StartEvent}.
 *
 * <pre>
 *   SL1|&lt;event&gt;|&lt;scheduleId&gt;|&lt;entryId&gt;|&lt;timestamp&gt;|key=value|key=value...\n
 * </pre>
 *
 * <ul>
 *   <li>{@code event} is {@link StartEventType#wireName()}.</li>
 *   <li>{@code entryId} is empty for schedule-level events.</li>
 *   <li>{@code timestamp} is ISO-8601 UTC, as {@link Instant#toString()}.</li>
 *   <li>Details follow in their original order.</li>
 * </ul>
 *
 * <h2>Escaping</h2>
 * Inside any field a backslash, {@code |}, {@code =} and line breaks are
 * written as {@code \\}, {@code \p}, {@code \e}, {@code \n} and {@code \r}, so
 * a field never contains a raw separator.
 */
public final class StartEventDatagramCodec
{
    public static final String MAGIC = "SL1";

    private static final char SEP = '|';
    private static final char KV = '=';
    private static final char ESC = '\\';

    public byte[] encode(StartEvent event) {
        Objects.requireNonNull(event, "event");

        StringBuilder sb = new StringBuilder(128);
        sb.append(MAGIC);
        field(sb, event.eventType().wireName());
        field(sb, event.scheduleId());
        field(sb, event.entryId() == null ? "" : event.entryId());
        field(sb, event.timestamp().toString());
        for (Map.Entry<String, String> d : event.details().entrySet()) {
            sb.append(SEP);
            escape(sb, d.getKey());
            sb.append(KV);
            escape(sb, d.getValue());
        }
        sb.append('\n');
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @throws StartEventDecodeException if {@code payload} is not a well-formed event line
     */
    public StartEvent decode(byte[] payload) {
        Objects.requireNonNull(payload, "payload");

        String line = utf8(payload);
        if (line.endsWith("\n")) {
            line = line.substring(0, line.length() - 1);
        }

        List<String> fields = split(line);
        if (fields.size() < 5) {
            throw new StartEventDecodeException("Expected at least 5 fields, got " + fields.size());
        }
        if (!MAGIC.equals(fields.get(0))) {
            throw new StartEventDecodeException("Not a start event datagram: " + fields.get(0));
        }

        StartEventType type;
        try {
            type = StartEventType.fromWireName(unescape(fields.get(1)));
        } catch (IllegalArgumentException e) {
            throw new StartEventDecodeException("Unknown event type " + fields.get(1), e);
        }

        String scheduleId = unescape(fields.get(2));
        if (scheduleId.isEmpty()) {
            throw new StartEventDecodeException("Missing schedule id");
        }
        String entryId = unescape(fields.get(3));

        Instant timestamp;
        try {
            timestamp = Instant.parse(unescape(fields.get(4)));
        } catch (DateTimeParseException e) {
            throw new StartEventDecodeException("Bad timestamp " + fields.get(4), e);
        }

        Map<String, String> details = new LinkedHashMap<>();
        for (int i = 5; i < fields.size(); i++) {
            String raw = fields.get(i);
            int eq = raw.indexOf(KV);
            if (eq < 0) {
                throw new StartEventDecodeException("Detail without '=': " + raw);
            }
            details.put(unescape(raw.substring(0, eq)), unescape(raw.substring(eq + 1)));
        }

        return new StartEvent(type, scheduleId, entryId.isEmpty() ? null : entryId, timestamp, details);
    }

    private static String utf8(byte[] payload) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(payload))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new StartEventDecodeException("Datagram is not valid UTF-8", e);
        }
    }

    private static void field(StringBuilder sb, String value) {
        sb.append(SEP);
        escape(sb, value);
    }

    private static void escape(StringBuilder sb, String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case ESC -> sb.append(ESC).append(ESC);
                case SEP -> sb.append(ESC).append('p');
                case KV -> sb.append(ESC).append('e');
                case '\n' -> sb.append(ESC).append('n');
                case '\r' -> sb.append(ESC).append('r');
                default -> sb.append(c);
            }
        }
    }

    private static String unescape(String value) {
        if (value.indexOf(ESC) < 0) {
            return value;
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c != ESC) {
                sb.append(c);
                continue;
            }
            if (++i == value.length()) {
                throw new StartEventDecodeException("Dangling escape in " + value);
            }
            char e = value.charAt(i);
            switch (e) {
                case ESC -> sb.append(ESC);
                case 'p' -> sb.append(SEP);
                case 'e' -> sb.append(KV);
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                default -> throw new StartEventDecodeException("Unknown escape \\" + e);
            }
        }
        return sb.toString();
    }

    /**
     * Splits on separators; escaped separators never appear raw, so a plain
     * scan is enough.
     */
    private static List<String> split(String line) {
        List<String> out = new ArrayList<>();
        int from = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ESC) {
                i++;
                continue;
            }
            if (c == SEP) {
                out.add(line.substring(from, i));
                from = i + 1;
            }
        }
        out.add(line.substring(from));
        return out;
    }
}
