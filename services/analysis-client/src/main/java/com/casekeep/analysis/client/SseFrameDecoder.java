package com.casekeep.analysis.client;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public final class SseFrameDecoder {

    private static final String FRAME_DELIMITER = "\n\n";

    private final CharsetDecoder charsetDecoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPLACE)
        .onUnmappableCharacter(CodingErrorAction.REPLACE);
    private final StringBuilder text = new StringBuilder();
    private ByteBuffer undecoded = ByteBuffer.allocate(0);

    public List<String> decode(byte[] chunk) {
        ByteBuffer input = ByteBuffer.allocate(undecoded.remaining() + chunk.length);
        input.put(undecoded).put(chunk).flip();

        CharBuffer chars = CharBuffer.allocate(input.remaining());
        charsetDecoder.decode(input, chars, false);
        chars.flip();
        for (int i = 0; i < chars.length(); i++) {
            char c = chars.charAt(i);
            if (c != '\r') {
                text.append(c);
            }
        }

        // an incomplete trailing character stays as bytes
        undecoded = ByteBuffer.allocate(input.remaining());
        undecoded.put(input).flip();

        List<String> payloads = new ArrayList<>();
        int end;
        while ((end = text.indexOf(FRAME_DELIMITER)) >= 0) {
            String frame = text.substring(0, end);
            text.delete(0, end + FRAME_DELIMITER.length());
            String data = dataOf(frame);
            if (data != null) {
                payloads.add(data);
            }
        }
        return payloads;
    }

    public boolean hasBufferedInput() {
        return text.length() > 0 || undecoded.hasRemaining();
    }

    static String dataOf(String frame) {
        List<String> lines = new ArrayList<>();
        for (String line : frame.split("\n", -1)) {
            if (line.isEmpty() || line.startsWith(":")) {
                continue;
            }
            int colon = line.indexOf(':');
            String field = colon < 0 ? line : line.substring(0, colon);
            if (!"data".equals(field)) {
                continue;
            }
            String value = colon < 0 ? "" : line.substring(colon + 1);
            lines.add(value.startsWith(" ") ? value.substring(1) : value);
        }
        return lines.isEmpty() ? null : String.join("\n", lines);
    }
}
