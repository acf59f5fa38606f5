package com.linlay.assistantgw.ingest.service;

import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

/**
 * Guesses a media type from the file name, then from the leading bytes.
 */
public final class MediaTypeDetector {

    public static final String OCTET_STREAM = "application/octet-stream";

    private static final byte[] PDF = {'%', 'P', 'D', 'F'};
    private static final byte[][] ZIP = {
            {0x50, 0x4B, 0x03, 0x04},
            {0x50, 0x4B, 0x05, 0x06},
            {0x50, 0x4B, 0x07, 0x08}
    };
    private static final byte[] OLE = {(byte) 0xD0, (byte) 0xCF, 0x11, (byte) 0xE0, (byte) 0xA1, (byte) 0xB1, 0x1A, (byte) 0xE1};
    private static final byte[] XLS = {0x09, 0x00, (byte) 0xFF, 0x00, 0x06, 0x00};
    private static final int SNIFF_BYTES = 1024;

    private MediaTypeDetector() {
    }

    public static String detect(String fileName, byte[] data) {
        Optional<MediaType> byName = fileName == null ? Optional.empty() : MediaTypeFactory.getMediaType(fileName);
        if (byName.isPresent() && !MediaType.APPLICATION_OCTET_STREAM.equals(byName.get())) {
            return byName.get().toString();
        }
        byte[] bytes = data == null ? new byte[0] : data;

        if (startsWith(bytes, PDF)) {
            return "application/pdf";
        }
        for (byte[] zip : ZIP) {
            if (startsWith(bytes, zip)) {
                return "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";
            }
        }
        if (startsWith(bytes, OLE)) {
            return "application/msword";
        }
        if (startsWith(bytes, XLS)) {
            return "application/vnd.ms-excel";
        }

        String head = decodeHead(bytes);
        if (head.contains("\n") && (head.contains(",") || head.contains("\t"))) {
            return "text/csv";
        }
        if (head.isEmpty() || isPrintable(head)) {
            return MediaType.TEXT_PLAIN_VALUE;
        }
        return OCTET_STREAM;
    }

    private static boolean startsWith(byte[] data, byte[] prefix) {
        return data.length >= prefix.length && Arrays.equals(data, 0, prefix.length, prefix, 0, prefix.length);
    }

    private static String decodeHead(byte[] data) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.IGNORE)
                .onUnmappableCharacter(CodingErrorAction.IGNORE);
        try {
            CharBuffer decoded = decoder.decode(ByteBuffer.wrap(data, 0, Math.min(data.length, SNIFF_BYTES)));
            return decoded.toString();
        } catch (CharacterCodingException ex) {
            return "";
        }
    }

    private static boolean isPrintable(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r' || c == '\t') {
                continue;
            }
            if (Character.isISOControl(c) || Character.getType(c) == Character.UNASSIGNED) {
                return false;
            }
        }
        return true;
    }
}
