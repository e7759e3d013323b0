package it.pagopa.soapclient.utils.soap;

import it.pagopa.soapclient.exceptions.SoapDeserializationException;

import java.io.ByteArrayInputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the text encoding of an XML document from its byte order mark or from the
 * {@code encoding} label of its XML declaration, and decodes it accordingly.
 * <p>
 * Labels are matched case insensitively; the common aliases used on the web
 * ({@code latin1}, {@code ascii}, {@code utf8}, ...) are accepted next to the canonical Java
 * charset names. A document without label is read as UTF-8.
 */
public final class XmlCharsetResolver {

    private static final Pattern encodingDeclarationPattern = Pattern
            .compile("^<\\?xml[^>]*?\\sencoding\\s*=\\s*[\"']([A-Za-z][A-Za-z0-9._:-]*)[\"']");

    private static final int DECLARATION_MAX_LENGTH = 256;

    private static final Map<String, String> labelAliases = Map.ofEntries(
            Map.entry("utf8", "UTF-8"),
            Map.entry("unicode-1-1-utf-8", "UTF-8"),
            Map.entry("latin1", "windows-1252"),
            Map.entry("l1", "windows-1252"),
            Map.entry("iso-8859-1", "windows-1252"),
            Map.entry("iso8859-1", "windows-1252"),
            Map.entry("iso_8859-1", "windows-1252"),
            Map.entry("ascii", "windows-1252"),
            Map.entry("us-ascii", "windows-1252"),
            Map.entry("cp1252", "windows-1252"),
            Map.entry("latin2", "ISO-8859-2"),
            Map.entry("l2", "ISO-8859-2"),
            Map.entry("utf-16", "UTF-16LE"),
            Map.entry("ucs-2", "UTF-16LE"),
            Map.entry("unicode", "UTF-16LE"),
            Map.entry("sjis", "Shift_JIS"),
            Map.entry("x-sjis", "Shift_JIS"),
            Map.entry("gb2312", "GBK"),
            Map.entry("koi", "KOI8-R"),
            Map.entry("koi8", "KOI8-R")
    );

    private XmlCharsetResolver() {
    }

    /**
     * Resolve a declared encoding label.
     *
     * @param label the label, as found in the XML declaration
     * @return the matching charset
     * @throws SoapDeserializationException for unknown or unsupported labels
     */
    public static Charset forLabel(String label) {
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        String charsetName = labelAliases.getOrDefault(normalized, normalized);
        try {
            return Charset.forName(charsetName);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new SoapDeserializationException("Unsupported XML encoding label: [%s]".formatted(label), e);
        }
    }

    /**
     * Detect the encoding of a whole XML document.
     *
     * @param document the document bytes
     * @return the charset to decode the document with
     */
    public static Charset detect(byte[] document) {
        return byteOrderMark(document)
                .orElseGet(() -> declaredLabel(document).map(XmlCharsetResolver::forLabel).orElse(StandardCharsets.UTF_8));
    }

    /**
     * Open a decoding reader over an XML document. A leading byte order mark is consumed.
     *
     * @param document the document bytes
     * @return a reader producing the decoded document text
     */
    public static Reader newReader(byte[] document) {
        Charset charset = detect(document);
        int offset = byteOrderMarkLength(document);
        return new InputStreamReader(
                new ByteArrayInputStream(document, offset, document.length - offset),
                charset
        );
    }

    static Optional<String> declaredLabel(byte[] document) {
        // the declaration is ASCII in every ASCII compatible encoding
        String head = new String(
                document,
                0,
                Math.min(document.length, DECLARATION_MAX_LENGTH),
                StandardCharsets.ISO_8859_1
        );
        Matcher matcher = encodingDeclarationPattern.matcher(head);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    private static Optional<Charset> byteOrderMark(byte[] document) {
        if (startsWith(document, 0xEF, 0xBB, 0xBF)) {
            return Optional.of(StandardCharsets.UTF_8);
        }
        if (startsWith(document, 0xFE, 0xFF)) {
            return Optional.of(StandardCharsets.UTF_16BE);
        }
        if (startsWith(document, 0xFF, 0xFE)) {
            return Optional.of(StandardCharsets.UTF_16LE);
        }
        return Optional.empty();
    }

    private static int byteOrderMarkLength(byte[] document) {
        if (startsWith(document, 0xEF, 0xBB, 0xBF)) {
            return 3;
        }
        return byteOrderMark(document).isPresent() ? 2 : 0;
    }

    private static boolean startsWith(
                                      byte[] document,
                                      int... prefix
    ) {
        if (document.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if ((document[i] & 0xFF) != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
