package it.pagopa.soapclient.utils;

import ch.qos.logback.classic.PatternLayout;
import ch.qos.logback.classic.spi.ILoggingEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern layout hiding sensitive values of logged SOAP envelopes.
 * <p>
 * Two kinds of rules are supported, both configurable from logback XML:
 * <ul>
 * <li>{@code maskedElement}: the local name of an XML element whose text content is masked,
 * whatever its namespace prefix and attributes, e.g. {@code password}</li>
 * <li>{@code maskPattern}: a free regular expression whose capturing groups are masked</li>
 * </ul>
 * Masked characters are replaced by {@code *}, keeping the rendered line length.
 */
public class LogMaskerPatternLayout extends PatternLayout {

    private static final String ELEMENT_CONTENT_TEMPLATE = "<(?:[\\w.-]+:)?%1$s(?:\\s[^>]*)?>([^<]*)</(?:[\\w.-]+:)?%1$s>";

    private final List<Pattern> maskRules = new ArrayList<>();

    public void addMaskPattern(String maskPattern) {
        maskRules.add(Pattern.compile(maskPattern, Pattern.MULTILINE));
    }

    public void addMaskedElement(String elementName) {
        maskRules.add(Pattern.compile(ELEMENT_CONTENT_TEMPLATE.formatted(Pattern.quote(elementName.trim()))));
    }

    @Override
    public String doLayout(ILoggingEvent event) {
        String line = super.doLayout(event);
        return maskRules.isEmpty() ? line : mask(line);
    }

    private String mask(String line) {
        StringBuilder masked = new StringBuilder(line);
        for (Pattern rule : maskRules) {
            Matcher matcher = rule.matcher(line);
            while (matcher.find()) {
                for (int group = 1; group <= matcher.groupCount(); group++) {
                    if (matcher.start(group) >= 0) {
                        for (int i = matcher.start(group); i < matcher.end(group); i++) {
                            masked.setCharAt(i, '*');
                        }
                    }
                }
            }
        }
        return masked.toString();
    }
}
