package com.firmenakte.aggregate.parse;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex extraction over plain German register and business text, shared by the HTML and PDF parsers.
 * Every method returns null (or an empty list) when nothing matches.
 */
public final class GermanTextPatterns {
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final Pattern THOUSANDS_ONLY = Pattern.compile("-?\\d{1,3}(\\.\\d{3})+");
    private static final Pattern UST_IDNR = Pattern.compile("\\bDE\\s?(\\d{9})\\b");
    private static final Pattern REGISTERNUMMER = Pattern.compile("\\b(HR[AB])\\s*(\\d{1,7})(?:\\s([A-Z]{1,2}))?\\b");
    private static final Pattern REGISTERNUMMER_LABELED = Pattern.compile(
        "Nummer\\s+der\\s+Firma\\s*:\\s*(HR[AB])\\s*(\\d{1,7})", FLAGS);
    private static final Pattern HANDELSREGISTER_COURT = Pattern.compile(
        "Handelsregister\\s+([AB])\\s+des\\s+Amtsgerichts\\s+([\\p{L}\\-]+(?:\\s*\\([\\p{L}\\-\\s]+\\))?)");
    private static final Pattern AMTSGERICHT = Pattern.compile("\\bAmtsgericht\\s+([\\p{L}\\-]+)");
    private static final Pattern GESCHAEFTSANSCHRIFT = Pattern.compile(
        "Geschäftsanschrift\\s*:\\s*(.+?)(?=\\n\\s*[a-z]\\)|\\n\\s*\\d+\\.|\\n\\s*\\n|$)", FLAGS | Pattern.DOTALL);
    private static final Pattern GEGENSTAND = Pattern.compile(
        "Gegenstand\\s+des\\s+Unternehmens\\s*:\\s*(.+?)(?=\\n\\s*\\d+\\.|\\n\\s*\\n|$)", FLAGS | Pattern.DOTALL);
    private static final Pattern GESCHAEFTSFUEHRER = Pattern.compile(
        "Geschäftsführer(?:in|innen)?\\s*:\\s*([^\\n]+)", FLAGS);
    private static final Pattern BIRTH_DATE_SUFFIX = Pattern.compile(",?\\s*\\*\\s*\\d{2}\\.\\d{2}\\.\\d{4}.*$");
    private static final Pattern PARAGRAPH_34C = Pattern.compile("§\\s*34\\s*c\\s*(?:der\\s+)?GewO", FLAGS);
    private static final Pattern EMPLOYEES_AFTER = Pattern.compile(
        "(\\d[\\d.]*)\\s*(?:Mitarbeiter(?:innen)?|Beschäftigte|Arbeitnehmer(?:innen)?|employees)\\b", FLAGS);
    // an optional fiscal year label such as "2023:" may sit between label and number
    private static final String YEAR_LABEL = "(?:(?:19|20)\\d{2}\\s*[:)]\\s*[^\\d\\n]{0,10}?)?";
    private static final Pattern EMPLOYEES_BEFORE = Pattern.compile(
        "(?:Mitarbeiter(?:zahl)?|Beschäftigte|Arbeitnehmer)[^\\d\\n]{0,40}?" + YEAR_LABEL + "(\\d[\\d.]*)", FLAGS);
    private static final String AMOUNT = "[^\\d\\n]{0,60}?" + YEAR_LABEL
        + "(-?\\d[\\d.,]*\\d|\\d)\\s*(Mio\\.?|Millionen|Mrd\\.?|Tsd\\.?|TEUR|T€)?";
    // "Umsatzsteuer" is VAT, not revenue
    private static final Pattern UMSATZ = Pattern.compile(
        "(?:Umsatzerlöse|Umsätze|Umsatz(?!-?steuer)|Revenue)" + AMOUNT, FLAGS);
    private static final Pattern GEWINN = Pattern.compile(
        "(?:Jahresüberschuss|Jahresergebnis|Gewinn|Net income)" + AMOUNT, FLAGS);
    private static final Pattern VERLUST = Pattern.compile("(?:Jahresfehlbetrag|Verlust)" + AMOUNT, FLAGS);
    private static final Pattern IMMOBILIEN_COUNT = Pattern.compile(
        "(\\d{1,5})\\s+(?:Immobilien|Grundstücke|Objekte)\\b", FLAGS);
    private static final Pattern IMMOBILIEN_VALUE = Pattern.compile(
        "(?:Immobilienvermögen|Grundstücke\\s+und\\s+Bauten|Gesamtwert\\s+(?:der\\s+)?Immobilien)" + AMOUNT, FLAGS);
    private static final Pattern INSOLVENCY = Pattern.compile(
        "Insolvenzverfahren|Insolvenzantrag|Insolvenz\\s+eröffnet|in\\s+Liquidation|\\bi\\.\\s?L\\.", FLAGS);
    private static final Pattern PHONE = Pattern.compile(
        "(?:Telefon|Tel\\.|Phone)\\s*:?\\s*(\\+?\\d[\\d\\s/().-]{5,}\\d)", FLAGS);
    private static final Pattern EMAIL = Pattern.compile(
        "(?:E-?Mail)\\s*:?\\s*([\\w.%+-]+@[\\w.-]+\\.[A-Za-z]{2,})", FLAGS);
    private static final Pattern FOUNDED = Pattern.compile(
        "(?:Gründungsdatum|Gegründet(?:\\s+am)?|Gründung|Founded)\\s*:?\\s*(\\d{1,2}\\.\\d{1,2}\\.\\d{4}|\\d{4}-\\d{2}-\\d{2}|\\d{4})",
        FLAGS);
    private static final Pattern AKTIV_SEIT = Pattern.compile("aktiv\\s+seit\\s*:?\\s*(\\d{4})", FLAGS);
    private static final Pattern GERMAN_DATE = Pattern.compile("(\\d{1,2})\\.(\\d{1,2})\\.(\\d{4})");
    private static final Pattern LEI = Pattern.compile("\\bLEI\\b[:\\s]*([A-Z0-9]{18}\\d{2})\\b");
    private static final Pattern TRADEMARK = Pattern.compile(
        "(Wort-?/Bildmarke|Wortmarke|Bildmarke)\\s*:?\\s*[\"„“']([^\"“”']+)[\"“”']");
    private static final Pattern FIRST_NUMBER = Pattern.compile("\\d[\\d.,]*");

    private GermanTextPatterns() {
    }

    /** Parses German formatted numbers such as {@code 11.100.000,00}; plain {@code 1200000} works too. */
    public static BigDecimal parseGermanNumber(String raw) {
        if (raw == null) {
            return null;
        }
        String cleaned = raw.replaceAll("[^\\d,.\\-]", "").replaceAll("[.,]+$", "");
        if (cleaned.isEmpty() || "-".equals(cleaned)) {
            return null;
        }
        if (cleaned.contains(",")) {
            cleaned = cleaned.replace(".", "").replace(',', '.');
        } else if (cleaned.indexOf('.') != cleaned.lastIndexOf('.') || THOUSANDS_ONLY.matcher(cleaned).matches()) {
            cleaned = cleaned.replace(".", "");
        }
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static String ustIdnr(String text) {
        Matcher matcher = matcher(UST_IDNR, text);
        return matcher != null && matcher.find() ? "DE" + matcher.group(1) : null;
    }

    public static String registernummer(String text) {
        Matcher labeled = matcher(REGISTERNUMMER_LABELED, text);
        if (labeled != null && labeled.find()) {
            return labeled.group(1).toUpperCase(Locale.ROOT) + labeled.group(2);
        }
        Matcher matcher = matcher(REGISTERNUMMER, text);
        if (matcher == null || !matcher.find()) {
            return null;
        }
        String suffix = matcher.group(3) == null ? "" : matcher.group(3);
        return matcher.group(1) + matcher.group(2) + suffix;
    }

    /** Court city of the register, e.g. {@code Hamburg} for "Handelsregister B des Amtsgerichts Hamburg". */
    public static String registerCourt(String text) {
        Matcher matcher = matcher(HANDELSREGISTER_COURT, text);
        if (matcher != null && matcher.find()) {
            return collapse(matcher.group(2));
        }
        Matcher amtsgericht = matcher(AMTSGERICHT, text);
        return amtsgericht != null && amtsgericht.find() ? amtsgericht.group(1) : null;
    }

    public static String geschaeftsanschrift(String text) {
        return firstGroup(GESCHAEFTSANSCHRIFT, text);
    }

    public static String gegenstand(String text) {
        return firstGroup(GEGENSTAND, text);
    }

    public static List<String> geschaeftsfuehrer(String text) {
        List<String> names = new ArrayList<>();
        Matcher matcher = matcher(GESCHAEFTSFUEHRER, text);
        if (matcher == null) {
            return names;
        }
        while (matcher.find()) {
            for (String part : matcher.group(1).split(";")) {
                String name = BIRTH_DATE_SUFFIX.matcher(part.trim()).replaceAll("").trim();
                if (!name.isEmpty() && !names.contains(name)) {
                    names.add(name);
                }
            }
        }
        return names;
    }

    public static boolean mentionsParagraph34c(String text) {
        Matcher matcher = matcher(PARAGRAPH_34C, text);
        return matcher != null && matcher.find();
    }

    public static boolean mentionsInsolvency(String text) {
        Matcher matcher = matcher(INSOLVENCY, text);
        return matcher != null && matcher.find();
    }

    public static Integer employees(String text) {
        BigDecimal value = numberGroup(EMPLOYEES_AFTER, text);
        if (value == null) {
            value = numberGroup(EMPLOYEES_BEFORE, text);
        }
        return count(value);
    }

    public static BigDecimal umsatz(String text) {
        return amount(UMSATZ, text);
    }

    /** Jahresüberschuss as a positive amount, Jahresfehlbetrag as a negative one. */
    public static BigDecimal gewinn(String text) {
        BigDecimal profit = amount(GEWINN, text);
        if (profit != null) {
            return profit;
        }
        BigDecimal loss = amount(VERLUST, text);
        return loss == null ? null : loss.abs().negate();
    }

    public static Integer anzahlImmobilien(String text) {
        return count(numberGroup(IMMOBILIEN_COUNT, text));
    }

    public static BigDecimal gesamtwertImmobilien(String text) {
        return amount(IMMOBILIEN_VALUE, text);
    }

    public static String telefon(String text) {
        String value = firstGroup(PHONE, text);
        return value == null ? null : value.replaceAll("\\s{2,}", " ");
    }

    public static String email(String text) {
        return firstGroup(EMAIL, text);
    }

    public static String gruendungsdatum(String text) {
        return isoDate(firstGroup(FOUNDED, text));
    }

    public static String aktivSeit(String text) {
        return firstGroup(AKTIV_SEIT, text);
    }

    public static List<String> sonstigeRechte(String text) {
        List<String> rights = new ArrayList<>();
        Matcher lei = matcher(LEI, text);
        if (lei != null && lei.find()) {
            rights.add("LEI: " + lei.group(1));
        }
        Matcher trademark = matcher(TRADEMARK, text);
        while (trademark != null && trademark.find()) {
            String entry = "Marke: " + trademark.group(2).trim();
            if (!rights.contains(entry)) {
                rights.add(entry);
            }
        }
        return rights;
    }

    /** Converts {@code 01.03.2015} to {@code 2015-03-01}; ISO dates and bare years pass through. */
    public static String isoDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        Matcher matcher = GERMAN_DATE.matcher(trimmed);
        if (matcher.matches()) {
            return String.format(
                Locale.ROOT,
                "%s-%02d-%02d",
                matcher.group(3),
                Integer.parseInt(matcher.group(2)),
                Integer.parseInt(matcher.group(1))
            );
        }
        return trimmed;
    }

    /** Largest number in a range such as "11-50 employees" or "10.001+ Beschäftigte". */
    public static Integer maxNumber(String text) {
        if (text == null) {
            return null;
        }
        Integer max = null;
        Matcher matcher = FIRST_NUMBER.matcher(text);
        while (matcher.find()) {
            Integer value = count(parseGermanNumber(matcher.group()));
            if (value != null && (max == null || value > max)) {
                max = value;
            }
        }
        return max;
    }

    private static BigDecimal amount(Pattern pattern, String text) {
        Matcher matcher = matcher(pattern, text);
        if (matcher == null || !matcher.find()) {
            return null;
        }
        BigDecimal value = parseGermanNumber(matcher.group(1));
        if (value == null) {
            return null;
        }
        String unit = matcher.group(2) == null ? "" : matcher.group(2).toLowerCase(Locale.ROOT);
        if (unit.startsWith("mio") || unit.startsWith("millionen")) {
            value = value.multiply(BigDecimal.valueOf(1_000_000L));
        } else if (unit.startsWith("mrd")) {
            value = value.multiply(BigDecimal.valueOf(1_000_000_000L));
        } else if (unit.startsWith("tsd") || unit.equals("teur") || unit.equals("t€")) {
            value = value.multiply(BigDecimal.valueOf(1_000L));
        }
        BigDecimal stripped = value.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }

    // null for fractions and values beyond int range
    private static Integer count(BigDecimal value) {
        if (value == null) {
            return null;
        }
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }

    private static BigDecimal numberGroup(Pattern pattern, String text) {
        Matcher matcher = matcher(pattern, text);
        return matcher != null && matcher.find() ? parseGermanNumber(matcher.group(1)) : null;
    }

    private static String firstGroup(Pattern pattern, String text) {
        Matcher matcher = matcher(pattern, text);
        return matcher != null && matcher.find() ? collapse(matcher.group(1)) : null;
    }

    private static Matcher matcher(Pattern pattern, String text) {
        return text == null || text.isBlank() ? null : pattern.matcher(text);
    }

    private static String collapse(String value) {
        if (value == null) {
            return null;
        }
        String collapsed = value.trim().replaceAll("\\s+", " ");
        return collapsed.isEmpty() ? null : collapsed;
    }
}
