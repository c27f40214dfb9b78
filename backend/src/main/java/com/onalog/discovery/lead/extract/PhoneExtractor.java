package com.onalog.discovery.lead.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class PhoneExtractor {
    private static final Pattern CONTACT_PHONE = Pattern.compile(
        "(?:phone|tel|telephone|call us|call|mobile|cell|whatsapp|fax|contact)\\s*[:.]?\\s*(\\+?\\(?\\d[\\d\\s().-]{7,20}\\d)",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern GENERAL_PHONE = Pattern.compile("(\\+\\d[\\d\\s().-]{8,20}\\d|\\(?\\d{3}\\)?[\\s.-]\\d{3}[\\s.-]\\d{4})");
    private static final Pattern SAME_DIGIT = Pattern.compile("^(\\d)\\1{8,}$");
    private static final Pattern ALL_ZERO = Pattern.compile("^0+$");
    private static final Pattern LEADING_ZERO_RUN = Pattern.compile("^0\\d{9,}$");
    private static final Pattern ROUND_NUMBER = Pattern.compile("^[1-9]0{8,}$");
    private static final double TEL_LINK_CONFIDENCE = 0.9;
    private static final double CONTACT_CONFIDENCE = 0.75;
    private static final double TEXT_CONFIDENCE = 0.6;
    private static final int MAX_PHONES = 3;

    private PhoneExtractor() {
    }

    /**
     * {@code tel:} links outrank numbers found near contact words, which outrank any other number in the text.
     */
    public static List<String> extract(Document document) {
        if (document == null) {
            return List.of();
        }
        Map<String, PhoneCandidate> byDigits = new LinkedHashMap<>();
        for (Element anchor : document.select("a[href^=tel:]")) {
            offer(byDigits, anchor.attr("href").substring("tel:".length()), TEL_LINK_CONFIDENCE);
        }
        String text = document.text();
        Matcher contact = CONTACT_PHONE.matcher(text);
        while (contact.find()) {
            offer(byDigits, contact.group(1), CONTACT_CONFIDENCE);
        }
        Matcher general = GENERAL_PHONE.matcher(text);
        while (general.find()) {
            offer(byDigits, general.group(1), TEXT_CONFIDENCE);
        }
        return byDigits.values().stream()
            .sorted(Comparator.comparingDouble(PhoneCandidate::confidence).reversed())
            .limit(MAX_PHONES)
            .map(PhoneCandidate::number)
            .toList();
    }

    public static boolean isPlausible(String raw) {
        String digits = digitsOf(raw);
        if (digits.length() < 10 || digits.length() > 15) {
            return false;
        }
        return !SAME_DIGIT.matcher(digits).matches()
            && !ALL_ZERO.matcher(digits).matches()
            && !LEADING_ZERO_RUN.matcher(digits).matches()
            && !ROUND_NUMBER.matcher(digits).matches();
    }

    static String digitsOf(String raw) {
        return raw == null ? "" : raw.replaceAll("\\D", "");
    }

    private static void offer(Map<String, PhoneCandidate> byDigits, String raw, double confidence) {
        if (!isPlausible(raw)) {
            return;
        }
        String digits = digitsOf(raw);
        String display = raw.trim().startsWith("+") ? "+" + digits : digits;
        PhoneCandidate existing = byDigits.get(digits);
        if (existing == null || existing.confidence() < confidence) {
            byDigits.put(digits, new PhoneCandidate(display, confidence));
        }
    }

    private record PhoneCandidate(String number, double confidence) {
    }
}
