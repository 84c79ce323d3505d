package com.crewflow.crewflow_backend.guardrail;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls distinct company names out of free text.
 * <ul>
 *   <li>list lines ({@code 1.}, {@code 2)}, {@code -}, {@code *}, {@code •}): the item text up to the first separator</li>
 *   <li>lines carrying a Swiss UID ({@code CHE-123.456.789}): the text in front of the UID</li>
 *   <li>other lines: names ending in a legal-form suffix (AG, GmbH, Inc...)</li>
 *   <li>anywhere: a small set of well-known Swiss companies</li>
 * </ul>
 * Names compare case-insensitively; first spelling wins.
 */
final class CompanyNameExtractor {

    private static final Pattern LIST_MARKER = Pattern.compile("^\\s*(?:\\d+[.)]|[-*•])\\s+(.+)$");
    private static final Pattern ITEM_SEPARATOR = Pattern.compile("\\s[-–]\\s|[:(,]");
    private static final Pattern CHE_UID = Pattern.compile("CHE[-\\s]?\\d{3}\\.\\d{3}\\.\\d{3}");
    private static final Pattern LEGAL_FORM = Pattern.compile(
            "\\b([A-Z][\\p{L}0-9&'.-]*(?:\\s+(?:&|[A-Z][\\p{L}0-9&'.-]*)){0,4})\\s+"
                    + "(AG|GmbH|SA|Sàrl|SARL|Inc|Corp|Corporation|LLC|Ltd|Limited|Group|Holdings?)\\b");

    private static final List<String> KNOWN_COMPANIES = List.of(
            "Nestlé", "Novartis", "Roche", "UBS", "ABB", "Swisscom", "Zurich Insurance",
            "Swiss Re", "Logitech", "Lonza", "Givaudan", "Holcim", "Syngenta", "Schindler");

    private static final Set<String> STOPWORDS = Set.of(
            "company", "companies", "name", "names", "list", "total", "the", "and",
            "here", "note", "summary", "results", "result");

    private CompanyNameExtractor() {
    }

    static List<String> extract(String text) {
        Map<String, String> names = new LinkedHashMap<>();
        if (text == null || text.isBlank()) return List.of();

        for (String line : text.split("\\R")) {
            Matcher item = LIST_MARKER.matcher(line);
            Matcher uid = CHE_UID.matcher(line);
            if (item.matches()) {
                add(names, head(stripMarkdown(item.group(1))));
            } else if (uid.find()) {
                add(names, head(stripMarkdown(line.substring(0, uid.start()))));
            } else {
                Matcher legal = LEGAL_FORM.matcher(line);
                while (legal.find()) {
                    add(names, legal.group(1) + " " + legal.group(2));
                }
            }
        }

        String lower = text.toLowerCase(Locale.ROOT);
        for (String known : KNOWN_COMPANIES) {
            String key = known.toLowerCase(Locale.ROOT);
            Pattern standalone = Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(key) + "(?![\\p{L}\\p{N}])");
            if (!standalone.matcher(lower).find()) continue;
            boolean covered = names.keySet().stream().anyMatch(n -> n.contains(key));
            if (!covered) add(names, known);
        }
        return new ArrayList<>(names.values());
    }

    private static String head(String itemText) {
        Matcher sep = ITEM_SEPARATOR.matcher(itemText);
        String name = sep.find() ? itemText.substring(0, sep.start()) : itemText;
        return name.replaceAll("[\\s\\-–:.,;]+$", "").trim();
    }

    private static String stripMarkdown(String s) {
        return s.replace("**", "").replace("__", "").replace("`", "").trim();
    }

    private static void add(Map<String, String> names, String candidate) {
        String name = candidate.trim();
        if (name.length() < 3) return;
        String key = name.toLowerCase(Locale.ROOT);
        if (STOPWORDS.contains(key)) return;
        names.putIfAbsent(key, name);
    }
}
