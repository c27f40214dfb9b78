package com.onalog.discovery.lead.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.onalog.discovery.lead.model.DecisionMaker;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds named executives on a page from team cards, "Name - Title" lines and schema.org Person/Organization data.
 */
@Component
public class DecisionMakerExtractor {
    static final String TEAM_SELECTORS =
        ".team-member, .member, .leadership, .executive, .profile, .person, .board-member, .management, .staff, .director";
    private static final Pattern PERSON_NAME = Pattern.compile(
        "^(?:(?:Dr|Mr|Mrs|Ms|Prof)\\.?\\s+)?\\p{Lu}[\\p{L}'-]+(?:\\s+\\p{Lu}[\\p{L}'-]+){1,3}$"
    );
    private static final Pattern NAME_DASH_TITLE = Pattern.compile(
        "^((?:(?:Dr|Mr|Mrs|Ms|Prof)\\.?\\s+)?\\p{Lu}[\\p{L}'-]+(?:\\s+\\p{Lu}[\\p{L}'-]+){1,3})\\s*[,|:\\-–—]\\s*(.{2,80})$"
    );
    private static final Pattern EXECUTIVE_TITLE = Pattern.compile(
        "\\b(ceo|cto|cfo|coo|cmo|cio|chief|founder|co-founder|cofounder|owner|president|vice president|vp|"
            + "director|managing|partner|head|general manager|manager|chair|chairman|chairwoman|chairperson|"
            + "executive|principal|proprietor|administrator|dean|superintendent|"
            + "diretor|directora|gerente|fundador|fundadora|presidente|socio|sócio|propietario|directeur|gérant)\\b",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
    );
    private static final Set<String> NON_NAME_WORDS = Set.of(
        "about", "contact", "our", "meet", "the", "read", "view", "learn", "more", "home", "menu", "team",
        "leadership", "services", "products", "news", "careers", "join", "welcome", "privacy", "terms", "board"
    );
    private static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");

    private final JsonLdReader jsonLdReader;

    public DecisionMakerExtractor(JsonLdReader jsonLdReader) {
        this.jsonLdReader = jsonLdReader;
    }

    public List<DecisionMaker> extract(Document document) {
        Map<String, DecisionMaker> byName = new LinkedHashMap<>();
        if (document == null) {
            return List.of();
        }
        fromTeamCards(document, byName);
        fromNameTitleLines(document, byName);
        fromStructuredData(document, byName);
        return List.copyOf(byName.values());
    }

    /**
     * Adds {@code additions} to {@code base} keyed by lower-cased name until {@code max} entries are held.
     */
    public static List<DecisionMaker> merge(Collection<DecisionMaker> base, Collection<DecisionMaker> additions, int max) {
        Map<String, DecisionMaker> byName = new LinkedHashMap<>();
        for (DecisionMaker existing : base) {
            byName.putIfAbsent(key(existing.name()), existing);
        }
        for (DecisionMaker candidate : additions) {
            if (byName.size() >= max) {
                break;
            }
            String key = key(candidate.name());
            DecisionMaker existing = byName.get(key);
            if (existing == null) {
                byName.put(key, candidate);
            } else if (!existing.hasEmail() && candidate.hasEmail()) {
                byName.put(key, new DecisionMaker(
                    existing.name(),
                    existing.title(),
                    candidate.email(),
                    existing.source(),
                    Math.max(existing.confidence(), candidate.confidence())
                ));
            }
        }
        List<DecisionMaker> merged = new ArrayList<>(byName.values());
        return merged.size() > max ? List.copyOf(merged.subList(0, max)) : List.copyOf(merged);
    }

    static boolean isExecutiveTitle(String title) {
        return title != null && EXECUTIVE_TITLE.matcher(title).find();
    }

    static boolean isPersonName(String name) {
        if (name == null) {
            return false;
        }
        String trimmed = name.trim();
        if (trimmed.length() < 4 || trimmed.length() > 50 || trimmed.contains("@")) {
            return false;
        }
        if (!PERSON_NAME.matcher(trimmed).matches()) {
            return false;
        }
        String firstWord = trimmed.split("\\s+")[0].toLowerCase(Locale.ROOT);
        return !NON_NAME_WORDS.contains(firstWord);
    }

    private void fromTeamCards(Document document, Map<String, DecisionMaker> byName) {
        for (Element card : document.select(TEAM_SELECTORS)) {
            Element nameElement = card.selectFirst("h2, h3, .name");
            Element titleElement = card.selectFirst("h4, .title, .role, .position");
            if (nameElement == null || titleElement == null) {
                continue;
            }
            String name = nameElement.text().trim();
            String title = titleElement.text().trim();
            if (!isPersonName(name) || !isExecutiveTitle(title)) {
                continue;
            }
            Element mailto = card.selectFirst("a[href^=mailto:]");
            String email = mailto == null ? null : mailto.attr("href").substring("mailto:".length()).trim();
            put(byName, new DecisionMaker(name, title, blankToNull(email), "website", 0.85));
        }
    }

    private void fromNameTitleLines(Document document, Map<String, DecisionMaker> byName) {
        for (Element element : document.select("h1, h2, h3, h4, h5, p, li")) {
            String text = element.ownText().isBlank() ? element.text() : element.ownText();
            if (text.length() > 140) {
                continue;
            }
            Matcher matcher = NAME_DASH_TITLE.matcher(text.trim());
            if (!matcher.matches()) {
                continue;
            }
            String name = matcher.group(1).trim();
            String remainder = matcher.group(2).trim();
            String email = null;
            Matcher emailMatcher = EMAIL.matcher(remainder);
            if (emailMatcher.find()) {
                email = emailMatcher.group().toLowerCase(Locale.ROOT);
                remainder = remainder.replace(emailMatcher.group(), "").replaceAll("[,|\\s]+$", "").trim();
            }
            if (!isPersonName(name) || !isExecutiveTitle(remainder)) {
                continue;
            }
            put(byName, new DecisionMaker(name, remainder, email, "website", email == null ? 0.75 : 0.9));
        }
    }

    private void fromStructuredData(Document document, Map<String, DecisionMaker> byName) {
        for (JsonNode node : jsonLdReader.read(document)) {
            if (JsonLdReader.hasType(node, "Person")) {
                addPerson(node, "Team Member", 0.85, byName);
            }
            if (JsonLdReader.isBusinessEntity(node)) {
                for (JsonNode founder : asList(node.get("founder"))) {
                    addPerson(founder, "Founder", 0.9, byName);
                }
                for (JsonNode employee : asList(node.get("employee"))) {
                    addPerson(employee, "Team Member", 0.8, byName);
                }
            }
        }
    }

    private void addPerson(JsonNode person, String defaultTitle, double confidence, Map<String, DecisionMaker> byName) {
        String name = person.isTextual() ? person.asText().trim() : JsonLdReader.text(person, "name");
        if (name == null || name.length() < 3 || name.length() > 80) {
            return;
        }
        String title = person.isObject() ? JsonLdReader.text(person, "jobTitle") : null;
        String email = person.isObject() ? JsonLdReader.text(person, "email") : null;
        if (email != null && email.toLowerCase(Locale.ROOT).startsWith("mailto:")) {
            email = email.substring("mailto:".length());
        }
        put(byName, new DecisionMaker(
            name,
            title == null ? defaultTitle : title,
            blankToNull(email),
            "structured_data",
            confidence
        ));
    }

    private static List<JsonNode> asList(JsonNode node) {
        List<JsonNode> result = new ArrayList<>();
        if (node == null || node.isNull()) {
            return result;
        }
        if (node.isArray()) {
            node.forEach(result::add);
        } else {
            result.add(node);
        }
        return result;
    }

    private static void put(Map<String, DecisionMaker> byName, DecisionMaker candidate) {
        byName.putIfAbsent(key(candidate.name()), candidate);
    }

    private static String key(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
