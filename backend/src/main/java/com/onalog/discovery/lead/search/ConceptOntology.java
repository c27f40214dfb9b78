package com.onalog.discovery.lead.search;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A small multilingual vocabulary for the business types that most often return zero results under their
 * literal name. Matching runs on accent-stripped, lower-cased text.
 */
public final class ConceptOntology {
    public record Concept(
        String id,
        List<String> triggers,
        Map<String, List<String>> labels,
        Map<String, List<String>> plurals
    ) {
        public List<String> labelsFor(String locale) {
            return labels.getOrDefault(locale, labels.get("en"));
        }

        public List<String> pluralsFor(String locale) {
            return plurals.getOrDefault(locale, plurals.get("en"));
        }
    }

    static final List<Concept> CONCEPTS = List.of(
        new Concept(
            "Cafe",
            List.of("cafe", "coffee", "cafeteria", "caffe", "coffeeshop"),
            Map.of(
                "en", List.of("cafe", "coffee shop"),
                "pt", List.of("café", "cafeteria"),
                "es", List.of("cafetería", "café"),
                "fr", List.of("café", "salon de thé"),
                "it", List.of("caffè", "bar caffetteria")
            ),
            Map.of(
                "en", List.of("cafes", "coffee shops"),
                "pt", List.of("cafés", "cafeterias"),
                "es", List.of("cafeterías", "cafés"),
                "fr", List.of("cafés"),
                "it", List.of("caffetterie")
            )
        ),
        new Concept(
            "RealEstateAgency",
            List.of("real estate", "estate agent", "realtor", "imobiliaria", "inmobiliaria", "immobiliere",
                "immobiliare", "property agent"),
            Map.of(
                "en", List.of("real estate agency", "estate agent"),
                "pt", List.of("imobiliária", "agência imobiliária"),
                "es", List.of("inmobiliaria", "agencia inmobiliaria"),
                "fr", List.of("agence immobilière"),
                "it", List.of("agenzia immobiliare")
            ),
            Map.of(
                "en", List.of("real estate agencies", "estate agents"),
                "pt", List.of("imobiliárias"),
                "es", List.of("inmobiliarias"),
                "fr", List.of("agences immobilières"),
                "it", List.of("agenzie immobiliari")
            )
        ),
        new Concept(
            "GelatoIceCream",
            List.of("gelato", "gelateria", "ice cream", "ice-cream", "sorveteria", "heladeria", "glacier", "gelataria"),
            Map.of(
                "en", List.of("ice cream shop", "gelato"),
                "pt", List.of("sorveteria", "gelataria"),
                "es", List.of("heladería"),
                "fr", List.of("glacier"),
                "it", List.of("gelateria")
            ),
            Map.of(
                "en", List.of("ice cream shops"),
                "pt", List.of("sorveterias", "gelatarias"),
                "es", List.of("heladerías"),
                "fr", List.of("glaciers"),
                "it", List.of("gelaterie")
            )
        ),
        new Concept(
            "Bank",
            List.of("bank", "banco", "banque", "banca"),
            Map.of(
                "en", List.of("bank"),
                "pt", List.of("banco"),
                "es", List.of("banco"),
                "fr", List.of("banque"),
                "it", List.of("banca")
            ),
            Map.of(
                "en", List.of("banks"),
                "pt", List.of("bancos"),
                "es", List.of("bancos"),
                "fr", List.of("banques"),
                "it", List.of("banche")
            )
        ),
        new Concept(
            "Hospital",
            List.of("hospital", "hopital", "ospedale", "clinic", "clinica"),
            Map.of(
                "en", List.of("hospital"),
                "pt", List.of("hospital"),
                "es", List.of("hospital"),
                "fr", List.of("hôpital"),
                "it", List.of("ospedale")
            ),
            Map.of(
                "en", List.of("hospitals"),
                "pt", List.of("hospitais"),
                "es", List.of("hospitales"),
                "fr", List.of("hôpitaux"),
                "it", List.of("ospedali")
            )
        )
    );

    private ConceptOntology() {
    }

    public static List<Concept> match(String query) {
        String folded = fold(query);
        List<Concept> matched = new ArrayList<>();
        for (Concept concept : CONCEPTS) {
            for (String trigger : concept.triggers()) {
                if (folded.contains(trigger)) {
                    matched.add(concept);
                    break;
                }
            }
        }
        return matched;
    }

    /**
     * Lower-cases and removes diacritics: {@code "Imobiliária"} becomes {@code "imobiliaria"}.
     */
    public static String fold(String text) {
        if (text == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        return decomposed.replaceAll("\\p{M}+", "").toLowerCase(Locale.ROOT).trim();
    }
}
