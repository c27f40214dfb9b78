package com.onalog.discovery.lead.search;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

public final class CountryNames {
    private static final Map<String, String> NAMES = Map.ofEntries(
        Map.entry("ng", "Nigeria"), Map.entry("za", "South Africa"), Map.entry("ke", "Kenya"),
        Map.entry("gh", "Ghana"), Map.entry("ug", "Uganda"), Map.entry("tz", "Tanzania"),
        Map.entry("et", "Ethiopia"), Map.entry("eg", "Egypt"), Map.entry("zm", "Zambia"),
        Map.entry("zw", "Zimbabwe"), Map.entry("rw", "Rwanda"), Map.entry("sn", "Senegal"),
        Map.entry("ci", "Ivory Coast"), Map.entry("cm", "Cameroon"), Map.entry("ao", "Angola"),
        Map.entry("ma", "Morocco"), Map.entry("tn", "Tunisia"), Map.entry("dz", "Algeria"),
        Map.entry("mg", "Madagascar"), Map.entry("mw", "Malawi"), Map.entry("mz", "Mozambique"),
        Map.entry("us", "United States"), Map.entry("ca", "Canada"), Map.entry("mx", "Mexico"),
        Map.entry("gb", "United Kingdom"), Map.entry("de", "Germany"), Map.entry("fr", "France"),
        Map.entry("it", "Italy"), Map.entry("es", "Spain"), Map.entry("nl", "Netherlands"),
        Map.entry("be", "Belgium"), Map.entry("ch", "Switzerland"), Map.entry("at", "Austria"),
        Map.entry("se", "Sweden"), Map.entry("no", "Norway"), Map.entry("dk", "Denmark"),
        Map.entry("pl", "Poland"), Map.entry("ie", "Ireland"), Map.entry("pt", "Portugal"),
        Map.entry("in", "India"), Map.entry("cn", "China"), Map.entry("jp", "Japan"),
        Map.entry("kr", "South Korea"), Map.entry("sg", "Singapore"), Map.entry("my", "Malaysia"),
        Map.entry("th", "Thailand"), Map.entry("id", "Indonesia"), Map.entry("ph", "Philippines"),
        Map.entry("vn", "Vietnam"), Map.entry("ae", "United Arab Emirates"), Map.entry("sa", "Saudi Arabia"),
        Map.entry("il", "Israel"), Map.entry("pk", "Pakistan"), Map.entry("bd", "Bangladesh"),
        Map.entry("au", "Australia"), Map.entry("nz", "New Zealand"), Map.entry("br", "Brazil"),
        Map.entry("ar", "Argentina"), Map.entry("co", "Colombia"), Map.entry("cl", "Chile"),
        Map.entry("pe", "Peru"), Map.entry("ve", "Venezuela"), Map.entry("ec", "Ecuador"),
        Map.entry("uy", "Uruguay"), Map.entry("py", "Paraguay"), Map.entry("bo", "Bolivia")
    );
    private static final Set<String> SPANISH = Set.of(
        "es", "mx", "ar", "co", "cl", "pe", "ve", "ec", "uy", "py", "bo", "gt", "cr", "pa", "do", "cu", "hn", "sv", "ni"
    );
    private static final Set<String> PORTUGUESE = Set.of("pt", "br", "ao", "mz");

    private CountryNames() {
    }

    /**
     * English country name for an ISO code; unknown codes are returned as given, blank as null.
     */
    public static String nameOf(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        String key = code.trim().toLowerCase(Locale.ROOT);
        return NAMES.getOrDefault(key, code.trim());
    }

    public static String localeOf(String code) {
        if (code == null || code.isBlank()) {
            return "en";
        }
        String key = code.trim().toLowerCase(Locale.ROOT);
        if (PORTUGUESE.contains(key)) {
            return "pt";
        }
        if (SPANISH.contains(key)) {
            return "es";
        }
        if (key.equals("fr")) {
            return "fr";
        }
        if (key.equals("it")) {
            return "it";
        }
        return "en";
    }
}
